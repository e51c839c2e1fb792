package com.universaltasker.orchestrator.action;

import java.util.List;

/**
 * One entry of the closed instruction vocabulary.
 *
 * <p>Arguments are checked by {@link #validate} for the whole instruction before
 * anything runs, so a malformed instruction never leaves the environment
 * half-driven. {@link #execute} is only called with arguments that passed
 * validation.
 */
public interface ActionPrimitive {

    PrimitiveManifest manifest();

    /** @throws ActionException BAD_ARGUMENT when the arguments do not fit the signature */
    void validate(List<String> args);

    /** @throws ActionException DEVICE_ERROR when the device refuses the action */
    void execute(List<String> args, InputDevice device);

    static int parseInt(List<String> args, int index, String what) {
        try {
            return Integer.parseInt(args.get(index).strip());
        } catch (NumberFormatException e) {
            throw new ActionException(ActionException.Kind.BAD_ARGUMENT,
                    what + " must be an integer, got '" + args.get(index) + "'");
        }
    }

    static void requireArity(List<String> args, PrimitiveManifest m, int... allowed) {
        for (int n : allowed) {
            if (args.size() == n) return;
        }
        throw new ActionException(ActionException.Kind.BAD_ARGUMENT,
                m.kind().keyword() + " takes " + describe(allowed) + " argument(s), got "
                + args.size() + "; usage: " + m.signature());
    }

    private static String describe(int[] allowed) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < allowed.length; i++) {
            if (i > 0) sb.append(i == allowed.length - 1 ? " or " : ", ");
            sb.append(allowed[i]);
        }
        return sb.toString();
    }
}
