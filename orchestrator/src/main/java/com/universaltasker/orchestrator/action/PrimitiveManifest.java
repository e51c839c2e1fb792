package com.universaltasker.orchestrator.action;

/**
 * Identity and documentation of one primitive.
 *
 * @param kind        Which vocabulary entry this primitive implements.
 * @param signature   Call form shown to the reasoning engine, e.g. "move(x, y)".
 * @param description One-sentence docstring injected verbatim into prompts.
 */
public record PrimitiveManifest(
        PrimitiveKind kind,
        String        signature,
        String        description) {}
