package com.universaltasker.orchestrator;

import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.StepOutcome;
import com.universaltasker.orchestrator.model.StepRecord;

import java.util.UUID;

/**
 * Entities as they look after the store assigned their ids.
 */
public final class TestSessions {

    private TestSessions() {}

    public static Session session(String goal, int budget) {
        Session session = new Session(goal, budget, null);
        setId(session, UUID.randomUUID());
        return session;
    }

    public static StepRecord step(Session session, int number, String thought, String instruction,
                                  StepOutcome outcome, String failureDetail) {
        StepRecord record = new StepRecord(session, number);
        record.setThought(thought);
        record.setInstruction(instruction);
        if (outcome == StepOutcome.FAIL) {
            record.fail(failureDetail);
        }
        return record;
    }

    public static void setId(Object entity, UUID id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
