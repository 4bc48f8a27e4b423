package com.rekindle.rex.core.testing;

import com.rekindle.rex.core.llm.Reasoner;
import com.rekindle.rex.core.llm.ReasonerException;
import com.rekindle.rex.core.llm.ReasonerRequest;
import com.rekindle.rex.core.llm.ReasonerResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deterministic {@link Reasoner} test double.
 */
public class ScriptedReasoner implements Reasoner {

    private enum Mode { ANSWER, FAIL, HANG }

    private final Mode mode;
    private final ReasonerResult answer;
    private final List<ReasonerRequest> requests = new CopyOnWriteArrayList<>();

    private ScriptedReasoner(Mode mode, ReasonerResult answer) {
        this.mode = mode;
        this.answer = answer;
    }

    public static ScriptedReasoner answering(String decision, Double confidence) {
        return new ScriptedReasoner(Mode.ANSWER, new ReasonerResult(decision, confidence));
    }

    public static ScriptedReasoner failing() {
        return new ScriptedReasoner(Mode.FAIL, null);
    }

    /** Never answers; blocks until interrupted. */
    public static ScriptedReasoner hanging() {
        return new ScriptedReasoner(Mode.HANG, null);
    }

    @Override
    public ReasonerResult resolve(ReasonerRequest request) throws ReasonerException {
        requests.add(request);
        switch (mode) {
            case FAIL -> throw new ReasonerException("provider returned 503");
            case HANG -> {
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new ReasonerException("interrupted");
            }
            default -> {
                return answer;
            }
        }
    }

    public int calls() {
        return requests.size();
    }

    public List<ReasonerRequest> requests() {
        return requests;
    }
}
