package com.rekindle.rex.core.decision;

import com.rekindle.rex.core.decision.rules.CatchAllRule;
import com.rekindle.rex.core.decision.rules.InvalidTransitionRule;
import com.rekindle.rex.core.decision.rules.ProgressTimeoutRule;
import com.rekindle.rex.core.model.MissionEvent;
import com.rekindle.rex.core.model.MissionState;
import com.rekindle.rex.core.model.MissionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleEngineTest {

    private static final long DAY = 24 * 60;

    private final RuleEngine engine = RuleEngine.withDefaultRules(new DecisionProperties());

    private static RetryContext retry(int retryCount, int priority, String code, Boolean recoverable) {
        return new RetryContext("M-1", MissionType.LEAD_REACTIVATION, priority, retryCount, 3,
                code, "worker error", recoverable);
    }

    // -- Structure ------------------------------------------------------------

    @Test
    @DisplayName("rules run in order and end with the catch-all")
    void orderedWithCatchAll() {
        List<Rule> rules = engine.rules();
        for (int i = 1; i < rules.size(); i++) {
            assertTrue(rules.get(i - 1).order() <= rules.get(i).order());
        }
        assertInstanceOf(CatchAllRule.class, rules.get(rules.size() - 1));
    }

    @Test
    @DisplayName("a supplied catch-all is replaced by the engine's own")
    void singleCatchAll() {
        var custom = new RuleEngine(List.of(new CatchAllRule(ctx -> "X"), new InvalidTransitionRule()),
                Duration.ofMillis(50));
        assertEquals(1, custom.rules().stream().filter(r -> r instanceof CatchAllRule).count());
    }

    // -- Transitions ----------------------------------------------------------

    @Nested
    @DisplayName("mission transitions")
    class TransitionRules {

        @Test
        @DisplayName("progress timeout retries while budget remains")
        void timeoutWithBudget() {
            var outcome = engine.evaluate(
                    new TransitionContext("M-1", MissionState.RUNNING, MissionEvent.PROGRESS_TIMEOUT, 1, 3));
            assertEquals(MissionState.RETRY_PENDING.name(), outcome.value());
            assertEquals(ProgressTimeoutRule.class.getSimpleName(), outcome.rule());
            assertFalse(outcome.deferred());
        }

        @Test
        @DisplayName("progress timeout fails once the budget is spent")
        void timeoutWithoutBudget() {
            var outcome = engine.evaluate(
                    new TransitionContext("M-1", MissionState.RUNNING, MissionEvent.PROGRESS_TIMEOUT, 3, 3));
            assertEquals(MissionState.FAILED.name(), outcome.value());
        }

        @Test
        @DisplayName("transitions out of terminal states are rejected")
        void terminalRejected() {
            var outcome = engine.evaluate(
                    new TransitionContext("M-1", MissionState.COMPLETED, MissionEvent.STARTED, 0, 3));
            assertEquals(DecisionValues.REJECT, outcome.value());
            assertFalse(outcome.deferred());
        }
    }

    // -- Retries --------------------------------------------------------------

    @Nested
    @DisplayName("retry decisions")
    class RetryRules {

        @Test
        @DisplayName("exhausted budget on a high-priority mission escalates")
        void escalates() {
            assertEquals(DecisionValues.ESCALATE, engine.evaluate(retry(3, 90, "PROVIDER_5XX", true)).value());
        }

        @Test
        @DisplayName("exhausted budget on a normal mission fails")
        void failsWhenExhausted() {
            assertEquals(DecisionValues.FAIL_TERMINAL, engine.evaluate(retry(3, 40, "PROVIDER_5XX", true)).value());
        }

        @Test
        @DisplayName("unclassified error codes are matched case-insensitively")
        void classifiesByCode() {
            assertEquals(DecisionValues.FAIL_TERMINAL, engine.evaluate(retry(0, 40, "auth_error", null)).value());
            assertEquals(DecisionValues.RETRY, engine.evaluate(retry(0, 40, "rate_limited", null)).value());
        }

        @Test
        @DisplayName("an unknown unclassified failure defers with ESCALATE as the default")
        void defersUnknown() {
            var outcome = engine.evaluate(retry(0, 40, "SOMETHING_ODD", null));
            assertTrue(outcome.deferred());
            assertEquals(DecisionValues.ESCALATE, outcome.value());
        }
    }

    // -- Domains and eligibility ---------------------------------------------

    @Nested
    @DisplayName("domains and eligibility")
    class DomainAndEligibilityRules {

        @Test
        @DisplayName("dedicated domain is used only at or above its floor")
        void dedicatedFloor() {
            var healthy = new DomainSelectionContext("M-1", MissionType.CAMPAIGN_EXECUTION, true, "C-1",
                    "acme-mail.com", 0.72, 0.7);
            var degraded = new DomainSelectionContext("M-1", MissionType.CAMPAIGN_EXECUTION, true, "C-1",
                    "acme-mail.com", 0.65, 0.7);
            assertEquals(DecisionValues.DEDICATED, engine.evaluate(healthy).value());
            assertEquals(DecisionValues.POOL, engine.evaluate(degraded).value());
        }

        @Test
        @DisplayName("unknown dedicated reputation defers with POOL as the default")
        void unknownReputationDefers() {
            var ctx = new DomainSelectionContext("M-1", MissionType.CAMPAIGN_EXECUTION, true, "C-1",
                    "acme-mail.com", null, null);
            var outcome = engine.evaluate(ctx);
            assertTrue(outcome.deferred());
            assertEquals(DecisionValues.POOL, outcome.value());
        }

        @Test
        @DisplayName("over-budget missions are ineligible")
        void budget() {
            var ctx = new EligibilityContext("M-1", MissionType.CAMPAIGN_EXECUTION, 50, 120.0, 100.0, Map.of());
            assertEquals(DecisionValues.INELIGIBLE, engine.evaluate(ctx).value());
        }

        @Test
        @DisplayName("low priority defers near a provider's limit, high priority does not")
        void rateLimit() {
            var hot = Map.of("EMAIL", 0.95);
            var low = new EligibilityContext("M-1", MissionType.CAMPAIGN_EXECUTION, 50, null, null, hot);
            var high = new EligibilityContext("M-2", MissionType.CAMPAIGN_EXECUTION, 85, null, null, hot);
            assertEquals(DecisionValues.DEFER, engine.evaluate(low).value());
            assertEquals(DecisionValues.ELIGIBLE, engine.evaluate(high).value());
        }
    }

    // -- Priority boost -------------------------------------------------------

    @Test
    @DisplayName("a mission queued past the boost interval is boosted, a fresh one is not")
    void priorityBoost() {
        var overdue = new PriorityCheckContext("M-1", MissionType.LEAD_REACTIVATION, 10, 100,
                1500, DAY);
        var fresh = new PriorityCheckContext("M-2", MissionType.LEAD_REACTIVATION, 10, 100,
                120, DAY);

        var boosted = engine.evaluate(overdue);
        assertEquals(DecisionValues.BOOST, boosted.value());
        assertFalse(boosted.deferred());
        assertEquals("PriorityBoostRule", boosted.rule());
        assertEquals(DecisionValues.MAINTAIN, engine.evaluate(fresh).value());
    }

    @Test
    @DisplayName("conservative defaults are allowed answers for each request type")
    void conservativeDefaults() {
        for (RequestType type : RequestType.values()) {
            assertTrue(type.allows(engine.conservativeDefault(type)), type.name());
        }
    }
}
