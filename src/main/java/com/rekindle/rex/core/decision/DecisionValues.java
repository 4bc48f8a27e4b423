package com.rekindle.rex.core.decision;

/**
 * Decision values shared by the layers and the scheduler.
 */
public final class DecisionValues {

    public static final String REJECT = "REJECT";

    public static final String RETRY = "RETRY";
    public static final String FAIL_TERMINAL = "FAIL_TERMINAL";
    public static final String ESCALATE = "ESCALATE";

    public static final String DEDICATED = "DEDICATED";
    public static final String POOL = "POOL";
    public static final String NOT_REQUIRED = "NOT_REQUIRED";

    public static final String ELIGIBLE = "ELIGIBLE";
    public static final String DEFER = "DEFER";
    public static final String INELIGIBLE = "INELIGIBLE";

    public static final String ATTEMPT = "ATTEMPT";
    public static final String DENY = "DENY";

    public static final String BOOST = "BOOST";
    public static final String MAINTAIN = "MAINTAIN";

    private DecisionValues() {}
}
