package com.rekindle.rex.core.resource;

/**
 * Outcome of {@link ResourceAllocator#acquire}. Denial is an expected result, not an error.
 */
public sealed interface AcquireResult permits AcquireResult.Granted, AcquireResult.Denied {

    boolean granted();

    record Granted(Lease lease) implements AcquireResult {
        @Override
        public boolean granted() {
            return true;
        }
    }

    record Denied(String reason) implements AcquireResult {
        @Override
        public boolean granted() {
            return false;
        }
    }
}
