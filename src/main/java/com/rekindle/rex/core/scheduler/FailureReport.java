package com.rekindle.rex.core.scheduler;

import com.rekindle.rex.core.model.MissionError;

import java.time.Instant;

/**
 * Message from a worker callback to the error-recovery loop.
 */
record FailureReport(String missionId, MissionError error, Instant reportedAt) {}
