package com.rekindle.rex.core.scheduler;

/**
 * Thrown by inbound calls naming a mission id that was never submitted.
 */
public class UnknownMissionException extends RuntimeException {

    private final String missionId;

    public UnknownMissionException(String missionId) {
        super("Unknown mission: " + missionId);
        this.missionId = missionId;
    }

    public String getMissionId() {
        return missionId;
    }
}
