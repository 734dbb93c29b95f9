package com.lucidreview.orchestration.model;

import java.util.Locale;

/**
 * Why the model stopped generating. Only {@link #END_TURN} and {@link #TOOL_USE} drive the
 * run loop; anything else lets the loop continue until the turn budget runs out.
 */
public enum StopReason {
    END_TURN("end_turn"),
    TOOL_USE("tool_use"),
    MAX_TOKENS("max_tokens"),
    STOP_SEQUENCE("stop_sequence"),
    CONTENT_FILTERED("content_filtered"),
    UNKNOWN("unknown");

    private final String wireValue;

    StopReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static StopReason fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StopReason reason : values()) {
            if (reason.wireValue.equals(normalized)) {
                return reason;
            }
        }
        return UNKNOWN;
    }
}
