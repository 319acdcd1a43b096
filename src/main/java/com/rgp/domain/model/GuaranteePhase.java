package com.rgp.domain.model;

/**
 * Lifecycle phase of a venue guarantee, derived from its state and the clock
 */
public enum GuaranteePhase {
    ASSEMBLING("ASSEMBLING"),
    REPORTING("REPORTING"),
    MATURED("MATURED"),
    FEES_DISTRIBUTED("FEES_DISTRIBUTED");

    private final String value;

    GuaranteePhase(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static GuaranteePhase fromValue(String value) {
        for (GuaranteePhase phase : values()) {
            if (phase.value.equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown guarantee phase: " + value);
    }
}
