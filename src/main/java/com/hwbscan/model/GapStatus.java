package com.hwbscan.model;

/**
 * Gap lifecycle. {@code ACTIVE} moves to exactly one of the two terminals.
 */
public enum GapStatus {
    ACTIVE("active"),
    CONSUMED("consumed"),
    VIOLATED("violated");

    private final String label;

    GapStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    public GapStatus consume() {
        switch (this) {
            case ACTIVE:
                return CONSUMED;
            case CONSUMED:
            case VIOLATED:
            default:
                throw new IllegalStateException("gap already " + label);
        }
    }

    public GapStatus violate() {
        switch (this) {
            case ACTIVE:
                return VIOLATED;
            case CONSUMED:
            case VIOLATED:
            default:
                throw new IllegalStateException("gap already " + label);
        }
    }

    public static GapStatus fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("gap status must not be empty");
        }
        String target = raw.trim().toLowerCase();
        for (GapStatus status : values()) {
            if (status.label.equals(target)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown gap status: " + raw);
    }
}
