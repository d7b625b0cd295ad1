package com.hwbscan.model;

/**
 * Setup lifecycle. {@code ACTIVE -> CONSUMED} is the only transition.
 */
public enum SetupStatus {
    ACTIVE("active"),
    CONSUMED("consumed");

    private final String label;

    SetupStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public SetupStatus consume() {
        switch (this) {
            case ACTIVE:
                return CONSUMED;
            case CONSUMED:
            default:
                throw new IllegalStateException("setup already " + label);
        }
    }

    public static SetupStatus fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("setup status must not be empty");
        }
        String target = raw.trim().toLowerCase();
        for (SetupStatus status : values()) {
            if (status.label.equals(target)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown setup status: " + raw);
    }
}
