package com.fleetmind.core.model;

/**
 * What a worker appears to be doing, inferred from the tail of its terminal output.
 */
public enum WorkerActivity {
    BUSY("busy"),
    IDLE("idle"),
    ABSENT("absent");

    private final String label;

    WorkerActivity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
