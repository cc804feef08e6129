package com.catalog.reconciliation.core.model;

import java.util.Locale;

/**
 * Processing workflow, also known as record type.
 */
public enum Workflow {
    /** Full-level vendor records. */
    CATALOGING("cat"),
    /** Order-level records that never merge with catalog state. */
    ACQUISITIONS("acq"),
    /** Order-level records selected for purchase. */
    SELECTION("sel");

    private final String code;

    Workflow(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isOrderLevel() {
        return this != CATALOGING;
    }

    public static Workflow fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Workflow code is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Workflow workflow : values()) {
            if (workflow.code.equals(normalized)) {
                return workflow;
            }
        }
        throw new IllegalArgumentException("Unknown workflow: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
