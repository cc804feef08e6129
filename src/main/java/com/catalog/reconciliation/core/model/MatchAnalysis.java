package com.catalog.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@link MatchDecision} together with the fields reports need:
 * duplicate, mixed and other ids, call numbers on both sides and whether they agreed.
 */
public record MatchAnalysis(
        MatchDecision decision,
        boolean callNumberMatch,
        ClassifiedCandidates classified,
        String resourceId,
        String callNumber,
        String targetCallNumber,
        String targetTitle,
        String vendor,
        Workflow workflow
) {
    public MatchAnalysis {
        Objects.requireNonNull(decision, "decision is required");
        classified = classified != null ? classified : ClassifiedCandidates.empty();
    }

    public CatalogAction action() {
        return decision.action();
    }

    public String targetId() {
        return decision.targetId();
    }

    public boolean updatedByVendor() {
        return decision.updatedByVendor();
    }

    public List<String> duplicateRecords() {
        return classified.duplicates();
    }

    public List<String> mixed() {
        return classified.mixed();
    }

    public List<String> other() {
        return classified.other();
    }
}
