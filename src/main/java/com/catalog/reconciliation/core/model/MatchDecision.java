package com.catalog.reconciliation.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The action chosen for one record.
 *
 * @param action          what the catalog loader should do
 * @param targetId        catalog id the record attaches to or overlays; null for most inserts
 * @param updatedByVendor true when a newer vendor record replaces catalog data
 */
public record MatchDecision(CatalogAction action, String targetId, boolean updatedByVendor) {

    public MatchDecision {
        Objects.requireNonNull(action, "action is required");
    }

    public static MatchDecision insert(String targetId) {
        return new MatchDecision(CatalogAction.INSERT, targetId, false);
    }

    public static MatchDecision attach(String targetId) {
        return new MatchDecision(CatalogAction.ATTACH, targetId, false);
    }

    public Optional<String> target() {
        return Optional.ofNullable(targetId);
    }

    public boolean isAttach() {
        return action == CatalogAction.ATTACH;
    }
}
