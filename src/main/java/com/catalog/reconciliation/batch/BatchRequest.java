package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.Matchpoints;
import com.catalog.reconciliation.core.model.Workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a batch run needs besides the records themselves.
 *
 * @param templateData     order template values, for order-level workflows
 * @param orderMatchpoints matchpoints from the order template, for order-level workflows
 */
public record BatchRequest(
        String batchId,
        LibrarySystem library,
        Collection collection,
        Workflow workflow,
        Map<String, Object> templateData,
        Matchpoints orderMatchpoints
) {
    public BatchRequest {
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(library, "library is required");
        Objects.requireNonNull(workflow, "workflow is required");
        collection = collection != null ? collection : Collection.NONE;
        // template values may be null, which Map.copyOf rejects
        templateData = templateData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(templateData))
                : Map.of();
        orderMatchpoints = orderMatchpoints != null ? orderMatchpoints : Matchpoints.none();
    }

    public static BatchRequest cataloging(String batchId, LibrarySystem library, Collection collection) {
        return new BatchRequest(batchId, library, collection, Workflow.CATALOGING, Map.of(), Matchpoints.none());
    }
}
