package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.config.EngineConfig;
import com.catalog.reconciliation.config.OrderFieldMapping;
import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Library and collection specific inputs to {@link FieldUpdateRuleEngine}.
 *
 * @param bibIdTag                 tag that carries the catalog bib id
 * @param defaultLocation          default location for selection command tags, or null
 * @param orderMappings            order-to-MARC mapping table
 * @param callNumberRebuildVendors vendors whose branch call numbers get split into subfields
 */
public record UpdateContext(
        String bibIdTag,
        String defaultLocation,
        List<OrderFieldMapping> orderMappings,
        Set<String> callNumberRebuildVendors
) {
    public UpdateContext {
        Objects.requireNonNull(bibIdTag, "bibIdTag is required");
        orderMappings = orderMappings != null ? List.copyOf(orderMappings) : List.of();
        callNumberRebuildVendors = callNumberRebuildVendors != null ? Set.copyOf(callNumberRebuildVendors) : Set.of();
    }

    public static UpdateContext forBatch(EngineConfig config, LibrarySystem library, Collection collection) {
        return new UpdateContext(
                config.bibIdTag(library),
                config.defaultLocation(library, collection).orElse(null),
                config.orderFieldMappings(),
                Set.copyOf(config.callNumberRebuildVendors()));
    }
}
