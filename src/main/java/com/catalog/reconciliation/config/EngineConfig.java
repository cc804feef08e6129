package com.catalog.reconciliation.config;

import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.OrderAttribute;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static rule tables for the engine, loaded once by {@link EngineConfigLoader}
 * and passed to the components that need them.
 *
 * @param bibIdTags                library code to the tag carrying the catalog bib id
 * @param defaultLocations         library code to collection code to default location
 * @param attachOnlyVendors        library code to vendors whose unmatched records still attach
 * @param callNumberRebuildVendors vendors whose branch call numbers are split into subfields
 * @param orderMapping             tag to subfield code to order attribute key, in output order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
        @JsonProperty("bibIdTags") Map<String, String> bibIdTags,
        @JsonProperty("defaultLocations") Map<String, Map<String, String>> defaultLocations,
        @JsonProperty("attachOnlyVendors") Map<String, List<String>> attachOnlyVendors,
        @JsonProperty("callNumberRebuildVendors") List<String> callNumberRebuildVendors,
        @JsonProperty("orderMapping") Map<String, Map<String, String>> orderMapping
) {

    public EngineConfig {
        bibIdTags = bibIdTags != null ? Map.copyOf(bibIdTags) : Map.of();
        defaultLocations = defaultLocations != null ? Map.copyOf(defaultLocations) : Map.of();
        attachOnlyVendors = attachOnlyVendors != null ? Map.copyOf(attachOnlyVendors) : Map.of();
        callNumberRebuildVendors = callNumberRebuildVendors != null ? List.copyOf(callNumberRebuildVendors) : List.of();
        // Map.copyOf would lose tag order
        orderMapping = orderMapping != null ? orderMapping : Map.of();
        for (LibrarySystem library : LibrarySystem.values()) {
            if (!bibIdTags.containsKey(library.getCode())) {
                throw new IllegalArgumentException("Missing bib id tag for library: " + library.getCode());
            }
        }
        for (Map.Entry<String, Map<String, String>> tag : orderMapping.entrySet()) {
            for (String key : tag.getValue().values()) {
                if (OrderAttribute.fromKey(key).isEmpty()) {
                    throw new IllegalArgumentException(
                            "Unknown order attribute '" + key + "' mapped under tag " + tag.getKey());
                }
            }
        }
    }

    public String bibIdTag(LibrarySystem library) {
        return bibIdTags.get(library.getCode());
    }

    public Optional<String> defaultLocation(LibrarySystem library, Collection collection) {
        Map<String, String> byCollection = defaultLocations.get(library.getCode());
        if (byCollection == null || collection == null) {
            return Optional.empty();
        }
        String location = byCollection.get(collection.getCode());
        return location == null || location.isBlank() ? Optional.empty() : Optional.of(location);
    }

    public boolean isAttachOnlyVendor(LibrarySystem library, String vendor) {
        List<String> vendors = attachOnlyVendors.get(library.getCode());
        return vendor != null && vendors != null && vendors.contains(vendor);
    }

    public boolean requiresCallNumberRebuild(String vendor) {
        return vendor != null && callNumberRebuildVendors.contains(vendor);
    }

    /**
     * The order mapping table as typed rules, tags in configured order.
     */
    public List<OrderFieldMapping> orderFieldMappings() {
        List<OrderFieldMapping> mappings = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> tag : orderMapping.entrySet()) {
            List<OrderFieldMapping.SubfieldMapping> subfields = new ArrayList<>();
            for (Map.Entry<String, String> subfield : tag.getValue().entrySet()) {
                subfields.add(new OrderFieldMapping.SubfieldMapping(
                        subfield.getKey(), OrderAttribute.fromKey(subfield.getValue()).orElseThrow()));
            }
            mappings.add(new OrderFieldMapping(tag.getKey(), subfields));
        }
        return mappings;
    }
}
