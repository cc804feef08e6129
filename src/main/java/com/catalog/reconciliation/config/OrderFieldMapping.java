package com.catalog.reconciliation.config;

import com.catalog.reconciliation.core.model.OrderAttribute;

import java.util.List;
import java.util.Objects;

/**
 * Maps order-line attributes onto the subfields of one MARC tag.
 *
 * @param tag       the MARC tag produced
 * @param subfields subfield code to attribute pairs, in output order
 */
public record OrderFieldMapping(String tag, List<SubfieldMapping> subfields) {

    public OrderFieldMapping {
        Objects.requireNonNull(tag, "tag is required");
        subfields = subfields != null ? List.copyOf(subfields) : List.of();
    }

    public record SubfieldMapping(String code, OrderAttribute attribute) {
        public SubfieldMapping {
            Objects.requireNonNull(code, "code is required");
            Objects.requireNonNull(attribute, "attribute is required");
        }
    }
}
