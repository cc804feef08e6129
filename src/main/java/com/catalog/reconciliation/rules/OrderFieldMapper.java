package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.config.OrderFieldMapping;
import com.catalog.reconciliation.core.marc.Subfield;
import com.catalog.reconciliation.core.model.FieldEdit;
import com.catalog.reconciliation.core.model.OrderLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders order lines as MARC field edits using the order mapping table.
 * Null attributes are skipped and multi-valued ones repeat their subfield.
 */
public class OrderFieldMapper {

    public List<FieldEdit> toEdits(List<OrderLine> orders, List<OrderFieldMapping> mappings) {
        List<FieldEdit> edits = new ArrayList<>();
        for (OrderLine order : orders) {
            for (OrderFieldMapping mapping : mappings) {
                List<Subfield> subfields = new ArrayList<>();
                for (OrderFieldMapping.SubfieldMapping subfield : mapping.subfields()) {
                    Object value = order.get(subfield.attribute());
                    if (value == null) {
                        continue;
                    }
                    if (value instanceof List<?> values) {
                        for (Object item : values) {
                            subfields.add(new Subfield(subfield.code(), String.valueOf(item)));
                        }
                    } else {
                        subfields.add(new Subfield(subfield.code(), String.valueOf(value)));
                    }
                }
                if (!subfields.isEmpty()) {
                    edits.add(FieldEdit.add(mapping.tag(), ' ', ' ', subfields));
                }
            }
        }
        return edits;
    }
}
