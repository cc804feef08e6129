package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.config.OrderFieldMapping;
import com.catalog.reconciliation.core.marc.Subfield;
import com.catalog.reconciliation.core.model.FieldEdit;
import com.catalog.reconciliation.core.model.OrderAttribute;
import com.catalog.reconciliation.core.model.OrderLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderFieldMapperTest {

    private final OrderFieldMapper mapper = new OrderFieldMapper();

    private final List<OrderFieldMapping> mappings = List.of(
            new OrderFieldMapping("960", List.of(
                    new OrderFieldMapping.SubfieldMapping("o", OrderAttribute.COPIES),
                    new OrderFieldMapping.SubfieldMapping("t", OrderAttribute.LOCATIONS),
                    new OrderFieldMapping.SubfieldMapping("u", OrderAttribute.FUND))),
            new OrderFieldMapping("961", List.of(
                    new OrderFieldMapping.SubfieldMapping("d", OrderAttribute.INTERNAL_NOTE))));

    @Test
    @DisplayName("Should emit one edit per mapped tag, expanding lists")
    void mapsOrderLine() {
        OrderLine order = OrderLine.builder()
                .copies("2")
                .locations(List.of("agb0n", "mab0n"))
                .fund("general")
                .internalNote("rush")
                .build();

        List<FieldEdit> edits = mapper.toEdits(List.of(order), mappings);

        assertEquals(2, edits.size());
        assertEquals("960", edits.get(0).tag());
        assertEquals(List.of(new Subfield("o", "2"), new Subfield("t", "agb0n"),
                new Subfield("t", "mab0n"), new Subfield("u", "general")), edits.get(0).subfields());
        assertEquals(List.of(new Subfield("d", "rush")), edits.get(1).subfields());
        assertFalse(edits.get(0).delete());
    }

    @Test
    @DisplayName("Tags without any values should be skipped")
    void skipsEmptyTags() {
        OrderLine order = OrderLine.builder().fund("general").build();

        List<FieldEdit> edits = mapper.toEdits(List.of(order, order), mappings);

        assertEquals(2, edits.size());
        assertTrue(edits.stream().allMatch(e -> e.tag().equals("960")));
    }
}
