package com.catalog.reconciliation.core.model;

import java.util.Optional;

/**
 * Attributes of an {@link OrderLine}. The key is the name used by order templates
 * and by the order-to-MARC mapping table.
 */
public enum OrderAttribute {
    AUDIENCE("audience", true),
    BLANKET_PO("blanket_po", false),
    BRANCHES("branches", true),
    COPIES("copies", false),
    COUNTRY("country", false),
    CREATE_DATE("create_date", false),
    FORMAT("format", false),
    FUND("fund", false),
    INTERNAL_NOTE("internal_note", false),
    LANG("lang", false),
    LOCATIONS("locations", true),
    ORDER_CODE_1("order_code_1", false),
    ORDER_CODE_2("order_code_2", false),
    ORDER_CODE_3("order_code_3", false),
    ORDER_CODE_4("order_code_4", false),
    ORDER_ID("order_id", false),
    ORDER_TYPE("order_type", false),
    PRICE("price", false),
    SELECTOR_NOTE("selector_note", false),
    SHELVES("shelves", true),
    STATUS("status", false),
    VAR_FIELD_ISBN("var_field_isbn", false),
    VENDOR_CODE("vendor_code", false),
    VENDOR_NOTES("vendor_notes", false),
    VENDOR_TITLE_NO("vendor_title_no", false);

    private final String key;
    private final boolean multiValued;

    OrderAttribute(String key, boolean multiValued) {
        this.key = key;
        this.multiValued = multiValued;
    }

    public String getKey() {
        return key;
    }

    public boolean isMultiValued() {
        return multiValued;
    }

    public static Optional<OrderAttribute> fromKey(String key) {
        for (OrderAttribute attribute : values()) {
            if (attribute.key.equals(key)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }
}
