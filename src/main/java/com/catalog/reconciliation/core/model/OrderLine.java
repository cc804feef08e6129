package com.catalog.reconciliation.core.model;

import java.time.temporal.TemporalAccessor;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One acquisitions or selection order attached to a {@link BibRecord}.
 *
 * <p>Scalar attributes hold strings, multi-valued attributes hold string lists.
 * The only mutation path is {@link #applyTemplate(Map)}.</p>
 */
public class OrderLine {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final EnumMap<OrderAttribute, Object> values;

    private OrderLine(EnumMap<OrderAttribute, Object> values) {
        this.values = values;
    }

    /**
     * Returns the raw value of an attribute: a {@code String}, a {@code List<String>} or null.
     */
    public Object get(OrderAttribute attribute) {
        return values.get(attribute);
    }

    public String getString(OrderAttribute attribute) {
        Object value = values.get(attribute);
        return value instanceof String s ? s : null;
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(OrderAttribute attribute) {
        Object value = values.get(attribute);
        return value instanceof List<?> list ? (List<String>) list : List.of();
    }

    public String getFund() { return getString(OrderAttribute.FUND); }
    public String getPrice() { return getString(OrderAttribute.PRICE); }
    public String getCopies() { return getString(OrderAttribute.COPIES); }
    public String getFormat() { return getString(OrderAttribute.FORMAT); }
    public String getLang() { return getString(OrderAttribute.LANG); }
    public String getVendorCode() { return getString(OrderAttribute.VENDOR_CODE); }
    public String getOrderType() { return getString(OrderAttribute.ORDER_TYPE); }
    public String getStatus() { return getString(OrderAttribute.STATUS); }
    public List<String> getLocations() { return getList(OrderAttribute.LOCATIONS); }
    public List<String> getAudience() { return getList(OrderAttribute.AUDIENCE); }

    /**
     * Overlays template data onto this order line.
     * A value overwrites the attribute only when it is truthy and its key names an
     * order attribute; empty or false values never erase existing data.
     * Applying the same template twice leaves the line as applying it once.
     */
    public void applyTemplate(Map<String, ?> templateData) {
        if (templateData == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : templateData.entrySet()) {
            Object value = entry.getValue();
            if (!isTruthy(value)) {
                continue;
            }
            OrderAttribute.fromKey(entry.getKey())
                    .ifPresent(attribute -> values.put(attribute, coerce(attribute, value)));
        }
    }

    /**
     * Returns an independent copy of this order line.
     */
    public OrderLine copy() {
        return new OrderLine(new EnumMap<>(values));
    }

    /**
     * Template truthiness: null, blank strings, empty collections or maps,
     * {@code false} and numeric zero are all falsy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        return true;
    }

    private static Object coerce(OrderAttribute attribute, Object value) {
        if (attribute.isMultiValued()) {
            List<String> list = new ArrayList<>();
            if (value instanceof Collection<?> c) {
                for (Object item : c) {
                    if (item != null) {
                        list.add(asString(item));
                    }
                }
            } else {
                list.add(asString(value));
            }
            return Collections.unmodifiableList(list);
        }
        return asString(value);
    }

    private static String asString(Object value) {
        if (value instanceof TemporalAccessor temporal) {
            return DATE_FORMAT.format(temporal);
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((OrderLine) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "OrderLine" + values;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final EnumMap<OrderAttribute, Object> values = new EnumMap<>(OrderAttribute.class);

        public Builder set(OrderAttribute attribute, Object value) {
            if (value == null) {
                values.remove(attribute);
            } else {
                values.put(attribute, coerce(attribute, value));
            }
            return this;
        }

        public Builder fund(String fund) { return set(OrderAttribute.FUND, fund); }
        public Builder price(String price) { return set(OrderAttribute.PRICE, price); }
        public Builder copies(String copies) { return set(OrderAttribute.COPIES, copies); }
        public Builder format(String format) { return set(OrderAttribute.FORMAT, format); }
        public Builder lang(String lang) { return set(OrderAttribute.LANG, lang); }
        public Builder country(String country) { return set(OrderAttribute.COUNTRY, country); }
        public Builder vendorCode(String vendorCode) { return set(OrderAttribute.VENDOR_CODE, vendorCode); }
        public Builder orderType(String orderType) { return set(OrderAttribute.ORDER_TYPE, orderType); }
        public Builder status(String status) { return set(OrderAttribute.STATUS, status); }
        public Builder internalNote(String note) { return set(OrderAttribute.INTERNAL_NOTE, note); }
        public Builder vendorNotes(String notes) { return set(OrderAttribute.VENDOR_NOTES, notes); }
        public Builder vendorTitleNo(String titleNo) { return set(OrderAttribute.VENDOR_TITLE_NO, titleNo); }
        public Builder blanketPo(String blanketPo) { return set(OrderAttribute.BLANKET_PO, blanketPo); }
        public Builder locations(List<String> locations) { return set(OrderAttribute.LOCATIONS, locations); }
        public Builder audience(List<String> audience) { return set(OrderAttribute.AUDIENCE, audience); }

        public OrderLine build() {
            return new OrderLine(new EnumMap<>(values));
        }
    }
}
