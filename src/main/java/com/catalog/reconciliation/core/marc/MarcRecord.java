package com.catalog.reconciliation.core.marc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured in-memory form of a MARC payload.
 *
 * <p>Instances are mutable and not thread-safe. They are owned by the pipeline
 * step that created them; use {@link #copy()} before handing one to another step.</p>
 */
public class MarcRecord {

    private static final String DEFAULT_LEADER = "00000nam a2200000 a 4500";

    private String leader;
    private final List<ControlField> controlFields;
    private final List<DataField> dataFields;

    public MarcRecord() {
        this(DEFAULT_LEADER, List.of(), List.of());
    }

    public MarcRecord(String leader, List<ControlField> controlFields, List<DataField> dataFields) {
        this.leader = Objects.requireNonNull(leader, "leader is required");
        this.controlFields = new ArrayList<>(controlFields);
        this.dataFields = new ArrayList<>(dataFields);
    }

    public String getLeader() {
        return leader;
    }

    public void setLeader(String leader) {
        this.leader = Objects.requireNonNull(leader, "leader is required");
    }

    public List<ControlField> getControlFields() {
        return List.copyOf(controlFields);
    }

    public List<DataField> getDataFields() {
        return List.copyOf(dataFields);
    }

    public Optional<ControlField> getControlField(String tag) {
        return controlFields.stream().filter(f -> f.tag().equals(tag)).findFirst();
    }

    public void setControlField(ControlField field) {
        controlFields.removeIf(f -> f.tag().equals(field.tag()));
        int index = 0;
        while (index < controlFields.size() && controlFields.get(index).tag().compareTo(field.tag()) <= 0) {
            index++;
        }
        controlFields.add(index, field);
    }

    public List<DataField> getFields(String tag) {
        List<DataField> fields = new ArrayList<>();
        for (DataField field : dataFields) {
            if (field.tag().equals(tag)) {
                fields.add(field);
            }
        }
        return fields;
    }

    public boolean hasField(String tag) {
        return dataFields.stream().anyMatch(f -> f.tag().equals(tag));
    }

    /**
     * Removes every data field with the given tag.
     *
     * @return number of fields removed
     */
    public int removeFields(String tag) {
        int before = dataFields.size();
        dataFields.removeIf(f -> f.tag().equals(tag));
        return before - dataFields.size();
    }

    /**
     * Removes the first data field equal to the given one.
     */
    public boolean removeField(DataField field) {
        return dataFields.remove(field);
    }

    /**
     * Appends a field at the end of the record regardless of tag order.
     */
    public void addField(DataField field) {
        dataFields.add(Objects.requireNonNull(field, "field is required"));
    }

    /**
     * Inserts a field before the first field whose tag sorts after it,
     * keeping same-tag fields in insertion order.
     */
    public void addOrderedField(DataField field) {
        Objects.requireNonNull(field, "field is required");
        int index = 0;
        while (index < dataFields.size() && dataFields.get(index).tag().compareTo(field.tag()) <= 0) {
            index++;
        }
        dataFields.add(index, field);
    }

    public MarcRecord copy() {
        return new MarcRecord(leader, controlFields, dataFields);
    }

    @Override
    public String toString() {
        return "MarcRecord{leader='" + leader + "', controlFields=" + controlFields.size()
                + ", dataFields=" + dataFields.size() + '}';
    }
}
