package com.catalog.reconciliation.core.model;

import com.catalog.reconciliation.core.marc.DataField;
import com.catalog.reconciliation.core.marc.Subfield;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A request to remove and/or add a field on a record's MARC payload.
 * Edits are data only; {@code FieldEditApplier} performs them.
 *
 * @param delete   remove every existing field with this tag before adding
 * @param replaces a specific existing field to remove before adding, or null
 */
public record FieldEdit(String tag, char ind1, char ind2, List<Subfield> subfields,
                        boolean delete, DataField replaces) {

    public FieldEdit {
        Objects.requireNonNull(tag, "tag is required");
        subfields = subfields != null ? List.copyOf(subfields) : List.of();
    }

    public static FieldEdit add(String tag, char ind1, char ind2, List<Subfield> subfields) {
        return new FieldEdit(tag, ind1, ind2, subfields, false, null);
    }

    public static FieldEdit replaceAll(String tag, List<Subfield> subfields) {
        return new FieldEdit(tag, ' ', ' ', subfields, true, null);
    }

    /**
     * Removes every field with {@code tag} and adds nothing.
     */
    public static FieldEdit deleteAll(String tag) {
        return new FieldEdit(tag, ' ', ' ', List.of(), true, null);
    }

    public static FieldEdit replace(DataField original, List<Subfield> subfields) {
        return new FieldEdit(original.tag(), original.ind1(), original.ind2(), subfields, false, original);
    }

    public Optional<DataField> original() {
        return Optional.ofNullable(replaces);
    }

    public boolean removeOnly() {
        return delete && subfields.isEmpty();
    }

    public DataField toField() {
        return new DataField(tag, ind1, ind2, subfields);
    }
}
