package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.marc.DataField;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.LibrarySystem;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates item fields, which carry barcodes in {@code $i}. BPL print records keep
 * items in {@code 960}; NYPL records and BPL OverDrive records use {@code 949 _1}.
 */
final class ItemFields {

    static final String BARCODE_CODE = "i";

    private ItemFields() {
    }

    record Spec(String tag, char ind1, char ind2) {
        boolean matches(DataField field) {
            return field.tag().equals(tag) && field.hasIndicators(ind1, ind2);
        }
    }

    static final Spec BPL_ITEM = new Spec("960", ' ', ' ');
    static final Spec DEFAULT_ITEM = new Spec("949", ' ', '1');

    static Spec specFor(BibRecord record) {
        if (record.getLibrary() == LibrarySystem.BPL && !isOverDrive(record.getMarcRecord())) {
            return BPL_ITEM;
        }
        return DEFAULT_ITEM;
    }

    static List<DataField> items(MarcRecord marc, Spec spec) {
        if (marc == null) {
            return List.of();
        }
        return marc.getFields(spec.tag()).stream().filter(spec::matches).toList();
    }

    static List<String> barcodes(BibRecord record) {
        List<String> barcodes = new ArrayList<>();
        for (DataField item : items(record.getMarcRecord(), specFor(record))) {
            barcodes.addAll(item.getValues(BARCODE_CODE));
        }
        return barcodes;
    }

    private static boolean isOverDrive(MarcRecord marc) {
        if (marc == null) {
            return false;
        }
        return marc.getFields("037").stream()
                .flatMap(f -> f.getValues("b").stream())
                .anyMatch(b -> b.contains("OverDrive"));
    }
}
