package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.error.DataIntegrityException;
import com.catalog.reconciliation.core.marc.DataField;
import com.catalog.reconciliation.core.marc.Subfield;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a flat branch call number such as {@code "J SPA GRAPHIC GN FIC SMITH"} into
 * prefix ({@code $p}), format ({@code $f}), main class ({@code $a}) and cutter ({@code $c}).
 * The subfields joined with spaces always reproduce the input.
 */
public class CallNumberReconstructor {

    public static final String TAG = "091";

    /**
     * @throws DataIntegrityException if the subfields would not reproduce the call number
     */
    public List<Subfield> reconstruct(String callNumber) {
        List<Subfield> subfields = new ArrayList<>();
        int pos = 0;

        if (callNumber.startsWith("J SPA ")) {
            subfields.add(new Subfield("p", "J SPA"));
        } else if (callNumber.startsWith("J ")) {
            subfields.add(new Subfield("p", "J"));
        }

        if (callNumber.contains("GRAPHIC ")) {
            subfields.add(new Subfield("f", "GRAPHIC"));
        } else if (callNumber.contains("HOLIDAY ")) {
            subfields.add(new Subfield("f", "HOLIDAY"));
        } else if (callNumber.contains("YR ")) {
            subfields.add(new Subfield("f", "YR"));
        }

        if (callNumber.contains("GN FIC ")) {
            pos = callNumber.indexOf("GN FIC ") + 7;
            subfields.add(new Subfield("a", "GN FIC"));
        } else if (callNumber.contains("FIC ")) {
            pos = callNumber.indexOf("FIC ") + 4;
            subfields.add(new Subfield("a", "FIC"));
        } else if (callNumber.contains("PIC ")) {
            pos = callNumber.indexOf("PIC ") + 4;
            subfields.add(new Subfield("a", "PIC"));
        } else if (callNumber.startsWith("J E ")) {
            pos = 4;
            subfields.add(new Subfield("a", "E"));
        } else if (callNumber.startsWith("J SPA E ")) {
            pos = 8;
            subfields.add(new Subfield("a", "E"));
        }

        subfields.add(new Subfield("c", callNumber.substring(pos)));

        String rebuilt = new DataField(TAG, ' ', ' ', subfields).value();
        if (!rebuilt.equals(callNumber)) {
            throw new DataIntegrityException("Constructed call number does not match original. New="
                    + rebuilt + ", Original=" + callNumber);
        }
        return subfields;
    }
}
