package com.catalog.reconciliation.core.marc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable MARC data field: tag, two indicators and ordered subfields.
 */
public record DataField(String tag, char ind1, char ind2, List<Subfield> subfields) {

    public DataField {
        Objects.requireNonNull(tag, "tag is required");
        if (tag.length() != 3) {
            throw new IllegalArgumentException("MARC tag must have 3 characters: '" + tag + "'");
        }
        subfields = subfields != null ? List.copyOf(subfields) : List.of();
    }

    public static DataField of(String tag, char ind1, char ind2, Subfield... subfields) {
        return new DataField(tag, ind1, ind2, List.of(subfields));
    }

    /**
     * Returns the first value of the given subfield code, or null.
     */
    public String getFirst(String code) {
        for (Subfield subfield : subfields) {
            if (subfield.code().equals(code)) {
                return subfield.value();
            }
        }
        return null;
    }

    public List<String> getValues(String code) {
        List<String> values = new ArrayList<>();
        for (Subfield subfield : subfields) {
            if (subfield.code().equals(code)) {
                values.add(subfield.value());
            }
        }
        return values;
    }

    public boolean hasIndicators(char expectedInd1, char expectedInd2) {
        return ind1 == expectedInd1 && ind2 == expectedInd2;
    }

    /**
     * Subfield values joined with single spaces.
     */
    public String value() {
        return subfields.stream().map(Subfield::value).collect(Collectors.joining(" "));
    }

    public DataField withSubfields(List<Subfield> newSubfields) {
        return new DataField(tag, ind1, ind2, newSubfields);
    }
}
