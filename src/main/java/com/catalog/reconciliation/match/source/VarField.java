package com.catalog.reconciliation.match.source;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A variable-length field as returned by a search backend.
 */
record VarField(String tag, String ind1, List<Sub> subfields) {

    VarField {
        subfields = subfields != null ? List.copyOf(subfields) : List.of();
    }

    record Sub(String code, String content) {
    }

    String joined() {
        return subfields.stream().map(Sub::content).collect(Collectors.joining(" "));
    }

    List<String> values(String code) {
        return subfields.stream()
                .filter(s -> code.equals(s.code()))
                .map(Sub::content)
                .toList();
    }
}
