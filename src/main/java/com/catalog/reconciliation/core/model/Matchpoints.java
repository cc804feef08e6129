package com.catalog.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Priority-ordered identifier kinds used to query the catalog search service.
 * The first entry is the primary matchpoint.
 */
public final class Matchpoints implements Iterable<IdentifierKind> {

    private static final Matchpoints NONE = new Matchpoints(List.of());

    private final List<IdentifierKind> kinds;

    private Matchpoints(List<IdentifierKind> kinds) {
        this.kinds = List.copyOf(kinds);
    }

    public static Matchpoints of(IdentifierKind... kinds) {
        return new Matchpoints(List.of(kinds));
    }

    public static Matchpoints none() {
        return NONE;
    }

    /**
     * Builds matchpoints from an ordered priority map such as
     * {@code {"primary": "isbn", "secondary": "oclc_number"}}.
     * Iteration order of the map is the priority order; blank values are skipped.
     *
     * @throws IllegalArgumentException if a value names an unsupported identifier kind
     */
    public static Matchpoints fromPriorityMap(Map<String, String> priorities) {
        Objects.requireNonNull(priorities, "priorities is required");
        List<IdentifierKind> kinds = new ArrayList<>();
        for (String key : priorities.values()) {
            if (key == null || key.isBlank()) {
                continue;
            }
            kinds.add(IdentifierKind.fromKey(key));
        }
        return new Matchpoints(kinds);
    }

    public List<IdentifierKind> getKinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    @Override
    public Iterator<IdentifierKind> iterator() {
        return kinds.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return kinds.equals(((Matchpoints) o).kinds);
    }

    @Override
    public int hashCode() {
        return kinds.hashCode();
    }

    @Override
    public String toString() {
        return "Matchpoints" + kinds;
    }
}
