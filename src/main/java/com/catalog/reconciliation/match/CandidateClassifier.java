package com.catalog.reconciliation.match;

import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Partitions candidates by collection relative to an incoming record.
 * BPL does not split its catalog into collections, so every BPL candidate is a match.
 */
public class CandidateClassifier {

    /**
     * Sorts candidates by ascending numeric bib id. For BPL all of them are matched;
     * otherwise MIXED candidates go to {@code mixed}, candidates in
     * {@code recordCollection} to {@code matched} and the rest to {@code other}.
     */
    public ClassifiedCandidates classify(List<Candidate> candidates, LibrarySystem library,
                                         Collection recordCollection) {
        Objects.requireNonNull(library, "library is required");
        if (candidates == null || candidates.isEmpty()) {
            return ClassifiedCandidates.empty();
        }
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingLong(Candidate::numericId));
        if (library == LibrarySystem.BPL) {
            return new ClassifiedCandidates(sorted, List.of(), List.of());
        }

        Collection target = recordCollection != null ? recordCollection : Collection.NONE;
        List<Candidate> matched = new ArrayList<>();
        List<String> mixed = new ArrayList<>();
        List<String> other = new ArrayList<>();
        for (Candidate candidate : sorted) {
            // backends without collections report null, which matches a record without one
            Collection collection = candidate.collection() != null ? candidate.collection() : Collection.NONE;
            if (collection == Collection.MIXED) {
                mixed.add(candidate.bibId());
            } else if (collection == target) {
                matched.add(candidate);
            } else {
                other.add(candidate.bibId());
            }
        }
        return new ClassifiedCandidates(matched, mixed, other);
    }
}
