package com.catalog.reconciliation.core.model;

import java.util.List;

/**
 * Candidates partitioned against an incoming record.
 *
 * @param matched candidates in the record's collection, ordered by ascending numeric bib id
 * @param mixed   ids of candidates spanning several collections
 * @param other   ids of candidates in a different collection
 */
public record ClassifiedCandidates(List<Candidate> matched, List<String> mixed, List<String> other) {

    public ClassifiedCandidates {
        matched = matched != null ? List.copyOf(matched) : List.of();
        mixed = mixed != null ? List.copyOf(mixed) : List.of();
        other = other != null ? List.copyOf(other) : List.of();
    }

    public static ClassifiedCandidates empty() {
        return new ClassifiedCandidates(List.of(), List.of(), List.of());
    }

    public boolean hasMatches() {
        return !matched.isEmpty();
    }

    /**
     * Ids of matched candidates when more than one candidate matched; empty otherwise.
     * Mixed and other candidates are never reported as duplicates.
     */
    public List<String> duplicates() {
        if (matched.size() > 1) {
            return matched.stream().map(Candidate::bibId).toList();
        }
        return List.of();
    }

    /**
     * The candidate with the highest numeric id, used when no call number agrees.
     */
    public Candidate lastMatched() {
        if (matched.isEmpty()) {
            throw new IllegalStateException("No matched candidates");
        }
        return matched.get(matched.size() - 1);
    }
}
