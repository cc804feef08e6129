package com.catalog.reconciliation.match;

import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.IdentifierKind;

import java.util.List;

/**
 * Catalog search service consumed by the {@link Matcher}.
 * Implementations are expected to be safe for concurrent use.
 */
public interface CandidateSource {

    /**
     * Looks up catalog records by one identifier.
     *
     * @return the hits, empty when nothing matches
     * @throws IllegalArgumentException if the source cannot search by {@code kind}
     * @throws com.catalog.reconciliation.core.error.CandidateLookupException if the lookup fails
     */
    List<Candidate> getCandidates(IdentifierKind kind, String value);
}
