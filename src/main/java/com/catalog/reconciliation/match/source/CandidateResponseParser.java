package com.catalog.reconciliation.match.source;

import com.catalog.reconciliation.core.model.Candidate;

import java.util.List;

/**
 * Converts a search backend's JSON response body into candidates.
 */
public interface CandidateResponseParser {

    /**
     * @throws com.catalog.reconciliation.core.error.CandidateLookupException if the body is not a valid response
     */
    List<Candidate> parse(String body);
}
