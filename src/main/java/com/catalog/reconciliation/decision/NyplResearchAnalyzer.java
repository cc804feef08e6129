package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;

/**
 * NYPL research cataloging. Research call numbers are too varied to compare, so
 * any candidate carrying one counts as agreeing.
 */
public class NyplResearchAnalyzer extends CallNumberAnalyzer {

    @Override
    protected boolean callNumbersAgree(BibRecord record, Candidate candidate) {
        return candidate.hasResearchCallNumber();
    }

    @Override
    protected String targetCallNumber(Candidate candidate) {
        return candidate.hasResearchCallNumber() ? candidate.researchCallNumbers().get(0) : null;
    }
}
