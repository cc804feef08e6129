package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;

import java.util.List;

/**
 * NYPL branch cataloging. Call numbers agree only when the record carries exactly
 * the candidate's branch call number.
 */
public class NyplBranchAnalyzer extends CallNumberAnalyzer {

    @Override
    protected boolean callNumbersAgree(BibRecord record, Candidate candidate) {
        return candidate.hasBranchCallNumber()
                && record.getBranchCallNumbers().equals(List.of(candidate.branchCallNumber()));
    }
}
