package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.core.model.MatchDecision;

/**
 * Acquisitions records are always inserted; candidates are kept only for reporting.
 */
public class AcquisitionsAnalyzer implements DecisionAnalyzer {

    @Override
    public MatchAnalysis analyze(BibRecord record, ClassifiedCandidates classified) {
        return CallNumberAnalyzer.analysis(record, classified, MatchDecision.insert(record.getBibId()),
                true, record.getBranchCallNumber(), record.getTitle());
    }
}
