package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.CatalogSource;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.core.model.MatchDecision;

import java.time.LocalDateTime;

/**
 * Turns classified candidates into a {@link MatchAnalysis} for one record.
 * Each library/collection/workflow combination has its own variant, chosen by
 * {@link DecisionAnalyzerFactory}.
 */
public interface DecisionAnalyzer {

    MatchAnalysis analyze(BibRecord record, ClassifiedCandidates classified);

    /**
     * Recency rule shared by the cataloging variants: in-house catalog records are
     * only attached to; otherwise a vendor record newer than the catalog copy, or
     * one without a timestamp, overlays it.
     */
    static MatchDecision determineAction(BibRecord record, Candidate candidate) {
        if (candidate.catalogSource() == CatalogSource.IN_HOUSE) {
            return new MatchDecision(CatalogAction.ATTACH, candidate.bibId(), false);
        }
        LocalDateTime recordTime = record.getUpdateTime();
        if (recordTime == null
                || (candidate.updateTime() != null && candidate.updateTime().isAfter(recordTime))) {
            return new MatchDecision(CatalogAction.OVERLAY, candidate.bibId(), true);
        }
        return new MatchDecision(CatalogAction.ATTACH, candidate.bibId(), false);
    }
}
