package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.core.model.MatchDecision;

/**
 * Selection orders never replace catalog data: a matched record is always attached to,
 * preferring the first candidate that has any call number.
 */
public class SelectionAnalyzer implements DecisionAnalyzer {

    @Override
    public MatchAnalysis analyze(BibRecord record, ClassifiedCandidates classified) {
        if (!classified.hasMatches()) {
            return CallNumberAnalyzer.analysis(record, classified, MatchDecision.insert(null), true, null, null);
        }
        for (Candidate candidate : classified.matched()) {
            if (candidate.hasBranchCallNumber() || candidate.hasResearchCallNumber()) {
                return CallNumberAnalyzer.analysis(record, classified, MatchDecision.attach(candidate.bibId()),
                        true, candidate.branchCallNumber(), candidate.title());
            }
        }
        Candidate fallback = classified.lastMatched();
        return CallNumberAnalyzer.analysis(record, classified, MatchDecision.attach(fallback.bibId()),
                true, fallback.branchCallNumber(), fallback.title());
    }
}
