package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.core.model.MatchDecision;

/**
 * Base for the cataloging variants: the first matched candidate whose call number
 * agrees with the record decides by recency; without agreement the candidate with
 * the highest id decides, still by recency, and the call-number match is reported false.
 */
abstract class CallNumberAnalyzer implements DecisionAnalyzer {

    @Override
    public MatchAnalysis analyze(BibRecord record, ClassifiedCandidates classified) {
        if (!classified.hasMatches()) {
            return noMatch(record, classified);
        }
        for (Candidate candidate : classified.matched()) {
            if (callNumbersAgree(record, candidate)) {
                return analysis(record, classified, DecisionAnalyzer.determineAction(record, candidate),
                        true, targetCallNumber(candidate), candidate.title());
            }
        }
        Candidate fallback = classified.lastMatched();
        return analysis(record, classified, DecisionAnalyzer.determineAction(record, fallback),
                false, targetCallNumber(fallback), fallback.title());
    }

    protected abstract boolean callNumbersAgree(BibRecord record, Candidate candidate);

    protected String targetCallNumber(Candidate candidate) {
        return candidate.branchCallNumber();
    }

    protected MatchAnalysis noMatch(BibRecord record, ClassifiedCandidates classified) {
        return analysis(record, classified, MatchDecision.insert(null), true, null, null);
    }

    static MatchAnalysis analysis(BibRecord record, ClassifiedCandidates classified, MatchDecision decision,
                                  boolean callNumberMatch, String targetCallNumber, String targetTitle) {
        return new MatchAnalysis(decision, callNumberMatch, classified, record.getResourceId(),
                record.getCallNumber(), targetCallNumber, targetTitle, record.getVendor(), record.getWorkflow());
    }
}
