package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.core.model.MatchDecision;

import java.util.List;
import java.util.Set;

/**
 * BPL cataloging. Branch call numbers are compared like NYPL branch ones; records
 * from attach-only vendors are attached even when nothing in the catalog matched.
 */
public class BplCatalogingAnalyzer extends CallNumberAnalyzer {

    private final Set<String> attachOnlyVendors;

    public BplCatalogingAnalyzer(Set<String> attachOnlyVendors) {
        this.attachOnlyVendors = Set.copyOf(attachOnlyVendors);
    }

    @Override
    protected boolean callNumbersAgree(BibRecord record, Candidate candidate) {
        return candidate.hasBranchCallNumber()
                && record.getBranchCallNumbers().equals(List.of(candidate.branchCallNumber()));
    }

    @Override
    protected MatchAnalysis noMatch(BibRecord record, ClassifiedCandidates classified) {
        CatalogAction action = record.getVendor() != null && attachOnlyVendors.contains(record.getVendor())
                ? CatalogAction.ATTACH
                : CatalogAction.INSERT;
        return analysis(record, classified, new MatchDecision(action, record.getBibId(), false),
                true, record.getBranchCallNumber(), record.getTitle());
    }
}
