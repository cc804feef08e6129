package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.config.EngineConfig;
import com.catalog.reconciliation.core.error.PreconditionViolationException;
import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.Workflow;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Chooses the {@link DecisionAnalyzer} for a record. Order-level workflows pick their
 * analyzer regardless of library or collection; cataloging depends on both.
 * Analyzers are stateless and shared.
 */
public class DecisionAnalyzerFactory {

    private final DecisionAnalyzer nyplBranch = new NyplBranchAnalyzer();
    private final DecisionAnalyzer nyplResearch = new NyplResearchAnalyzer();
    private final DecisionAnalyzer bplCataloging;
    private final DecisionAnalyzer selection = new SelectionAnalyzer();
    private final DecisionAnalyzer acquisitions = new AcquisitionsAnalyzer();

    public DecisionAnalyzerFactory(EngineConfig config) {
        Objects.requireNonNull(config, "config is required");
        this.bplCataloging = new BplCatalogingAnalyzer(new HashSet<>(
                config.attachOnlyVendors().getOrDefault(LibrarySystem.BPL.getCode(), List.of())));
    }

    /**
     * @throws PreconditionViolationException if no analyzer handles the combination
     */
    public DecisionAnalyzer forRecord(Workflow workflow, LibrarySystem library, Collection collection) {
        Objects.requireNonNull(workflow, "workflow is required");
        Objects.requireNonNull(library, "library is required");
        if (workflow == Workflow.SELECTION) {
            return selection;
        }
        if (workflow == Workflow.ACQUISITIONS) {
            return acquisitions;
        }
        if (library == LibrarySystem.BPL) {
            return bplCataloging;
        }
        if (collection == Collection.BRANCH) {
            return nyplBranch;
        }
        if (collection == Collection.RESEARCH) {
            return nyplResearch;
        }
        throw new PreconditionViolationException("No match analyzer for workflow=" + workflow.getCode()
                + ", library=" + library.getCode() + ", collection=" + collection);
    }
}
