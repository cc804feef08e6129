package com.catalog.reconciliation.decision;

import com.catalog.reconciliation.config.EngineConfigLoader;
import com.catalog.reconciliation.core.error.PreconditionViolationException;
import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.Workflow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DecisionAnalyzerFactoryTest {

    private final DecisionAnalyzerFactory factory =
            new DecisionAnalyzerFactory(new EngineConfigLoader().loadDefault());

    @ParameterizedTest(name = "{0}/{1}/{2} -> {3}")
    @CsvSource({
            "CATALOGING, NYPL, BRANCH, NyplBranchAnalyzer",
            "CATALOGING, NYPL, RESEARCH, NyplResearchAnalyzer",
            "CATALOGING, BPL, NONE, BplCatalogingAnalyzer",
            "SELECTION, NYPL, RESEARCH, SelectionAnalyzer",
            "SELECTION, BPL, NONE, SelectionAnalyzer",
            "ACQUISITIONS, NYPL, BRANCH, AcquisitionsAnalyzer",
            "ACQUISITIONS, BPL, NONE, AcquisitionsAnalyzer"
    })
    @DisplayName("Workflow should take precedence over library and collection")
    void selectsVariant(Workflow workflow, LibrarySystem library, Collection collection, String expected) {
        assertEquals(expected, factory.forRecord(workflow, library, collection).getClass().getSimpleName());
    }

    @Test
    @DisplayName("NYPL cataloging without a collection should be a precondition violation")
    void unknownCombination() {
        PreconditionViolationException e = assertThrows(PreconditionViolationException.class,
                () -> factory.forRecord(Workflow.CATALOGING, LibrarySystem.NYPL, Collection.MIXED));
        assertTrue(e.getMessage().contains("library=nypl"));
    }
}
