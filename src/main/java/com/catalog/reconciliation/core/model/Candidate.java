package com.catalog.reconciliation.core.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Read-only projection of one catalog search hit.
 * Backend-specific response shapes are converted into this type at the parsing boundary.
 *
 * @param bibId               catalog id, e.g. {@code .b11111111x} or {@code 11111111}
 * @param collection          collection of the catalog record, null when the backend does not report one
 * @param branchCallNumber    branch call number, null when absent
 * @param researchCallNumbers research call numbers, possibly empty
 * @param catalogSource       whether the catalog record was created in house
 * @param updateTime          last update of the catalog record
 */
public record Candidate(
        String bibId,
        String title,
        Collection collection,
        String branchCallNumber,
        List<String> researchCallNumbers,
        CatalogSource catalogSource,
        LocalDateTime updateTime,
        String controlNumber,
        List<String> isbns,
        List<String> oclcNumbers,
        List<String> upcs,
        List<String> barcodes
) {
    public Candidate {
        Objects.requireNonNull(bibId, "bibId is required");
        Objects.requireNonNull(catalogSource, "catalogSource is required");
        researchCallNumbers = researchCallNumbers != null ? List.copyOf(researchCallNumbers) : List.of();
        isbns = isbns != null ? List.copyOf(isbns) : List.of();
        oclcNumbers = oclcNumbers != null ? List.copyOf(oclcNumbers) : List.of();
        upcs = upcs != null ? List.copyOf(upcs) : List.of();
        barcodes = barcodes != null ? List.copyOf(barcodes) : List.of();
    }

    public boolean hasBranchCallNumber() {
        return branchCallNumber != null && !branchCallNumber.isEmpty();
    }

    public boolean hasResearchCallNumber() {
        return !researchCallNumbers.isEmpty();
    }

    /**
     * Numeric part of the bib id, used to order candidates.
     *
     * @throws IllegalArgumentException if the id has no numeric part
     */
    public long numericId() {
        return BibIds.numericPart(bibId);
    }

    public static Builder builder(String bibId) {
        return new Builder(bibId);
    }

    public static final class Builder {
        private final String bibId;
        private String title;
        private Collection collection;
        private String branchCallNumber;
        private List<String> researchCallNumbers;
        private CatalogSource catalogSource = CatalogSource.VENDOR;
        private LocalDateTime updateTime;
        private String controlNumber;
        private List<String> isbns;
        private List<String> oclcNumbers;
        private List<String> upcs;
        private List<String> barcodes;

        private Builder(String bibId) {
            this.bibId = bibId;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder collection(Collection collection) { this.collection = collection; return this; }
        public Builder branchCallNumber(String branchCallNumber) { this.branchCallNumber = branchCallNumber; return this; }
        public Builder researchCallNumbers(List<String> researchCallNumbers) { this.researchCallNumbers = researchCallNumbers; return this; }
        public Builder catalogSource(CatalogSource catalogSource) { this.catalogSource = catalogSource; return this; }
        public Builder updateTime(LocalDateTime updateTime) { this.updateTime = updateTime; return this; }
        public Builder controlNumber(String controlNumber) { this.controlNumber = controlNumber; return this; }
        public Builder isbns(List<String> isbns) { this.isbns = isbns; return this; }
        public Builder oclcNumbers(List<String> oclcNumbers) { this.oclcNumbers = oclcNumbers; return this; }
        public Builder upcs(List<String> upcs) { this.upcs = upcs; return this; }
        public Builder barcodes(List<String> barcodes) { this.barcodes = barcodes; return this; }

        public Candidate build() {
            return new Candidate(bibId, title, collection, branchCallNumber, researchCallNumbers,
                    catalogSource, updateTime, controlNumber, isbns, oclcNumbers, upcs, barcodes);
        }
    }
}
