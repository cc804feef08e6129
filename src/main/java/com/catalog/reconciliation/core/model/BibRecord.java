package com.catalog.reconciliation.core.model;

import com.catalog.reconciliation.core.marc.MarcDates;
import com.catalog.reconciliation.core.marc.MarcRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Canonical in-memory representation of one incoming bibliographic record and its order data.
 *
 * <p>Instances are immutable: the structured MARC payload is copied on the way in and
 * on the way out, and changes produce new instances through the {@code with*} methods.</p>
 */
public final class BibRecord {

    private final String bibId;
    private final String controlNumber;
    private final String isbn;
    private final List<String> oclcNumbers;
    private final String upc;
    private final List<String> branchCallNumbers;
    private final List<String> researchCallNumbers;
    private final Collection collection;
    private final LibrarySystem library;
    private final Workflow workflow;
    private final String title;
    private final String vendor;
    private final VendorInfo vendorInfo;
    private final String updateDate;
    private final List<String> barcodes;
    private final List<OrderLine> orders;
    private final MarcRecord marcRecord;

    private BibRecord(Builder builder) {
        this.library = Objects.requireNonNull(builder.library, "library is required");
        this.workflow = Objects.requireNonNull(builder.workflow, "workflow is required");
        this.collection = builder.collection != null ? builder.collection : Collection.NONE;
        this.bibId = builder.bibId;
        this.controlNumber = builder.controlNumber;
        this.isbn = builder.isbn;
        this.oclcNumbers = builder.oclcNumbers != null ? List.copyOf(builder.oclcNumbers) : List.of();
        this.upc = builder.upc;
        this.branchCallNumbers = builder.branchCallNumbers != null ? List.copyOf(builder.branchCallNumbers) : List.of();
        this.researchCallNumbers = builder.researchCallNumbers != null ? List.copyOf(builder.researchCallNumbers) : List.of();
        this.title = builder.title;
        this.vendorInfo = builder.vendorInfo;
        this.vendor = builder.vendorInfo != null ? builder.vendorInfo.name() : builder.vendor;
        this.updateDate = builder.updateDate;
        this.barcodes = builder.barcodes != null ? List.copyOf(builder.barcodes) : List.of();
        this.orders = builder.orders != null
                ? builder.orders.stream().map(OrderLine::copy).toList()
                : List.of();
        this.marcRecord = builder.marcRecord != null ? builder.marcRecord.copy() : new MarcRecord();
    }

    public String getBibId() { return bibId; }
    public String getControlNumber() { return controlNumber; }
    public String getIsbn() { return isbn; }
    public List<String> getOclcNumbers() { return oclcNumbers; }
    public String getUpc() { return upc; }
    public List<String> getBranchCallNumbers() { return branchCallNumbers; }
    public List<String> getResearchCallNumbers() { return researchCallNumbers; }
    public Collection getCollection() { return collection; }
    public LibrarySystem getLibrary() { return library; }
    public Workflow getWorkflow() { return workflow; }
    public String getTitle() { return title; }
    public String getVendor() { return vendor; }
    public VendorInfo getVendorInfo() { return vendorInfo; }
    public String getUpdateDate() { return updateDate; }
    public List<String> getBarcodes() { return barcodes; }

    /**
     * Returns copies of the order lines; mutating them does not affect this record.
     */
    public List<OrderLine> getOrders() {
        return orders.stream().map(OrderLine::copy).toList();
    }

    /**
     * Returns a copy of the structured MARC payload.
     */
    public MarcRecord getMarcRecord() {
        return marcRecord.copy();
    }

    public String getBranchCallNumber() {
        return branchCallNumbers.isEmpty() ? null : branchCallNumbers.get(0);
    }

    public String getResearchCallNumber() {
        return researchCallNumbers.isEmpty() ? null : researchCallNumbers.get(0);
    }

    /**
     * The authoritative call number: the research call number for NYPL Research
     * records, the branch call number for every other combination.
     */
    public String getCallNumber() {
        if (collection == Collection.RESEARCH && library == LibrarySystem.NYPL) {
            return getResearchCallNumber();
        }
        return getBranchCallNumber();
    }

    /**
     * Last update of the vendor record, parsed from the 005 value; null when absent.
     */
    public LocalDateTime getUpdateTime() {
        return MarcDates.parse(updateDate);
    }

    /**
     * Value of an identifier used as a matchpoint, or null when the record lacks it.
     * Multi-valued OCLC numbers yield the first one.
     */
    public String getIdentifier(IdentifierKind kind) {
        return switch (kind) {
            case BIB_ID -> bibId;
            case ISBN -> isbn;
            case OCLC_NUMBER -> oclcNumbers.isEmpty() ? null : oclcNumbers.get(0);
            case UPC -> upc;
        };
    }

    /**
     * Best available identifier for reports: bib id, control number, ISBN,
     * first OCLC number, then UPC.
     */
    public String getResourceId() {
        if (hasText(bibId)) return bibId;
        if (hasText(controlNumber)) return controlNumber;
        if (hasText(isbn)) return isbn;
        if (!oclcNumbers.isEmpty()) return oclcNumbers.get(0);
        if (hasText(upc)) return upc;
        return null;
    }

    public BibRecord withBibId(String newBibId) {
        return toBuilder().bibId(newBibId).build();
    }

    public BibRecord withMarcRecord(MarcRecord newMarcRecord) {
        return toBuilder().marcRecord(newMarcRecord).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .bibId(bibId)
                .controlNumber(controlNumber)
                .isbn(isbn)
                .oclcNumbers(oclcNumbers)
                .upc(upc)
                .branchCallNumbers(branchCallNumbers)
                .researchCallNumbers(researchCallNumbers)
                .collection(collection)
                .library(library)
                .workflow(workflow)
                .title(title)
                .vendor(vendor)
                .vendorInfo(vendorInfo)
                .updateDate(updateDate)
                .barcodes(barcodes)
                .orders(orders)
                .marcRecord(marcRecord);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "BibRecord{" +
                "library=" + library +
                ", workflow=" + workflow +
                ", collection=" + collection +
                ", controlNumber='" + controlNumber + '\'' +
                ", bibId='" + bibId + '\'' +
                ", vendor='" + vendor + '\'' +
                ", title='" + title + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String bibId;
        private String controlNumber;
        private String isbn;
        private List<String> oclcNumbers;
        private String upc;
        private List<String> branchCallNumbers;
        private List<String> researchCallNumbers;
        private Collection collection;
        private LibrarySystem library;
        private Workflow workflow;
        private String title;
        private String vendor;
        private VendorInfo vendorInfo;
        private String updateDate;
        private List<String> barcodes;
        private List<OrderLine> orders;
        private MarcRecord marcRecord;

        private Builder() {}

        public Builder bibId(String bibId) { this.bibId = bibId; return this; }
        public Builder controlNumber(String controlNumber) { this.controlNumber = controlNumber; return this; }
        public Builder isbn(String isbn) { this.isbn = isbn; return this; }
        public Builder oclcNumbers(List<String> oclcNumbers) { this.oclcNumbers = oclcNumbers; return this; }
        public Builder oclcNumber(String oclcNumber) { this.oclcNumbers = oclcNumber != null ? List.of(oclcNumber) : null; return this; }
        public Builder upc(String upc) { this.upc = upc; return this; }
        public Builder branchCallNumbers(List<String> branchCallNumbers) { this.branchCallNumbers = branchCallNumbers; return this; }
        public Builder branchCallNumber(String branchCallNumber) { this.branchCallNumbers = branchCallNumber != null ? List.of(branchCallNumber) : null; return this; }
        public Builder researchCallNumbers(List<String> researchCallNumbers) { this.researchCallNumbers = researchCallNumbers; return this; }
        public Builder collection(Collection collection) { this.collection = collection; return this; }
        public Builder library(LibrarySystem library) { this.library = library; return this; }
        public Builder workflow(Workflow workflow) { this.workflow = workflow; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder vendor(String vendor) { this.vendor = vendor; return this; }
        public Builder vendorInfo(VendorInfo vendorInfo) { this.vendorInfo = vendorInfo; return this; }
        public Builder updateDate(String updateDate) { this.updateDate = updateDate; return this; }
        public Builder barcodes(List<String> barcodes) { this.barcodes = barcodes; return this; }
        public Builder orders(List<OrderLine> orders) { this.orders = orders; return this; }
        public Builder marcRecord(MarcRecord marcRecord) { this.marcRecord = marcRecord; return this; }

        public BibRecord build() {
            return new BibRecord(this);
        }
    }
}
