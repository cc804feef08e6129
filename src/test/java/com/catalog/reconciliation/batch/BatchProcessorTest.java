package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.config.EngineConfig;
import com.catalog.reconciliation.config.EngineConfigLoader;
import com.catalog.reconciliation.config.ProcessingOptions;
import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.error.DataIntegrityException;
import com.catalog.reconciliation.core.error.PreconditionViolationException;
import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.IdentifierKind;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.Matchpoints;
import com.catalog.reconciliation.core.model.VendorInfo;
import com.catalog.reconciliation.core.model.Workflow;
import com.catalog.reconciliation.match.CandidateSource;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.report.BatchReport;
import com.catalog.reconciliation.report.ReportSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.catalog.reconciliation.batch.BatchFixtures.bplItems;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BatchProcessor Tests")
class BatchProcessorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private static EngineConfig config;

    @Mock
    private CandidateSource source;

    @Mock
    private ReportSink reportSink;

    @Mock
    private MetricsService metrics;

    private BatchProcessor processor;

    @BeforeAll
    static void loadConfig() {
        config = new EngineConfigLoader().loadDefault();
    }

    @AfterEach
    void tearDown() {
        if (processor != null) {
            processor.close();
        }
    }

    private BatchProcessor processor(ProcessingOptions options) {
        processor = BatchProcessor.builder()
                .candidateSource(source)
                .engineConfig(config)
                .options(options)
                .metrics(metrics)
                .reportSink(reportSink)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
        return processor;
    }

    private static BibRecord bpl(String controlNumber, String isbn, String callNumber, String... barcodes) {
        return BibRecord.builder()
                .library(LibrarySystem.BPL)
                .workflow(Workflow.CATALOGING)
                .controlNumber(controlNumber)
                .isbn(isbn)
                .branchCallNumber(callNumber)
                .updateDate("20200601000000.0")
                .vendorInfo(new VendorInfo("BT CLS", List.of(), Matchpoints.of(IdentifierKind.ISBN)))
                .barcodes(List.of(barcodes))
                .marcRecord(bplItems(barcodes))
                .build();
    }

    private static BibRecord acquisition(String controlNumber, String isbn) {
        return BibRecord.builder()
                .library(LibrarySystem.BPL)
                .workflow(Workflow.ACQUISITIONS)
                .controlNumber(controlNumber)
                .isbn(isbn)
                .build();
    }

    private static BatchRequest orderRequest(String batchId, Workflow workflow, Map<String, Object> template) {
        return new BatchRequest(batchId, LibrarySystem.BPL, Collection.NONE, workflow, template,
                Matchpoints.of(IdentifierKind.ISBN));
    }

    @Nested
    @DisplayName("Successful batches")
    class SuccessTests {

        @Test
        @DisplayName("Should decide, update, deduplicate and report a BPL cataloging batch")
        void endToEnd() {
            Candidate existing = Candidate.builder("12345678")
                    .branchCallNumber("FIC SMITH")
                    .updateTime(LocalDateTime.of(2019, 1, 1, 0, 0))
                    .build();
            when(source.getCandidates(IdentifierKind.ISBN, "111")).thenReturn(List.of(existing));
            when(source.getCandidates(IdentifierKind.ISBN, "999")).thenReturn(List.of());

            List<BibRecord> records = List.of(
                    bpl("on111", "111", "FIC SMITH", "b1"),
                    bpl("on999", "999", "FIC JONES", "b2", "b3"),
                    bpl("on999", "999", "FIC JONES", "b4"));

            BatchResult result = processor(ProcessingOptions.builder().workerCount(2).build())
                    .process(records, BatchRequest.cataloging("batch-1", LibrarySystem.BPL, Collection.NONE));

            assertTrue(result.isSuccess());
            assertEquals(List.of(CatalogAction.ATTACH, CatalogAction.INSERT, CatalogAction.INSERT),
                    result.analyses().stream().map(a -> a.action()).toList());

            BibRecord attached = result.dedupe().attach().get(0);
            assertEquals("12345678", attached.getBibId());
            assertEquals(".b12345678", attached.getMarcRecord().getFields("907").get(0).getFirst("a"));
            assertEquals('a', attached.getMarcRecord().getLeader().charAt(9));

            assertEquals(1, result.dedupe().deduped().size());
            assertEquals(List.of("b2", "b3", "b4"), result.dedupe().deduped().get(0).getBarcodes());
            assertTrue(result.integrity().valid());

            ArgumentCaptor<BatchReport> report = ArgumentCaptor.forClass(BatchReport.class);
            verify(reportSink).accept(report.capture());
            assertEquals(NOW, report.getValue().generatedAt());
            assertEquals(3, report.getValue().totalRecords());
            verify(metrics).recordBatchSize(3);
            verify(metrics).incrementDuplicatesMerged(1);
        }

        @Test
        @DisplayName("Records failing a precondition should be skipped and listed")
        void preconditionSkipsRecord() {
            when(source.getCandidates(IdentifierKind.ISBN, "111")).thenReturn(List.of());
            BibRecord noVendor = BibRecord.builder()
                    .library(LibrarySystem.BPL)
                    .workflow(Workflow.CATALOGING)
                    .controlNumber("on404")
                    .build();

            BatchResult result = processor(ProcessingOptions.sequential()).process(
                    List.of(bpl("on111", "111", "FIC SMITH", "b1"), noVendor),
                    BatchRequest.cataloging("batch-2", LibrarySystem.BPL, Collection.NONE));

            assertTrue(result.hasErrors());
            assertFalse(result.isSuccess());
            assertEquals(1, result.analyses().size());
            assertTrue(result.errors().get(0).contains("on404"));
            assertTrue(result.integrity().valid());
        }

        @Test
        @DisplayName("Record timeouts should not count time spent waiting for a worker")
        void queuedRecordsDoNotTimeOut() {
            when(source.getCandidates(eq(IdentifierKind.ISBN), anyString())).thenAnswer(invocation -> {
                Thread.sleep(150);
                return List.of();
            });
            List<BibRecord> records = List.of(
                    acquisition("on1", "9780000000001"),
                    acquisition("on2", "9780000000002"),
                    acquisition("on3", "9780000000003"),
                    acquisition("on4", "9780000000004"));

            BatchResult result = processor(ProcessingOptions.builder()
                    .workerCount(1)
                    .recordTimeout(Duration.ofMillis(400))
                    .build())
                    .process(records, orderRequest("batch-7", Workflow.ACQUISITIONS, Map.of("fund", "kids")));

            assertTrue(result.isSuccess());
            assertEquals(4, result.analyses().size());
            assertTrue(result.analyses().stream().allMatch(a -> a.action() == CatalogAction.INSERT));
        }
    }

    @Nested
    @DisplayName("Failed batches")
    class FailureTests {

        @Test
        @DisplayName("Lookup failures should fail the batch")
        void lookupFailure() {
            when(source.getCandidates(IdentifierKind.ISBN, "111"))
                    .thenThrow(new CandidateLookupException("search service returned 503"));

            BatchProcessor batchProcessor = processor(ProcessingOptions.sequential());
            List<BibRecord> records = List.of(bpl("on111", "111", "FIC SMITH"));
            BatchRequest request = BatchRequest.cataloging("batch-3", LibrarySystem.BPL, Collection.NONE);

            CandidateLookupException e = assertThrows(CandidateLookupException.class,
                    () -> batchProcessor.process(records, request));
            assertEquals("search service returned 503", e.getMessage());
        }

        @Test
        @DisplayName("Slow records should time out instead of counting as unmatched")
        void timeout() {
            when(source.getCandidates(IdentifierKind.ISBN, "111")).thenAnswer(invocation -> {
                Thread.sleep(1_000);
                return List.of();
            });

            BatchProcessor batchProcessor = processor(ProcessingOptions.builder()
                    .workerCount(1)
                    .recordTimeout(Duration.ofMillis(100))
                    .build());
            List<BibRecord> records = List.of(bpl("on111", "111", "FIC SMITH"));
            BatchRequest request = BatchRequest.cataloging("batch-4", LibrarySystem.BPL, Collection.NONE);

            CandidateLookupException e = assertThrows(CandidateLookupException.class,
                    () -> batchProcessor.process(records, request));
            assertTrue(e.getMessage().contains("timed out"));
        }

        @Test
        @DisplayName("Repeated incoming barcodes should fail before any lookup")
        void duplicateBarcodes() {
            BatchProcessor batchProcessor = processor(ProcessingOptions.defaults());
            List<BibRecord> records = List.of(bpl("on1", "1", null, "b1"), bpl("on2", "2", null, "b1"));
            BatchRequest request = BatchRequest.cataloging("batch-5", LibrarySystem.BPL, Collection.NONE);

            assertThrows(DataIntegrityException.class, () -> batchProcessor.process(records, request));
        }

        @ParameterizedTest
        @EnumSource(value = Workflow.class, names = {"ACQUISITIONS", "SELECTION"})
        @DisplayName("Order-level batches without a template should be rejected")
        void missingTemplate(Workflow workflow) {
            BatchProcessor batchProcessor = processor(ProcessingOptions.defaults());
            List<BibRecord> records = List.of(acquisition("on1", "9780000000001"));
            BatchRequest request = orderRequest("batch-8", workflow, null);

            PreconditionViolationException e = assertThrows(PreconditionViolationException.class,
                    () -> batchProcessor.process(records, request));
            assertTrue(e.getMessage().contains("batch-8"));
            assertTrue(e.getMessage().contains(workflow.getCode()));
        }

        @Test
        @DisplayName("Oversized batches should be rejected")
        void oversizedBatch() {
            BatchProcessor batchProcessor = processor(ProcessingOptions.builder().maxBatchSize(1).build());
            List<BibRecord> records = List.of(bpl("on1", "1", null), bpl("on2", "2", null));
            BatchRequest request = BatchRequest.cataloging("batch-6", LibrarySystem.BPL, Collection.NONE);

            assertThrows(PreconditionViolationException.class, () -> batchProcessor.process(records, request));
        }
    }
}
