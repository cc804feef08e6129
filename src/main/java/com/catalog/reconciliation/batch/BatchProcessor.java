package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.config.EngineConfig;
import com.catalog.reconciliation.config.ProcessingOptions;
import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.error.PreconditionViolationException;
import com.catalog.reconciliation.core.error.ReconciliationException;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.ClassifiedCandidates;
import com.catalog.reconciliation.core.model.FieldEdit;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.decision.DecisionAnalyzer;
import com.catalog.reconciliation.decision.DecisionAnalyzerFactory;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.match.CandidateClassifier;
import com.catalog.reconciliation.match.CandidateSource;
import com.catalog.reconciliation.match.Matcher;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.report.BatchReport;
import com.catalog.reconciliation.report.ReportSink;
import com.catalog.reconciliation.rules.FieldEditApplier;
import com.catalog.reconciliation.rules.FieldUpdateRuleEngine;
import com.catalog.reconciliation.rules.UpdateContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a batch of records through matching, analysis and field updates on a bounded
 * worker pool, then deduplicates and validates the batch once every record is decided.
 *
 * <pre>
 * try (BatchProcessor processor = BatchProcessor.builder()
 *         .candidateSource(source)
 *         .engineConfig(new EngineConfigLoader().loadDefault())
 *         .build()) {
 *     BatchResult result = processor.process(records, request);
 * }
 * </pre>
 *
 * <p>A record missing required configuration is skipped and listed in
 * {@link BatchResult#errors()}. Lookup failures, timeouts and call-number integrity
 * errors fail the whole batch.</p>
 */
public class BatchProcessor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final Matcher matcher;
    private final CandidateClassifier classifier;
    private final DecisionAnalyzerFactory analyzerFactory;
    private final FieldUpdateRuleEngine ruleEngine;
    private final FieldEditApplier editApplier;
    private final BarcodeExtractor barcodeExtractor;
    private final BatchDeduplicator deduplicator;
    private final BarcodeIntegrityValidator integrityValidator;
    private final EngineConfig engineConfig;
    private final ProcessingOptions options;
    private final MetricsService metrics;
    private final ReportSink reportSink;
    private final Clock clock;
    private final ExecutorService executor;

    private BatchProcessor(Builder builder) {
        this.engineConfig = Objects.requireNonNull(builder.engineConfig, "engineConfig is required");
        Objects.requireNonNull(builder.candidateSource, "candidateSource is required");
        this.options = builder.options != null ? builder.options : ProcessingOptions.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
        this.matcher = new Matcher(builder.candidateSource, metrics);
        this.classifier = new CandidateClassifier();
        this.analyzerFactory = new DecisionAnalyzerFactory(engineConfig);
        this.ruleEngine = new FieldUpdateRuleEngine();
        this.editApplier = new FieldEditApplier();
        this.barcodeExtractor = new BarcodeExtractor();
        this.deduplicator = new BatchDeduplicator();
        this.integrityValidator = new BarcodeIntegrityValidator();
        this.reportSink = builder.reportSink;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.executor = Executors.newFixedThreadPool(options.getWorkerCount());
    }

    /**
     * @throws PreconditionViolationException if the batch exceeds the configured size
     * @throws com.catalog.reconciliation.core.error.DataIntegrityException if incoming barcodes
     *         repeat or a call number cannot be rebuilt
     * @throws CandidateLookupException if a lookup fails or a record times out
     */
    public BatchResult process(List<BibRecord> records, BatchRequest request) {
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(request, "request is required");
        if (records.size() > options.getMaxBatchSize()) {
            throw new PreconditionViolationException("Batch size " + records.size()
                    + " exceeds maximum of " + options.getMaxBatchSize() + ", batchId=" + request.batchId());
        }
        if (request.workflow().isOrderLevel() && request.templateData().isEmpty()) {
            throw new PreconditionViolationException("Order template required for "
                    + request.workflow().getCode() + " workflow: batchId=" + request.batchId());
        }

        try (LogContext ctx = LogContext.forBatch(request.batchId(), request.library().getCode(),
                request.workflow().getCode())) {
            log.info("batch.started batchId={} records={} collection={}",
                    request.batchId(), records.size(), request.collection());
            metrics.recordBatchSize(records.size());

            List<String> barcodes = barcodeExtractor.extract(records);
            UpdateContext updateContext = UpdateContext.forBatch(engineConfig, request.library(), request.collection());

            List<CompletableFuture<RecordOutcome>> futures = new ArrayList<>(records.size());
            for (BibRecord record : records) {
                futures.add(submit(record, request, updateContext));
            }

            List<BibRecord> processed = new ArrayList<>();
            List<MatchAnalysis> analyses = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    RecordOutcome outcome = futures.get(i).join();
                    processed.add(outcome.record());
                    analyses.add(outcome.analysis());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof PreconditionViolationException) {
                        log.warn("record.skipped batchId={} resourceId={} reason={}",
                                request.batchId(), records.get(i).getResourceId(), cause.getMessage());
                        errors.add(cause.getMessage());
                        continue;
                    }
                    futures.forEach(f -> f.cancel(true));
                    throw failure(cause, records.get(i), request);
                }
            }

            DedupeResult dedupe = deduplicator.dedupe(processed, analyses);
            if (dedupe.mergedCount() > 0) {
                metrics.incrementDuplicatesMerged(dedupe.mergedCount());
            }

            IntegrityReport integrity = options.isValidateIntegrity()
                    ? integrityValidator.validate(dedupe.output(), barcodes)
                    : IntegrityReport.skipped();
            if (!integrity.valid()) {
                metrics.incrementIntegrityFailure();
            }

            BatchReport report = BatchReport.from(request.batchId(), analyses, clock.instant());
            if (reportSink != null) {
                reportSink.accept(report);
            }

            BatchResult result = new BatchResult(request.batchId(), analyses, dedupe, integrity, report, errors);
            log.info("batch.completed batchId={} processed={} attach={} deduped={} valid={} errors={}",
                    request.batchId(), analyses.size(), dedupe.attach().size(), dedupe.deduped().size(),
                    integrity.valid(), errors.size());
            return result;
        }
    }

    /**
     * The record timeout starts when a worker picks the record up, not while it waits in the queue.
     */
    private CompletableFuture<RecordOutcome> submit(BibRecord record, BatchRequest request,
                                                    UpdateContext updateContext) {
        CompletableFuture<RecordOutcome> future = new CompletableFuture<>();
        executor.execute(() -> {
            if (future.isDone()) {
                return;
            }
            future.orTimeout(options.getRecordTimeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
                future.complete(processRecord(record, request, updateContext));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future;
    }

    private RecordOutcome processRecord(BibRecord record, BatchRequest request, UpdateContext updateContext) {
        try (LogContext ctx = LogContext.forRecord(request.batchId(), record.getResourceId(),
                record.getWorkflow().getCode())) {
            List<Candidate> candidates = matcher.match(record, request.orderMatchpoints());
            ClassifiedCandidates classified = classifier.classify(candidates, record.getLibrary(), record.getCollection());
            DecisionAnalyzer analyzer = analyzerFactory.forRecord(
                    record.getWorkflow(), record.getLibrary(), record.getCollection());
            MatchAnalysis analysis = analyzer.analyze(record, classified);

            List<FieldEdit> edits = ruleEngine.computeEdits(record, analysis.decision(), record.getVendorInfo(),
                    request.templateData(), updateContext);
            MarcRecord marc = editApplier.apply(record.getMarcRecord(), edits, record.getLibrary());
            BibRecord updated = record.toBuilder()
                    .bibId(analysis.targetId() != null ? analysis.targetId() : record.getBibId())
                    .marcRecord(marc)
                    .build();

            metrics.incrementAction(record.getVendor(), analysis.action());
            log.info("record.decided resourceId={} action={} target={} callNumberMatch={} candidates={}",
                    analysis.resourceId(), analysis.action(), analysis.targetId(), analysis.callNumberMatch(),
                    candidates.size());
            return new RecordOutcome(updated, analysis);
        }
    }

    private RuntimeException failure(Throwable cause, BibRecord record, BatchRequest request) {
        if (cause instanceof TimeoutException) {
            return new CandidateLookupException("Record processing timed out after "
                    + options.getRecordTimeout().toMillis() + "ms: resourceId=" + record.getResourceId()
                    + ", batchId=" + request.batchId(), cause);
        }
        if (cause instanceof RuntimeException runtime) {
            log.error("batch.failed batchId={} resourceId={} error={}",
                    request.batchId(), record.getResourceId(), cause.getMessage());
            return runtime;
        }
        return new ReconciliationException("Record processing failed: resourceId=" + record.getResourceId()
                + ", batchId=" + request.batchId(), cause);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    record RecordOutcome(BibRecord record, MatchAnalysis analysis) {}

    public static class Builder {
        private CandidateSource candidateSource;
        private EngineConfig engineConfig;
        private ProcessingOptions options;
        private MetricsService metrics;
        private ReportSink reportSink;
        private Clock clock;

        public Builder candidateSource(CandidateSource candidateSource) {
            this.candidateSource = candidateSource;
            return this;
        }

        public Builder engineConfig(EngineConfig engineConfig) {
            this.engineConfig = engineConfig;
            return this;
        }

        public Builder options(ProcessingOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder reportSink(ReportSink reportSink) {
            this.reportSink = reportSink;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public BatchProcessor build() {
            return new BatchProcessor(this);
        }
    }
}
