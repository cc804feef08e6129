package com.catalog.reconciliation.match;

import com.catalog.reconciliation.core.error.PreconditionViolationException;
import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.IdentifierKind;
import com.catalog.reconciliation.core.model.Matchpoints;
import com.catalog.reconciliation.core.model.Workflow;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Finds catalog candidates for a record by querying identifiers in priority order.
 * The first identifier that yields any candidates wins; later ones are not queried.
 */
public class Matcher {
    private static final Logger log = LoggerFactory.getLogger(Matcher.class);

    private final CandidateSource source;
    private final MetricsService metrics;

    public Matcher(CandidateSource source) {
        this(source, NoOpMetricsService.INSTANCE);
    }

    public Matcher(CandidateSource source, MetricsService metrics) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Returns the candidates found by the highest-priority identifier that produced any.
     * Cataloging records use the matchpoints of their vendor; order-level records
     * use {@code orderMatchpoints}.
     *
     * @throws PreconditionViolationException if the record's workflow lacks the matchpoints it needs
     */
    public List<Candidate> match(BibRecord record, Matchpoints orderMatchpoints) {
        Matchpoints matchpoints = resolveMatchpoints(record, orderMatchpoints);
        for (IdentifierKind kind : matchpoints) {
            String value = record.getIdentifier(kind);
            if (value == null || value.isBlank()) {
                log.debug("match.skipped kind={} reason=empty", kind);
                continue;
            }
            long start = System.nanoTime();
            List<Candidate> candidates;
            try {
                candidates = source.getCandidates(kind, value);
            } catch (RuntimeException e) {
                metrics.incrementLookupFailure(kind);
                throw e;
            } finally {
                metrics.recordLookupDuration(kind, Duration.ofNanos(System.nanoTime() - start));
            }
            if (candidates != null && !candidates.isEmpty()) {
                log.debug("match.found kind={} value={} count={}", kind, value, candidates.size());
                return candidates;
            }
        }
        log.debug("match.none resourceId={} matchpoints={}", record.getResourceId(), matchpoints);
        return List.of();
    }

    private static Matchpoints resolveMatchpoints(BibRecord record, Matchpoints orderMatchpoints) {
        if (record.getWorkflow() == Workflow.CATALOGING) {
            if (record.getVendorInfo() == null) {
                throw new PreconditionViolationException(
                        "Vendor index required for cataloging workflow. resourceId="
                                + record.getResourceId() + ", vendor=" + record.getVendor());
            }
            return record.getVendorInfo().matchpoints();
        }
        if (orderMatchpoints == null || orderMatchpoints.isEmpty()) {
            throw new PreconditionViolationException(
                    "Matchpoints from order template required for acquisition or selection workflow. resourceId="
                            + record.getResourceId() + ", workflow=" + record.getWorkflow().getCode());
        }
        return orderMatchpoints;
    }
}
