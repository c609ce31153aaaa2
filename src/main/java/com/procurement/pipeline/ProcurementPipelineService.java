package com.procurement.pipeline;

import com.procurement.audit.RunAuditor;
import com.procurement.config.ProcurementProperties;
import com.procurement.contract.PipelineRunSummary;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.RunStatus;
import com.procurement.contract.VendorNormalizationEntry;
import com.procurement.fact.FactBuildResult;
import com.procurement.fact.FactBuilder;
import com.procurement.gate.GateResult;
import com.procurement.gate.QualityGate;
import com.procurement.normalize.VendorNormalizer;
import com.procurement.stats.SpendStatistics;
import com.procurement.stats.StatisticsAggregator;
import com.procurement.store.DerivedTables;
import com.procurement.store.ProcurementStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Full-refresh procurement pipeline.
 *
 * Stages, in order:
 * 1. vendor normalization and quality gate (independent, optionally concurrent)
 * 2. spend statistics over accepted rows
 * 3. fact derivation
 * 4. atomic publish of all derived tables, then the run summary
 *
 * Runs are serialized; a trigger during a run fails fast. A failed run
 * publishes nothing and is still audited.
 */
@Service
public class ProcurementPipelineService {

    private static final Logger log = LoggerFactory.getLogger(ProcurementPipelineService.class);

    private final ProcurementStore store;
    private final VendorNormalizer normalizer;
    private final QualityGate qualityGate;
    private final StatisticsAggregator statisticsAggregator;
    private final FactBuilder factBuilder;
    private final RunAuditor auditor;
    private final boolean parallelStages;
    private final ReentrantLock runLock = new ReentrantLock();

    public ProcurementPipelineService(ProcurementStore store,
                                      VendorNormalizer normalizer,
                                      QualityGate qualityGate,
                                      StatisticsAggregator statisticsAggregator,
                                      FactBuilder factBuilder,
                                      RunAuditor auditor,
                                      ProcurementProperties properties) {
        this.store = store;
        this.normalizer = normalizer;
        this.qualityGate = qualityGate;
        this.statisticsAggregator = statisticsAggregator;
        this.factBuilder = factBuilder;
        this.auditor = auditor;
        this.parallelStages = properties.getPipeline().isParallelStages();
    }

    public PipelineRunSummary run() {
        if (!runLock.tryLock()) {
            throw new PipelineAlreadyRunningException();
        }
        try {
            return runLocked();
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Runs a write against inputs the pipeline reads, holding the run lock so
     * no run can start or be in flight meanwhile.
     *
     * @throws PipelineAlreadyRunningException if a run currently holds the lock
     */
    public <T> T whileIdle(Supplier<T> write) {
        if (!runLock.tryLock()) {
            throw new PipelineAlreadyRunningException();
        }
        try {
            return write.get();
        } finally {
            runLock.unlock();
        }
    }

    private PipelineRunSummary runLocked() {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        long rawCount = 0;
        log.info("Pipeline run {} started", runId);

        PipelineRunSummary summary;
        try {
            List<RawTransaction> raw = store.readAllRaw();
            rawCount = raw.size();
            List<VendorNormalizationEntry> previousMap = store.readNormalizationMap();

            CompletableFuture<List<VendorNormalizationEntry>> normalization =
                stage(() -> normalizer.refresh(raw, previousMap, startedAt));
            CompletableFuture<GateResult> gate =
                stage(() -> qualityGate.partition(raw, startedAt));
            List<VendorNormalizationEntry> normalizationMap = normalization.join();
            GateResult gateResult = gate.join();

            SpendStatistics statistics = statisticsAggregator.aggregate(gateResult.accepted());
            FactBuildResult facts = factBuilder.build(
                gateResult.accepted(), normalizationMap, statistics, startedAt);

            store.commitDerived(new DerivedTables(
                normalizationMap, gateResult.accepted(), gateResult.rejected(), facts.facts()));

            summary = new PipelineRunSummary(
                runId,
                PipelineRunSummary.PIPELINE_RUN,
                RunStatus.SUCCEEDED,
                rawCount,
                gateResult.accepted().size(),
                gateResult.rejected().size(),
                facts.facts().size(),
                facts.unresolvedVendorCount(),
                facts.outlierCount(),
                "Staging Rows: " + rawCount + " | Fact Rows: " + facts.facts().size(),
                startedAt,
                Instant.now()
            );
        } catch (RuntimeException ex) {
            Throwable cause = unwrap(ex);
            log.error("Pipeline run {} failed; derived tables left unchanged", runId, cause);
            PipelineRunException failure = new PipelineRunException(runId, cause);
            recordFailure(runId, rawCount, startedAt, cause, failure);
            throw failure;
        }

        // Already published: an audit failure is logged, the run still succeeded.
        try {
            auditor.record(summary);
        } catch (RuntimeException auditFailure) {
            log.error("Could not audit successful run {} ({}): {}",
                runId, summary.description(), auditFailure.getMessage(), auditFailure);
        }
        return summary;
    }

    private <T> CompletableFuture<T> stage(Supplier<T> work) {
        return parallelStages
            ? CompletableFuture.supplyAsync(work)
            : CompletableFuture.completedFuture(work.get());
    }

    private void recordFailure(String runId, long rawCount, Instant startedAt,
                               Throwable cause, PipelineRunException failure) {
        PipelineRunSummary summary = new PipelineRunSummary(
            runId,
            PipelineRunSummary.PIPELINE_RUN,
            RunStatus.FAILED,
            rawCount, 0, 0, 0, 0, 0,
            "Run failed: " + cause.getMessage(),
            startedAt,
            Instant.now()
        );
        try {
            auditor.record(summary);
        } catch (RuntimeException auditFailure) {
            log.error("Could not audit failed run {}: {}", runId, auditFailure.getMessage());
            failure.addSuppressed(auditFailure);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }
}
