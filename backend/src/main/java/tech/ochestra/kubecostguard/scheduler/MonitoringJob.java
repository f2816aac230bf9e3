package tech.ochestra.kubecostguard.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.adapters.ClusterSnapshotSource;
import tech.ochestra.kubecostguard.adapters.EvaluationReportListener;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.optimization.cleanup.CleanupMode;
import tech.ochestra.kubecostguard.service.EvaluationCycleService;
import tech.ochestra.kubecostguard.service.EvaluationReport;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Continuous monitoring: one evaluation cycle per interval.
 *
 * Scheduled with a fixed delay, so a cycle never starts before the previous
 * one (listeners included) has finished. A cycle running past the timeout,
 * or still running at shutdown, is cancelled; cleanup stops before its next
 * deletion. A failed cycle is logged and the next scheduled run is the retry.
 *
 * The application ships no {@link ClusterSnapshotSource}. The deployment must
 * register one as a bean; without it every cycle is skipped with a warning,
 * even when {@code kubecostguard.kubernetes.enabled} is set.
 */
@Component
@ConditionalOnProperty(name = "kubecostguard.monitoring.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class MonitoringJob {

    private final ObjectProvider<ClusterSnapshotSource> snapshotSource;
    private final EvaluationCycleService cycleService;
    private final ObjectProvider<EvaluationReportListener> listeners;
    private final KubeCostGuardProperties properties;
    private final ExecutorService cycleRunner =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("monitoring-cycle-"));
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${kubecostguard.monitoring.interval-millis:300000}")
    public void runScheduledCycle() {
        ClusterSnapshotSource source = snapshotSource.getIfAvailable();
        if (source == null) {
            log.warn("Monitoring enabled but no ClusterSnapshotSource is configured - skipping cycle");
            return;
        }
        if (shuttingDown.get()) {
            return;
        }

        AtomicBoolean cancelled = new AtomicBoolean(false);
        CleanupMode cleanupMode = properties.getCleanup().isApplyOnSchedule() ? CleanupMode.APPLY : CleanupMode.DRY_RUN;
        long timeoutMillis = properties.getMonitoring().getCycleTimeoutMillis();

        Future<EvaluationReport> cycle = cycleRunner.submit(() -> {
            ClusterSnapshot snapshot = source.capture();
            return cycleService.runCycle(snapshot, cleanupMode, () -> cancelled.get() || shuttingDown.get());
        });

        try {
            EvaluationReport report = cycle.get(timeoutMillis, TimeUnit.MILLISECONDS);
            publish(report);
        } catch (TimeoutException e) {
            cancelled.set(true);
            cycle.cancel(true);
            log.error("Evaluation cycle exceeded {}ms and was cancelled", timeoutMillis);
        } catch (InterruptedException e) {
            cancelled.set(true);
            cycle.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Monitoring interrupted, evaluation cycle cancelled");
        } catch (ExecutionException e) {
            log.error("Evaluation cycle failed: {}", e.getCause().getMessage(), e.getCause());
        }
    }

    private void publish(EvaluationReport report) {
        List<EvaluationReportListener> targets = listeners.orderedStream().toList();
        for (EvaluationReportListener listener : targets) {
            try {
                listener.onReport(report);
            } catch (RuntimeException e) {
                log.error("Report listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        log.debug("Published evaluation report to {} listeners", targets.size());
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        cycleRunner.shutdownNow();
        log.info("Monitoring stopped");
    }
}
