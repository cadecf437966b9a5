package com.papertrail.core.redflag;

import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.logging.LogContext;
import com.papertrail.core.metrics.MetricsService;
import com.papertrail.core.metrics.NoOpMetricsService;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.redflag.detectors.AuditRepeatDetector;
import com.papertrail.core.redflag.detectors.CampaignConnectionDetector;
import com.papertrail.core.redflag.detectors.CircularSubcontractingDetector;
import com.papertrail.core.redflag.detectors.CollusionRingDetector;
import com.papertrail.core.redflag.detectors.ConcentrationDetector;
import com.papertrail.core.redflag.detectors.GeographicAnomalyDetector;
import com.papertrail.core.redflag.detectors.IdenticalBidAmountsDetector;
import com.papertrail.core.redflag.detectors.PhoenixCompanyDetector;
import com.papertrail.core.redflag.detectors.PoliticalConnectionDetector;
import com.papertrail.core.redflag.detectors.ShellCompanyDetector;
import com.papertrail.core.redflag.detectors.ShellNetworkDetector;
import com.papertrail.core.redflag.detectors.SingleBidderDetector;
import com.papertrail.core.redflag.detectors.SplitContractsDetector;
import com.papertrail.core.redflag.detectors.TimingClusterDetector;
import com.papertrail.core.tracing.NoOpTracingService;
import com.papertrail.core.tracing.Span;
import com.papertrail.core.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans the detector battery out over a thread pool against one read-only
 * context and collects the results.
 *
 * <p>A detector that throws or exceeds its timeout is reported as a
 * {@link DetectorFailure}; it never prevents the other detectors' flags from
 * being returned.</p>
 */
public class RedFlagEngine {
    private static final Logger log = LoggerFactory.getLogger(RedFlagEngine.class);

    private static final Comparator<RedFlag> FLAG_ORDER = Comparator
            .comparing(RedFlag::getType)
            .thenComparing(f -> String.join(",", f.getSubjectIds()))
            .thenComparing(RedFlag::getSeverity)
            .thenComparing(f -> f.getEvidence().toString());

    private final List<RedFlagDetector> detectors;
    private final MetricsService metrics;
    private final TracingService tracing;

    public RedFlagEngine(List<RedFlagDetector> detectors, MetricsService metrics, TracingService tracing) {
        this.detectors = List.copyOf(detectors);
        this.metrics = metrics;
        this.tracing = tracing;
    }

    public RedFlagEngine(List<RedFlagDetector> detectors) {
        this(detectors, new NoOpMetricsService(), new NoOpTracingService());
    }

    /**
     * The full detector battery.
     */
    public static List<RedFlagDetector> standardDetectors() {
        return List.of(
                new SingleBidderDetector(),
                new IdenticalBidAmountsDetector(),
                new SplitContractsDetector(),
                new ConcentrationDetector(),
                new CollusionRingDetector(),
                new PhoenixCompanyDetector(),
                new CircularSubcontractingDetector(),
                new AuditRepeatDetector(),
                new ShellCompanyDetector(),
                new CampaignConnectionDetector(),
                new PoliticalConnectionDetector(),
                new GeographicAnomalyDetector(),
                new TimingClusterDetector(),
                new ShellNetworkDetector());
    }

    public List<RedFlagDetector> getDetectors() {
        return detectors;
    }

    /**
     * Runs every detector. Each detector's timeout starts when it starts
     * running, so detectors queued behind others keep their full budget. A
     * detector past its timeout is interrupted and reported. Collection gives
     * up after {@code timeout * (rounds + 1)}, where rounds is the number of
     * pool waves, in case a detector ignores interruption and starves the
     * queue.
     */
    public DetectionResult run(DetectionContext context) {
        DetectionOptions options = context.options();
        int threads = Math.max(1, Math.min(options.getParallelism(), detectors.size()));
        long timeoutNanos = options.getDetectorTimeout().toNanos();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor();
        List<RedFlag> flags = new ArrayList<>();
        List<DetectorFailure> failures = new ArrayList<>();
        try {
            List<DetectorTask> tasks = new ArrayList<>();
            for (RedFlagDetector detector : detectors) {
                DetectorTask task = new DetectorTask(detector, () -> runOne(detector, context), watchdog,
                        timeoutNanos);
                tasks.add(task);
                executor.execute(task);
            }
            long rounds = (detectors.size() + threads - 1) / threads;
            long guard = System.nanoTime() + saturatedMultiply(timeoutNanos, rounds + 1);
            for (DetectorTask task : tasks) {
                String name = task.detector.getName();
                try {
                    long remaining = Math.max(0, guard - System.nanoTime());
                    List<RedFlag> produced = task.get(remaining, TimeUnit.NANOSECONDS);
                    flags.addAll(produced);
                    produced.forEach(f -> metrics.recordRedFlag(f.getType(), f.getSeverity()));
                } catch (CancellationException | TimeoutException e) {
                    task.cancel(true);
                    fail(failures, DetectorFailure.timeout(name, options.getDetectorTimeout().toMillis()), null);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    fail(failures, DetectorFailure.of(name, cause), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    fail(failures, DetectorFailure.of(name, e), e);
                }
            }
        } finally {
            executor.shutdownNow();
            watchdog.shutdownNow();
        }

        flags.sort(FLAG_ORDER);
        log.info("detect.completed detectors={} flags={} failures={}", detectors.size(), flags.size(), failures.size());
        return new DetectionResult(flags, failures);
    }

    private static long saturatedMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        return (high == 0 && low >= 0) ? low : Long.MAX_VALUE;
    }

    private List<RedFlag> runOne(RedFlagDetector detector, DetectionContext context) {
        try (LogContext ignored = LogContext.forDetector(context.runId(), detector.getName());
             Span span = tracing.detectorSpan(context.runId(), detector.getName())) {
            try {
                List<RedFlag> flags = detector.detect(context);
                span.count("flags", flags.size());
                span.succeeded();
                log.debug("detector.completed flags={}", flags.size());
                return flags;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }

    /**
     * One detector run whose timeout is armed when a pool thread picks it up.
     */
    private static final class DetectorTask extends FutureTask<List<RedFlag>> {

        private final RedFlagDetector detector;
        private final ScheduledExecutorService watchdog;
        private final long timeoutNanos;

        DetectorTask(RedFlagDetector detector, Callable<List<RedFlag>> work, ScheduledExecutorService watchdog,
                     long timeoutNanos) {
            super(work);
            this.detector = detector;
            this.watchdog = watchdog;
            this.timeoutNanos = timeoutNanos;
        }

        @Override
        public void run() {
            if (isDone()) {
                return;
            }
            ScheduledFuture<?> alarm = watchdog.schedule(() -> {
                if (cancel(true)) {
                    log.warn("detector.timed_out detector={} timeoutMs={}",
                            detector.getName(), TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
                }
            }, timeoutNanos, TimeUnit.NANOSECONDS);
            try {
                super.run();
            } finally {
                alarm.cancel(false);
            }
        }
    }

    private void fail(List<DetectorFailure> failures, DetectorFailure failure, Throwable cause) {
        failures.add(failure);
        metrics.recordDetectorFailure(failure.detector());
        if (cause != null) {
            log.error("detector.failed detector={} error={}", failure.detector(), failure.errorType(), cause);
        } else {
            log.error("detector.failed detector={} error={} message={}",
                    failure.detector(), failure.errorType(), failure.message());
        }
    }
}
