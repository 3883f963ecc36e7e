package com.homeostat.core.sensor;

import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.mode.ConstraintSet;
import com.homeostat.core.mode.ModeView;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically reads every {@link MetricCollector} into a {@link MetricSample}, keeps the
 * rolling {@link MetricWindow}, and forwards samples and threshold-crossing
 * {@link ControlSignal}s to the registered {@link MetricSink}s.
 * <p>
 * The next cycle is always scheduled, whatever the outcome of the current one; the active
 * mode only changes how soon.
 */
@Service
public class MetricSampler {

    private static final Logger log = LoggerFactory.getLogger(MetricSampler.class);

    private final List<MetricCollector> collectors;
    private final List<MetricSink> sinks;
    private final ModeView modeView;
    private final EventBus eventBus;
    private final HomeostatMetrics metrics;
    private final Clock clock;
    private final HomeostatProperties.Sampler config;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "metric-sampler");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger collectorThreads = new AtomicInteger();
    private final ExecutorService collectorPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "metric-collector-" + collectorThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<MetricWindow> window;
    private final ArrayDeque<ControlSignal> recentSignals = new ArrayDeque<>();
    /** Metrics currently above their threshold; sampler-thread confined. */
    private final Set<String> exceeded = new HashSet<>();
    private volatile Instant lastCycleAt;
    private volatile boolean running;

    @Autowired
    public MetricSampler(List<MetricCollector> collectors, List<MetricSink> sinks, ModeView modeView,
                         EventBus eventBus, HomeostatMetrics metrics, Clock clock,
                         HomeostatProperties properties) {
        this.collectors = List.copyOf(collectors);
        this.sinks = List.copyOf(sinks);
        this.modeView = modeView;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getSampler();
        this.window = new AtomicReference<>(MetricWindow.empty(config.getWindowCapacity()));
    }

    @PostConstruct
    void start() {
        if (!config.isEnabled()) {
            log.info("Metric sampling disabled by configuration");
            return;
        }
        running = true;
        scheduler.execute(this::cycle);
        log.info("Metric sampler started with {} collectors (default interval={}s)",
                collectors.size(), config.getInterval().toSeconds());
    }

    @PreDestroy
    void stop() {
        running = false;
        scheduler.shutdownNow();
        collectorPool.shutdownNow();
        log.info("Metric sampler stopped");
    }

    /**
     * Collects one reading from each collector, each bounded by the collector timeout.
     * Failed or slow collectors are left out of the sample.
     */
    public MetricSample sample() {
        Instant timestamp = clock.instant();
        var futures = new LinkedHashMap<MetricCollector, Future<Double>>();
        for (MetricCollector collector : collectors) {
            Callable<Double> read = collector::collect;
            futures.put(collector, collectorPool.submit(read));
        }

        long deadline = System.nanoTime() + config.getCollectorTimeout().toNanos();
        var readings = new LinkedHashMap<String, Double>();
        for (var entry : futures.entrySet()) {
            String metric = entry.getKey().metric();
            Future<Double> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                readings.put(metric, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                degraded(metric, "timeout", "no reading within " + config.getCollectorTimeout().toMillis() + "ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                String reason = cause instanceof CollectionException ? "unavailable" : "error";
                degraded(metric, reason, String.valueOf(cause.getMessage()));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                degraded(metric, "interrupted", "sampling interrupted");
                break;
            }
        }
        metrics.recordSampleSize(readings.size());
        return MetricSample.system(timestamp, readings);
    }

    /** Samples newer than {@code now - duration}. */
    public MetricWindow window(Duration duration) {
        return window.get().newerThan(clock.instant().minus(duration));
    }

    public MetricWindow snapshot() {
        return window.get();
    }

    public Optional<MetricSample> latest() {
        return window.get().latest();
    }

    /** Signals emitted at or after {@code since}, oldest first. */
    public List<ControlSignal> signalsSince(Instant since) {
        synchronized (recentSignals) {
            return recentSignals.stream()
                    .filter(s -> !s.timestamp().isBefore(since))
                    .toList();
        }
    }

    public boolean isRunning() {
        return running && !scheduler.isShutdown();
    }

    public Optional<Instant> lastCycleAt() {
        return Optional.ofNullable(lastCycleAt);
    }

    /**
     * Takes one sample, appends it to the window and forwards it and any signals to the sinks.
     */
    void sampleAndDispatch() {
        MetricSample sample = sample();
        window.updateAndGet(w -> w.append(sample));
        lastCycleAt = sample.timestamp();

        List<ControlSignal> signals = detectSignals(sample, modeView.current().constraints());
        for (MetricSink sink : sinks) {
            sink.onSample(sample);
        }
        for (ControlSignal signal : signals) {
            remember(signal);
            log.info("Control signal {} on {}={}", signal.name(), signal.metric(), signal.value());
            eventBus.publish(new HomeostatEvent(HomeostatEvent.CONTROL_SIGNAL, null,
                    Map.of("signal", signal.name(), "metric", signal.metric(), "value", signal.value()),
                    signal.timestamp()));
            for (MetricSink sink : sinks) {
                sink.onSignal(signal);
            }
        }
    }

    /**
     * Edge-triggered: one signal when a reading rises above its threshold, one when it
     * falls back to or below it.
     */
    List<ControlSignal> detectSignals(MetricSample sample, ConstraintSet constraints) {
        var signals = new ArrayList<ControlSignal>();
        constraints.signalThresholds().forEach((metric, threshold) ->
                sample.value(metric).ifPresent(value -> {
                    if (value > threshold && exceeded.add(metric)) {
                        signals.add(ControlSignal.exceeded(metric, value, sample.timestamp()));
                    } else if (value <= threshold && exceeded.remove(metric)) {
                        signals.add(ControlSignal.recovered(metric, value, sample.timestamp()));
                    }
                }));
        return signals;
    }

    private void cycle() {
        try {
            sampleAndDispatch();
        } catch (RuntimeException e) {
            log.error("Sampling cycle failed, continuing: {}", e.getMessage(), e);
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (!running || scheduler.isShutdown()) {
            return;
        }
        Duration interval = currentInterval();
        try {
            scheduler.schedule(this::cycle, interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Sampler shutting down, next cycle not scheduled");
        }
    }

    Duration currentInterval() {
        return modeView.current().constraints().samplingIntervalOverride().orElse(config.getInterval());
    }

    private void remember(ControlSignal signal) {
        synchronized (recentSignals) {
            recentSignals.addLast(signal);
            while (recentSignals.size() > config.getSignalHistory()) {
                recentSignals.removeFirst();
            }
        }
    }

    private void degraded(String metric, String reason, String detail) {
        log.warn("Collector {} degraded ({}): {}", metric, reason, detail);
        metrics.recordCollectorFailure(metric, reason);
    }
}
