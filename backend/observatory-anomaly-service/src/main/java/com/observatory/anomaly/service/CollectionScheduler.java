package com.observatory.anomaly.service;

import com.observatory.anomaly.config.ObservatoryProperties;
import com.observatory.anomaly.discover.DiscoveryService;
import com.observatory.anomaly.error.PersistenceFailureException;
import com.observatory.anomaly.model.CollectionResult;
import com.observatory.anomaly.model.ServiceRegistration;
import com.observatory.anomaly.model.TickReport;
import com.observatory.anomaly.store.MetricStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives periodic collection. A single driver thread fires ticks at a fixed rate and fans each
 * active service out to a fixed worker pool. At most one collection per service is in flight;
 * a second request for a busy service joins the running one. Each tick first lets discovery
 * register new containers and pods, so they are collected in the same tick.
 */
@Component
public class CollectionScheduler implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(CollectionScheduler.class);

  private final ServiceCollector collector;
  private final MetricStore store;
  private final DiscoveryService discovery;
  private final Clock clock;
  private final ObservatoryProperties.Scheduler config;
  private volatile ExecutorService workers;
  private final ConcurrentMap<String, CompletableFuture<CollectionResult>> inFlight = new ConcurrentHashMap<>();
  private final MeterRegistry metrics;
  private final Counter ticks;
  private final Counter tickFailures;
  private final Timer tickDuration;

  private volatile ScheduledExecutorService driver;
  private volatile boolean running;

  public CollectionScheduler(ServiceCollector collector,
                             MetricStore store,
                             DiscoveryService discovery,
                             Clock clock,
                             ObservatoryProperties props,
                             MeterRegistry metrics) {
    this.collector = collector;
    this.store = store;
    this.discovery = discovery;
    this.clock = clock;
    this.config = props.scheduler();
    this.workers = newWorkerPool();
    this.metrics = metrics;
    this.ticks = metrics.counter("observatory_scheduler_ticks_total");
    this.tickFailures = metrics.counter("observatory_scheduler_tick_failures_total");
    this.tickDuration = metrics.timer("observatory_scheduler_tick_duration_seconds");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (workers.isShutdown()) {
      workers = newWorkerPool();
      log.info("[scheduler] Restarting with a fresh worker pool");
    }
    running = true;
    if (!config.enabled()) {
      log.info("[scheduler] Periodic collection disabled, manual collection only");
      return;
    }
    driver = Executors.newSingleThreadScheduledExecutor(threadFactory("observatory-tick"));
    driver.scheduleAtFixedRate(this::tickSafely,
        config.initialDelay().toMillis(), config.period().toMillis(), TimeUnit.MILLISECONDS);
    log.info("[scheduler] Started: period={} initialDelay={} workers={}",
        config.period(), config.initialDelay(), config.workerThreads());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    ScheduledExecutorService current = driver;
    driver = null;
    if (current != null) {
      current.shutdown();
    }
    drain(config.shutdownGrace());
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * Stops accepting work and waits up to {@code grace} for in-flight collections, then interrupts them.
   */
  public void drain(Duration grace) {
    ExecutorService pool = workers;
    pool.shutdown();
    try {
      if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        List<Runnable> dropped = pool.shutdownNow();
        log.warn("[scheduler] Grace period {} elapsed, interrupted workers ({} queued tasks dropped)",
            grace, dropped.size());
      } else {
        log.info("[scheduler] Drained");
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Queues a collection for {@code serviceName}, or returns the one already running for it.
   */
  public CompletableFuture<CollectionResult> submit(String serviceName) {
    CompletableFuture<CollectionResult> created = new CompletableFuture<>();
    CompletableFuture<CollectionResult> existing = inFlight.putIfAbsent(serviceName, created);
    if (existing != null) {
      log.debug("[submit] Collection for {} already in flight, joining it", serviceName);
      return existing;
    }
    try {
      workers.execute(() -> runCollection(serviceName, created));
    } catch (RejectedExecutionException e) {
      inFlight.remove(serviceName, created);
      created.completeExceptionally(new IllegalStateException("Collection pool is shut down", e));
    }
    return created;
  }

  private void runCollection(String serviceName, CompletableFuture<CollectionResult> future) {
    CollectionResult result;
    try {
      result = collector.collect(serviceName);
    } catch (RuntimeException e) {
      log.error("[collect] Unexpected failure for {}: {}", serviceName, e.getMessage(), e);
      result = CollectionResult.failed(serviceName, e.getMessage());
    } finally {
      inFlight.remove(serviceName, future);
    }
    future.complete(result);
  }

  public TickReport runTick() {
    Instant startedAt = clock.instant();
    long startNanos = System.nanoTime();
    ticks.increment();
    log.info("[tick] Started at {}", startedAt);
    discovery.refreshIfDue(startedAt);

    List<ServiceRegistration> services;
    try {
      services = store.activeServices();
    } catch (PersistenceFailureException e) {
      tickFailures.increment();
      log.error("[tick] Could not list services: {}", e.getMessage());
      return new TickReport(startedAt, 0, 0, 0, 0, 0, 0, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    Map<String, CompletableFuture<CollectionResult>> pending = new LinkedHashMap<>();
    for (ServiceRegistration service : services) {
      pending.put(service.serviceName(), submit(service.serviceName()));
    }

    long deadline = startNanos + config.period().toNanos();
    int stored = 0;
    int duplicates = 0;
    int noData = 0;
    int failed = 0;
    int anomalies = 0;
    for (Map.Entry<String, CompletableFuture<CollectionResult>> entry : pending.entrySet()) {
      CollectionResult result;
      try {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        result = entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        log.warn("[tick] Collection for {} still running at the end of the tick", entry.getKey());
        result = CollectionResult.failed(entry.getKey(), "collection exceeded tick period");
      } catch (ExecutionException e) {
        result = CollectionResult.failed(entry.getKey(), e.getCause().getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("[tick] Interrupted while waiting for collections");
        break;
      }
      metrics.counter("observatory_collection_outcomes_total", "outcome", result.outcome().name().toLowerCase(Locale.ROOT))
          .increment();
      switch (result.outcome()) {
        case STORED -> stored++;
        case DUPLICATE -> duplicates++;
        case NO_DATA -> noData++;
        case FAILED -> failed++;
      }
      if (result.anomalyDetected()) anomalies++;
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    tickDuration.record(elapsed);
    TickReport report = new TickReport(startedAt, services.size(), stored, duplicates, noData, failed, anomalies, elapsed);
    log.info("[tick] Finished in {} ms: services={} stored={} duplicates={} noData={} failed={} anomalies={}",
        elapsed.toMillis(), report.services(), stored, duplicates, noData, failed, anomalies);
    return report;
  }

  private void tickSafely() {
    try {
      runTick();
    } catch (RuntimeException e) {
      tickFailures.increment();
      log.error("[tick] Tick failed: {}", e.getMessage(), e);
    }
  }

  private ExecutorService newWorkerPool() {
    return Executors.newFixedThreadPool(config.workerThreads(), threadFactory("observatory-collector"));
  }

  private static ThreadFactory threadFactory(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
