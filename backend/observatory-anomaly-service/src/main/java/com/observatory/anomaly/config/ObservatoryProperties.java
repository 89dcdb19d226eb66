package com.observatory.anomaly.config;

import com.observatory.anomaly.detect.SeverityThresholds;
import com.observatory.anomaly.health.HealthPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bound from {@code observatory.*}. Missing sections fall back to defaults; invalid values fail startup.
 */
@ConfigurationProperties(prefix = "observatory")
public record ObservatoryProperties(
    Scheduler scheduler,
    Source source,
    Detection detection,
    SeverityThresholds severity,
    HealthPolicy health,
    Collection collection
) {

  public ObservatoryProperties {
    scheduler = scheduler == null ? new Scheduler(null, null, null, null, null) : scheduler;
    source = source == null ? new Source(null, null) : source;
    detection = detection == null ? new Detection(null, null, null, null, null, null, null, null, null, null) : detection;
    severity = severity == null ? SeverityThresholds.DEFAULTS : severity;
    health = health == null ? HealthPolicy.DEFAULTS : health;
    collection = collection == null ? new Collection(null, null) : collection;
  }

  public record Scheduler(
      Boolean enabled,
      Duration period,
      Duration initialDelay,
      Integer workerThreads,
      Duration shutdownGrace
  ) {
    public Scheduler {
      enabled = enabled == null ? Boolean.TRUE : enabled;
      period = period == null ? Duration.ofSeconds(60) : period;
      initialDelay = initialDelay == null ? Duration.ofSeconds(5) : initialDelay;
      workerThreads = workerThreads == null ? 4 : workerThreads;
      shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
      requirePositive("observatory.scheduler.period", period);
      requirePositive("observatory.scheduler.shutdown-grace", shutdownGrace);
      if (initialDelay.isNegative()) {
        throw new IllegalArgumentException("observatory.scheduler.initial-delay must not be negative");
      }
      if (workerThreads < 1) {
        throw new IllegalArgumentException("observatory.scheduler.worker-threads must be >= 1, got " + workerThreads);
      }
    }
  }

  public record Source(String baseUrl, Duration timeout) {
    public Source {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:9090" : baseUrl;
      timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
      requirePositive("observatory.source.timeout", timeout);
    }
  }

  public record Detection(
      Integer minWindowSize,
      Integer maxWindowSize,
      Duration lookback,
      Integer treeCount,
      Integer maxDepth,
      Long seed,
      Double tailProbabilityFloor,
      Double attributionThreshold,
      Double rankWeight,
      Double excursionScale
  ) {
    public static final int MIN_WINDOW_FLOOR = 10;

    public Detection {
      minWindowSize = minWindowSize == null ? MIN_WINDOW_FLOOR : minWindowSize;
      maxWindowSize = maxWindowSize == null ? 1440 : maxWindowSize;
      lookback = lookback == null ? Duration.ofHours(24) : lookback;
      treeCount = treeCount == null ? 100 : treeCount;
      maxDepth = maxDepth == null ? 0 : maxDepth;
      seed = seed == null ? 42L : seed;
      tailProbabilityFloor = tailProbabilityFloor == null ? 1e-9 : tailProbabilityFloor;
      attributionThreshold = attributionThreshold == null ? 0.05 : attributionThreshold;
      rankWeight = rankWeight == null ? 0.4 : rankWeight;
      excursionScale = excursionScale == null ? 3.0 : excursionScale;
      if (minWindowSize < MIN_WINDOW_FLOOR) {
        throw new IllegalArgumentException(
            "observatory.detection.min-window-size must be >= " + MIN_WINDOW_FLOOR + ", got " + minWindowSize);
      }
      if (maxWindowSize < minWindowSize) {
        throw new IllegalArgumentException("observatory.detection.max-window-size must be >= min-window-size");
      }
      requirePositive("observatory.detection.lookback", lookback);
      if (treeCount < 1) {
        throw new IllegalArgumentException("observatory.detection.tree-count must be >= 1, got " + treeCount);
      }
      if (maxDepth < 0) {
        throw new IllegalArgumentException("observatory.detection.max-depth must be >= 0, got " + maxDepth);
      }
      if (tailProbabilityFloor <= 0.0 || tailProbabilityFloor >= 0.5) {
        throw new IllegalArgumentException("observatory.detection.tail-probability-floor must lie in (0,0.5)");
      }
      if (attributionThreshold <= 0.0 || attributionThreshold > 0.5) {
        throw new IllegalArgumentException("observatory.detection.attribution-threshold must lie in (0,0.5]");
      }
      if (rankWeight <= 0.0 || rankWeight > 1.0) {
        throw new IllegalArgumentException("observatory.detection.rank-weight must lie in (0,1], got " + rankWeight);
      }
      if (excursionScale <= 0.0) {
        throw new IllegalArgumentException("observatory.detection.excursion-scale must be positive, got " + excursionScale);
      }
    }
  }

  public record Collection(Duration backfillWindow, Duration backfillStep) {
    public Collection {
      backfillWindow = backfillWindow == null ? Duration.ofHours(2) : backfillWindow;
      backfillStep = backfillStep == null ? Duration.ofMinutes(1) : backfillStep;
      requirePositive("observatory.collection.backfill-window", backfillWindow);
      requirePositive("observatory.collection.backfill-step", backfillStep);
    }
  }

  private static void requirePositive(String key, Duration value) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(key + " must be positive, got " + value);
    }
  }
}
