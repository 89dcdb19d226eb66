package com.observatory.anomaly;

import com.observatory.anomaly.model.MetricSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Hourly samples of a steady service. {@link #steady} cycles every feature through the same nine
 * offsets with a different phase; {@link #jitteredSeries} draws uniform seeded noise, so new
 * marginal extremes keep appearing.
 */
public final class Fixtures {

  public static final Instant T0 = Instant.parse("2026-01-05T00:00:00Z");

  private static final int[] OFFSETS = {0, 3, -5, 2, 5, -2, 4, -3, 1};

  private Fixtures() {}

  public static Instant hour(int i) {
    return T0.plus(Duration.ofHours(i));
  }

  public static MetricSample steady(String service, int i) {
    return sample(service, i, 0.010 + 0.0004 * OFFSETS[(i + 2) % 9]);
  }

  public static MetricSample withErrorRate(String service, int i, double errorRate) {
    return sample(service, i, errorRate);
  }

  public static List<MetricSample> steadySeries(String service, int count) {
    List<MetricSample> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) out.add(steady(service, i));
    return out;
  }

  /** request_rate 100±5, error_rate 0.01±0.002, latencies and resources with small uniform noise. */
  public static List<MetricSample> jitteredSeries(String service, long seed, int count) {
    Random random = new Random(seed);
    List<MetricSample> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      double requestRate = 100.0 + (random.nextDouble() * 2.0 - 1.0) * 5.0;
      double errorRate = 0.01 + (random.nextDouble() * 2.0 - 1.0) * 0.002;
      double p95 = 120.0 + (random.nextDouble() * 2.0 - 1.0) * 0.5;
      double p99 = 180.0 + (random.nextDouble() * 2.0 - 1.0) * 0.5;
      double cpu = 0.4 + (random.nextDouble() * 2.0 - 1.0) * 0.004;
      double memory = 0.55 + (random.nextDouble() * 2.0 - 1.0) * 0.004;
      out.add(new MetricSample(service, hour(i), requestRate, errorRate, 90.0, p95, p99, cpu, memory, 0, 3));
    }
    return out;
  }

  public static MetricSample withErrorRate(MetricSample s, double errorRate) {
    return new MetricSample(s.serviceName(), s.timestamp(), s.requestRate(), errorRate, s.latencyP50(), s.latencyP95(),
        s.latencyP99(), s.cpuUsage(), s.memoryUsage(), s.restartCount(), s.podCount());
  }

  private static MetricSample sample(String service, int i, double errorRate) {
    return new MetricSample(
        service,
        hour(i),
        100.0 + OFFSETS[i % 9],
        errorRate,
        90.0,
        120.0 + 0.6 * OFFSETS[(i + 4) % 9],
        180.0 + 0.8 * OFFSETS[(i + 6) % 9],
        0.40 + 0.004 * OFFSETS[(i + 1) % 9],
        0.55 + 0.004 * OFFSETS[(i + 3) % 9],
        0,
        3);
  }
}
