package com.mk.fx.qa.perf.execution.metrics;

import java.util.Arrays;
import java.util.List;

/**
 * Latency distribution over a set of samples in milliseconds. An empty population reports zero for
 * every figure.
 */
public record LatencyStats(
    double minMs, double maxMs, double avgMs, double p50Ms, double p95Ms, double p99Ms, int samples) {

  public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0, 0);

  public static LatencyStats of(List<Double> latencies) {
    if (latencies == null || latencies.isEmpty()) {
      return EMPTY;
    }
    double[] sorted = latencies.stream().mapToDouble(Double::doubleValue).toArray();
    Arrays.sort(sorted);
    double sum = 0;
    for (double v : sorted) {
      sum += v;
    }
    return new LatencyStats(
        sorted[0],
        sorted[sorted.length - 1],
        sum / sorted.length,
        percentile(sorted, 50),
        percentile(sorted, 95),
        percentile(sorted, 99),
        sorted.length);
  }

  /** Nearest-rank percentile over sorted data. */
  static double percentile(double[] sorted, int p) {
    if (p < 0 || p > 100)
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    int c = sorted.length;
    int idx = Math.min(c - 1, Math.max(0, (int) Math.ceil((p / 100.0) * c) - 1));
    return sorted[idx];
  }
}
