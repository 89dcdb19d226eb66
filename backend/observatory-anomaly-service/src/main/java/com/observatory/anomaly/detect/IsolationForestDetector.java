package com.observatory.anomaly.detect;

import java.util.Arrays;
import java.util.Random;

/**
 * Isolation forest over the whole window, history and current vector together. Points that are
 * separated from the rest after few random splits score close to 1.
 *
 * <p>Each split picks a dimension with probability proportional to the node's range in that
 * dimension divided by the window-wide interquartile range of the dimension (population standard
 * deviation when the IQR is zero), then a split value uniformly inside the node's range. Dimensions
 * that are constant at the node are never picked. Every evaluation starts from a fresh
 * {@link Random} with the configured seed, so equal windows give equal scores.
 */
public class IsolationForestDetector implements OutlierDetector {

  private final int treeCount;
  private final int maxDepth;
  private final long seed;

  /**
   * @param maxDepth depth limit per tree, or 0 for {@code ceil(log2 n)}
   */
  public IsolationForestDetector(int treeCount, int maxDepth, long seed) {
    if (treeCount < 1) throw new IllegalArgumentException("treeCount must be >= 1");
    if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
    this.treeCount = treeCount;
    this.maxDepth = maxDepth;
    this.seed = seed;
  }

  @Override
  public DetectorKind kind() {
    return DetectorKind.ISOLATION;
  }

  @Override
  public DetectorScore score(FeatureMatrix window) {
    double[][] rows = window.rows();
    int n = rows.length;
    int depthLimit = maxDepth > 0 ? maxDepth : Math.max(1, ceilLog2(n));
    double[] spreads = spreads(rows);
    double[] current = window.current();
    Random random = new Random(seed);

    int[] all = new int[n];
    for (int i = 0; i < n; i++) all[i] = i;

    double totalPath = 0.0;
    for (int t = 0; t < treeCount; t++) {
      Node root = grow(rows, all, 0, depthLimit, spreads, random);
      totalPath += pathLength(root, current);
    }
    double meanPath = totalPath / treeCount;
    double score = Math.pow(2.0, -meanPath / averagePathLength(n));
    return new DetectorScore(DetectorKind.ISOLATION, meanPath, Math.min(1.0, Math.max(0.0, score)));
  }

  private Node grow(double[][] rows, int[] indices, int depth, int depthLimit, double[] spreads, Random random) {
    if (indices.length <= 1 || depth >= depthLimit) {
      return Node.leaf(indices.length);
    }
    int dimensions = rows[0].length;
    double[] lows = new double[dimensions];
    double[] highs = new double[dimensions];
    double[] weights = new double[dimensions];
    double totalWeight = 0.0;
    for (int d = 0; d < dimensions; d++) {
      double lo = rows[indices[0]][d];
      double hi = lo;
      for (int i : indices) {
        lo = Math.min(lo, rows[i][d]);
        hi = Math.max(hi, rows[i][d]);
      }
      lows[d] = lo;
      highs[d] = hi;
      weights[d] = hi > lo ? (hi - lo) / spreads[d] : 0.0;
      totalWeight += weights[d];
    }
    if (totalWeight <= 0.0) {
      return Node.leaf(indices.length);
    }

    double r = random.nextDouble() * totalWeight;
    double cumulative = 0.0;
    int dimension = -1;
    for (int d = 0; d < dimensions; d++) {
      if (weights[d] <= 0.0) continue;
      dimension = d;
      cumulative += weights[d];
      if (r < cumulative) break;
    }
    double split = lows[dimension] + random.nextDouble() * (highs[dimension] - lows[dimension]);

    int leftCount = 0;
    for (int i : indices) {
      if (rows[i][dimension] < split) leftCount++;
    }
    int[] left = new int[leftCount];
    int[] right = new int[indices.length - leftCount];
    int l = 0;
    int rr = 0;
    for (int i : indices) {
      if (rows[i][dimension] < split) left[l++] = i;
      else right[rr++] = i;
    }
    Node leftChild = grow(rows, left, depth + 1, depthLimit, spreads, random);
    Node rightChild = grow(rows, right, depth + 1, depthLimit, spreads, random);
    return new Node(dimension, split, leftChild, rightChild, indices.length);
  }

  private static double pathLength(Node root, double[] point) {
    Node node = root;
    int depth = 0;
    while (!node.isLeaf()) {
      node = point[node.dimension()] < node.split() ? node.left() : node.right();
      depth++;
    }
    return depth + averagePathLength(node.size());
  }

  /** Average unsuccessful-search path length of a binary search tree over {@code n} points. */
  static double averagePathLength(int n) {
    if (n <= 1) return 0.0;
    if (n == 2) return 1.0;
    double harmonic = 0.0;
    for (int k = 1; k < n; k++) harmonic += 1.0 / k;
    return 2.0 * harmonic - 2.0 * (n - 1) / n;
  }

  static double[] spreads(double[][] rows) {
    int dimensions = rows[0].length;
    double[] out = new double[dimensions];
    for (int d = 0; d < dimensions; d++) {
      double[] sorted = new double[rows.length];
      for (int i = 0; i < rows.length; i++) sorted[i] = rows[i][d];
      Arrays.sort(sorted);
      double spread = quantile(sorted, 0.75) - quantile(sorted, 0.25);
      if (spread <= 0.0) {
        double sum = 0.0;
        for (double v : sorted) sum += v;
        double mean = sum / sorted.length;
        double squares = 0.0;
        for (double v : sorted) squares += (v - mean) * (v - mean);
        spread = Math.sqrt(squares / sorted.length);
      }
      out[d] = spread;
    }
    return out;
  }

  static double quantile(double[] sorted, double p) {
    double pos = p * (sorted.length - 1);
    int lo = (int) Math.floor(pos);
    int hi = Math.min(lo + 1, sorted.length - 1);
    return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
  }

  static int ceilLog2(int n) {
    return n <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(n - 1);
  }

  private record Node(int dimension, double split, Node left, Node right, int size) {
    static Node leaf(int size) {
      return new Node(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
      return left == null;
    }
  }
}
