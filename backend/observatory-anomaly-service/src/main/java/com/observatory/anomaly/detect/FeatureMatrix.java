package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.Feature;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Window of feature vectors ordered oldest first. The last row is the sample being scored,
 * every other row is its history.
 */
public final class FeatureMatrix {

  private final String serviceName;
  private final List<Instant> timestamps;
  private final double[][] rows;

  public FeatureMatrix(String serviceName, List<Instant> timestamps, double[][] rows) {
    if (rows.length < 2) {
      throw new IllegalArgumentException("A window needs at least two vectors, got " + rows.length);
    }
    if (timestamps.size() != rows.length) {
      throw new IllegalArgumentException("Timestamps and rows differ in length");
    }
    for (double[] row : rows) {
      if (row.length != Feature.VECTOR.size()) {
        throw new IllegalArgumentException("Feature vectors must have " + Feature.VECTOR.size() + " dimensions");
      }
    }
    this.serviceName = serviceName;
    this.timestamps = List.copyOf(timestamps);
    this.rows = rows;
  }

  public String serviceName() { return serviceName; }

  public int size() { return rows.length; }

  public int historySize() { return rows.length - 1; }

  public int dimensions() { return Feature.VECTOR.size(); }

  public double value(int row, int dimension) { return rows[row][dimension]; }

  public double[] current() { return rows[rows.length - 1].clone(); }

  public Instant currentTimestamp() { return timestamps.get(timestamps.size() - 1); }

  /** Values of one dimension over the history, unsorted. */
  public double[] historyColumn(int dimension) {
    double[] column = new double[historySize()];
    for (int i = 0; i < column.length; i++) column[i] = rows[i][dimension];
    return column;
  }

  double[][] rows() { return rows; }

  @Override
  public String toString() {
    return "FeatureMatrix{" + serviceName + ", size=" + rows.length + ", current=" + Arrays.toString(current()) + "}";
  }
}
