package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.Feature;

/**
 * Smaller empirical tail probability of the current value of one feature.
 *
 * @param aboveMedian whether the current value lies above the historical median
 * @param excursion distance beyond the historical min/max in units of the historical range; 0 inside the
 *                  range, infinite when the history is constant and the current value differs
 */
public record TailProbability(Feature feature, double probability, boolean aboveMedian, double excursion) {}
