package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.Severity;

import java.util.List;
import java.util.stream.Collectors;

final class AnomalyDescriber {

  private AnomalyDescriber() {}

  static String describe(String serviceName, Severity severity, List<TailProbability> attributed) {
    String head = severity.displayName() + " anomaly on " + serviceName + ": ";
    if (attributed.isEmpty()) {
      return head + "unusual combination of metrics";
    }
    return head + attributed.stream()
        .map(t -> t.feature().metricName() + (t.aboveMedian() ? " above" : " below") + " historical norm")
        .collect(Collectors.joining(", "));
  }
}
