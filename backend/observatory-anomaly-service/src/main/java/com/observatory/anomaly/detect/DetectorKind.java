package com.observatory.anomaly.detect;

public enum DetectorKind {
  EMPIRICAL_TAIL,
  ISOLATION
}
