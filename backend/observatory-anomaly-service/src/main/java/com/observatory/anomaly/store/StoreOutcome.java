package com.observatory.anomaly.store;

public enum StoreOutcome {
  STORED,
  DUPLICATE
}
