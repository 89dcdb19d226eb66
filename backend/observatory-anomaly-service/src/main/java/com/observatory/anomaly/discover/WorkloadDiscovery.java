package com.observatory.anomaly.discover;

import java.util.List;

/**
 * Lists the workloads of one container platform. Implementations throw
 * {@link com.observatory.anomaly.error.DiscoveryUnavailableException} when the platform cannot be asked.
 */
public interface WorkloadDiscovery {

  /** "docker" or "kubernetes". */
  String platform();

  List<DiscoveredWorkload> discover();
}
