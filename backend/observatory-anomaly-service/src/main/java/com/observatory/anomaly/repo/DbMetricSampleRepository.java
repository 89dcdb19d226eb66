package com.observatory.anomaly.repo;

import com.observatory.anomaly.entity.DbMetricSample;
import java.time.Instant;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DbMetricSampleRepository extends JpaRepository<DbMetricSample, Long> {
  Optional<DbMetricSample> findFirstByServiceNameOrderByTimestampDesc(String serviceName);

  List<DbMetricSample> findByServiceNameAndTimestampAfterOrderByTimestampDesc(String serviceName, Instant since, Pageable pageable);

  List<DbMetricSample> findByServiceNameAndTimestampGreaterThanEqualOrderByTimestampAsc(String serviceName, Instant since);
}
