package com.observatory.anomaly.repo;

import com.observatory.anomaly.entity.DbAnomalyRecord;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface DbAnomalyRecordRepository extends JpaRepository<DbAnomalyRecord, Long>, JpaSpecificationExecutor<DbAnomalyRecord> {
  Optional<DbAnomalyRecord> findFirstByServiceNameAndTimestampOrderByIdDesc(String serviceName, Instant timestamp);
}
