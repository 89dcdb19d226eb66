package com.observatory.anomaly.repo;

import com.observatory.anomaly.entity.DbService;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DbServiceRepository extends JpaRepository<DbService, Long> {
  Optional<DbService> findByServiceName(String serviceName);

  List<DbService> findAllByOrderByServiceNameAsc();

  List<DbService> findByStatusOrderByServiceNameAsc(String status);
}
