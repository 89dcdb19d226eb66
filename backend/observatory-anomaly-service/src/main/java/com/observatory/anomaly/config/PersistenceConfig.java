package com.observatory.anomaly.config;

import com.observatory.anomaly.entity.DbMetricSample;
import com.observatory.anomaly.repo.DbMetricSampleRepository;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Lets applications outside {@code com.observatory.anomaly} pick up the store's entities and repositories.
 */
@Configuration
@EntityScan(basePackageClasses = DbMetricSample.class)
@EnableJpaRepositories(basePackageClasses = DbMetricSampleRepository.class)
public class PersistenceConfig {
}
