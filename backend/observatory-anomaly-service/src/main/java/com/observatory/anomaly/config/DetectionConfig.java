package com.observatory.anomaly.config;

import com.observatory.anomaly.detect.AnomalyEnsemble;
import com.observatory.anomaly.detect.EmpiricalTailDetector;
import com.observatory.anomaly.detect.FeatureExtractor;
import com.observatory.anomaly.detect.IsolationForestDetector;
import com.observatory.anomaly.health.HealthScorer;
import com.observatory.anomaly.store.MetricStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ObservatoryProperties.class)
public class DetectionConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public FeatureExtractor featureExtractor(MetricStore store, Clock clock, ObservatoryProperties props) {
    ObservatoryProperties.Detection detection = props.detection();
    return new FeatureExtractor(store, clock, detection.minWindowSize(), detection.maxWindowSize(), detection.lookback());
  }

  @Bean
  public AnomalyEnsemble anomalyEnsemble(FeatureExtractor extractor, Clock clock, ObservatoryProperties props) {
    ObservatoryProperties.Detection detection = props.detection();
    return new AnomalyEnsemble(
        extractor,
        new EmpiricalTailDetector(detection.tailProbabilityFloor(), detection.rankWeight(), detection.excursionScale()),
        new IsolationForestDetector(detection.treeCount(), detection.maxDepth(), detection.seed()),
        props.severity(),
        detection.attributionThreshold(),
        clock);
  }

  @Bean
  public HealthScorer healthScorer(ObservatoryProperties props) {
    return new HealthScorer(props.health());
  }
}
