package com.observatory.anomaly.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "metrics_anomalies",
    indexes = @Index(name = "idx_metrics_anomalies_service_ts", columnList = "service_name, sampled_at"))
public class DbAnomalyRecord {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "service_name", nullable = false)
  private String serviceName;

  @Column(name = "sampled_at", nullable = false)
  private Instant timestamp;

  @Column(nullable = false, length = 64)
  private String anomalyType;

  @Column(nullable = false, length = 16)
  private String severity;

  @Column(nullable = false)
  private double anomalyScore;

  // comma separated feature names, in feature order
  @Column(length = 512)
  private String affectedMetrics;

  @Column(length = 2048)
  private String description;

  @Column(nullable = false)
  private Instant detectedAt;

  public Long getId() { return id; }
  public String getServiceName() { return serviceName; }
  public Instant getTimestamp() { return timestamp; }
  public String getAnomalyType() { return anomalyType; }
  public String getSeverity() { return severity; }
  public double getAnomalyScore() { return anomalyScore; }
  public String getAffectedMetrics() { return affectedMetrics; }
  public String getDescription() { return description; }
  public Instant getDetectedAt() { return detectedAt; }

  public void setServiceName(String serviceName) { this.serviceName = serviceName; }
  public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
  public void setAnomalyType(String anomalyType) { this.anomalyType = anomalyType; }
  public void setSeverity(String severity) { this.severity = severity; }
  public void setAnomalyScore(double anomalyScore) { this.anomalyScore = anomalyScore; }
  public void setAffectedMetrics(String affectedMetrics) { this.affectedMetrics = affectedMetrics; }
  public void setDescription(String description) { this.description = description; }
  public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }
}
