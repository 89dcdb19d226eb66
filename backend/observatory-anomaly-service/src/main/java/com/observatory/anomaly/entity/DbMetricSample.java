package com.observatory.anomaly.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "service_metrics",
    uniqueConstraints = @UniqueConstraint(name = "uk_service_metrics_service_ts", columnNames = {"service_name", "sampled_at"}),
    indexes = @Index(name = "idx_service_metrics_service_ts", columnList = "service_name, sampled_at"))
public class DbMetricSample {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "service_name", nullable = false)
  private String serviceName;

  @Column(name = "sampled_at", nullable = false)
  private Instant timestamp;

  @Column(nullable = false)
  private double requestRate;

  @Column(nullable = false)
  private double errorRate;

  @Column(nullable = false)
  private double latencyP50;

  @Column(nullable = false)
  private double latencyP95;

  @Column(nullable = false)
  private double latencyP99;

  @Column(nullable = false)
  private double cpuUsage;

  @Column(nullable = false)
  private double memoryUsage;

  @Column(nullable = false)
  private int restartCount;

  @Column(nullable = false)
  private int podCount;

  public Long getId() { return id; }
  public String getServiceName() { return serviceName; }
  public Instant getTimestamp() { return timestamp; }
  public double getRequestRate() { return requestRate; }
  public double getErrorRate() { return errorRate; }
  public double getLatencyP50() { return latencyP50; }
  public double getLatencyP95() { return latencyP95; }
  public double getLatencyP99() { return latencyP99; }
  public double getCpuUsage() { return cpuUsage; }
  public double getMemoryUsage() { return memoryUsage; }
  public int getRestartCount() { return restartCount; }
  public int getPodCount() { return podCount; }

  public void setServiceName(String serviceName) { this.serviceName = serviceName; }
  public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
  public void setRequestRate(double requestRate) { this.requestRate = requestRate; }
  public void setErrorRate(double errorRate) { this.errorRate = errorRate; }
  public void setLatencyP50(double latencyP50) { this.latencyP50 = latencyP50; }
  public void setLatencyP95(double latencyP95) { this.latencyP95 = latencyP95; }
  public void setLatencyP99(double latencyP99) { this.latencyP99 = latencyP99; }
  public void setCpuUsage(double cpuUsage) { this.cpuUsage = cpuUsage; }
  public void setMemoryUsage(double memoryUsage) { this.memoryUsage = memoryUsage; }
  public void setRestartCount(int restartCount) { this.restartCount = restartCount; }
  public void setPodCount(int podCount) { this.podCount = podCount; }
}
