package com.observatory.anomaly.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "services",
    uniqueConstraints = @UniqueConstraint(name = "uk_services_name", columnNames = "service_name"))
public class DbService {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "service_name", nullable = false)
  private String serviceName;

  @Column(nullable = false, length = 64)
  private String serviceType;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(nullable = false)
  private Instant firstSeen;

  private Instant lastSeen;

  public Long getId() { return id; }
  public String getServiceName() { return serviceName; }
  public String getServiceType() { return serviceType; }
  public String getStatus() { return status; }
  public Instant getFirstSeen() { return firstSeen; }
  public Instant getLastSeen() { return lastSeen; }

  public void setServiceName(String serviceName) { this.serviceName = serviceName; }
  public void setServiceType(String serviceType) { this.serviceType = serviceType; }
  public void setStatus(String status) { this.status = status; }
  public void setFirstSeen(Instant firstSeen) { this.firstSeen = firstSeen; }
  public void setLastSeen(Instant lastSeen) { this.lastSeen = lastSeen; }
}
