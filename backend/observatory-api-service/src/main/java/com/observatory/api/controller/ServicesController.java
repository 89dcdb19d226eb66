package com.observatory.api.controller;

import com.observatory.anomaly.model.RegistrationResult;
import com.observatory.anomaly.service.MonitoringService;
import com.observatory.api.model.RegisterRequest;
import com.observatory.api.model.RegisterResponse;
import com.observatory.api.model.ServiceView;
import com.observatory.api.model.ServicesResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class ServicesController {
  private final MonitoringService monitoring;

  public ServicesController(MonitoringService monitoring) {
    this.monitoring = monitoring;
  }

  @GetMapping("/api/services")
  public ServicesResponse listServices() {
    List<ServiceView> services = monitoring.listServices().stream().map(ServiceView::of).toList();
    return new ServicesResponse(services, services.size());
  }

  @PostMapping("/api/services/register")
  public ResponseEntity<RegisterResponse> register(@RequestBody RegisterRequest request) {
    boolean backfill = Boolean.TRUE.equals(request.backfill());
    RegistrationResult result = monitoring.registerService(request.serviceName(), request.serviceType(), backfill);
    String name = result.registration().serviceName();
    String message = result.created()
        ? "Service " + name + " registered"
        : "Service " + name + " already registered";
    RegisterResponse body = new RegisterResponse(true, result.created(), ServiceView.of(result.registration()),
        result.backfilled(), message);
    return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
  }
}
