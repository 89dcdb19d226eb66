package com.observatory.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.observatory.anomaly.discover.DockerDiscovery;
import com.observatory.anomaly.discover.KubernetesDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(DiscoveryProperties.class)
public class DiscoveryConfig {

  private static final Logger log = LoggerFactory.getLogger(DiscoveryConfig.class);

  @Bean
  @ConditionalOnProperty(prefix = "observatory.discovery.docker", name = "enabled", havingValue = "true")
  public DockerDiscovery dockerDiscovery(DiscoveryProperties props, ObjectMapper mapper) {
    DiscoveryProperties.Docker docker = props.docker();
    log.info("[discover] Docker discovery against {}", docker.baseUrl());
    return new DockerDiscovery(restClient(docker.baseUrl(), docker.timeout()).build(), mapper);
  }

  @Bean
  @ConditionalOnProperty(prefix = "observatory.discovery.kubernetes", name = "enabled", havingValue = "true")
  public KubernetesDiscovery kubernetesDiscovery(DiscoveryProperties props, ObjectMapper mapper) {
    DiscoveryProperties.Kubernetes kubernetes = props.kubernetes();
    RestClient.Builder builder = restClient(kubernetes.baseUrl(), kubernetes.timeout());
    Path tokenFile = Path.of(kubernetes.tokenFile());
    if (Files.isReadable(tokenFile)) {
      try {
        builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + Files.readString(tokenFile).trim());
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read service account token " + tokenFile, e);
      }
    } else {
      log.warn("[discover] No service account token at {}, calling the Kubernetes API anonymously", tokenFile);
    }
    log.info("[discover] Kubernetes discovery against {} namespaces={}", kubernetes.baseUrl(), kubernetes.namespaces());
    return new KubernetesDiscovery(builder.build(), mapper, kubernetes.namespaces());
  }

  private static RestClient.Builder restClient(String baseUrl, Duration timeout) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(timeout);
    return RestClient.builder()
        .baseUrl(baseUrl)
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
  }
}
