package com.observatory.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.observatory.anomaly.source.MetricsSource;
import com.observatory.anomaly.source.PrometheusClient;
import com.observatory.anomaly.source.PrometheusMetricsSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class MetricsSourceConfig {

  @Bean
  public PrometheusClient prometheusClient(ObservatoryProperties props, ObjectMapper mapper) {
    ObservatoryProperties.Source source = props.source();
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(source.timeout())
        .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(source.timeout());

    RestClient restClient = RestClient.builder()
        .baseUrl(source.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
    return new PrometheusClient(restClient, mapper);
  }

  @Bean
  @ConditionalOnMissingBean(MetricsSource.class)
  public MetricsSource metricsSource(PrometheusClient client) {
    return new PrometheusMetricsSource(client);
  }
}
