package com.observatory.anomaly.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryPropertiesTest {

  @Test
  void bothPlatformsAreOffByDefault() {
    DiscoveryProperties props = new DiscoveryProperties(null, null, null);

    assertThat(props.interval()).isEqualTo(Duration.ofMinutes(5));
    assertThat(props.docker().enabled()).isFalse();
    assertThat(props.docker().baseUrl()).isEqualTo("http://localhost:2375");
    assertThat(props.kubernetes().enabled()).isFalse();
    assertThat(props.kubernetes().namespaces()).containsExactly("default");
  }

  @Test
  void bindsNamespacesAndEndpoints() {
    Map<String, String> values = Map.of(
        "observatory.discovery.interval", "2m",
        "observatory.discovery.kubernetes.enabled", "true",
        "observatory.discovery.kubernetes.base-url", "http://localhost:8001",
        "observatory.discovery.kubernetes.namespaces", "default,shop",
        "observatory.discovery.docker.timeout", "3s");

    DiscoveryProperties props = new Binder(new MapConfigurationPropertySource(values))
        .bind("observatory.discovery", DiscoveryProperties.class).get();

    assertThat(props.interval()).isEqualTo(Duration.ofMinutes(2));
    assertThat(props.kubernetes().enabled()).isTrue();
    assertThat(props.kubernetes().baseUrl()).isEqualTo("http://localhost:8001");
    assertThat(props.kubernetes().namespaces()).containsExactly("default", "shop");
    assertThat(props.docker().enabled()).isFalse();
    assertThat(props.docker().timeout()).isEqualTo(Duration.ofSeconds(3));
  }

  @Test
  void zeroIntervalFailsBinding() {
    Map<String, String> values = Map.of("observatory.discovery.interval", "0s");

    assertThatThrownBy(() -> new Binder(new MapConfigurationPropertySource(values))
        .bind("observatory.discovery", DiscoveryProperties.class))
        .isInstanceOf(BindException.class)
        .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }
}
