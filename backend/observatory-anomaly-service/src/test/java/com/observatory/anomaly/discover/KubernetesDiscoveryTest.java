package com.observatory.anomaly.discover;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.observatory.anomaly.error.DiscoveryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class KubernetesDiscoveryTest {

  private static final String BASE = "https://kube.test:6443";

  private MockRestServiceServer server;
  private KubernetesDiscovery discovery;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder()
        .baseUrl(BASE)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer sa-token");
    server = MockRestServiceServer.bindTo(builder).build();
    discovery = new KubernetesDiscovery(builder.build(), new ObjectMapper(), List.of("default", "shop"));
  }

  private static String pods(String namespace, String... names) {
    StringBuilder items = new StringBuilder();
    for (String name : names) {
      if (items.length() > 0) items.append(',');
      items.append("{\"metadata\":{\"name\":\"").append(name).append("\",\"namespace\":\"").append(namespace)
          .append("\"},\"status\":{\"phase\":\"Running\"}}");
    }
    return "{\"kind\":\"PodList\",\"items\":[" + items + "]}";
  }

  @Test
  void podsOfEveryConfiguredNamespaceAreNamedByNamespace() {
    server.expect(requestTo(BASE + "/api/v1/namespaces/default/pods"))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sa-token"))
        .andRespond(withSuccess(pods("default", "web-7d4b9c"), MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE + "/api/v1/namespaces/shop/pods"))
        .andRespond(withSuccess(pods("shop", "checkout-5f6d", "cart-0"), MediaType.APPLICATION_JSON));

    assertThat(discovery.discover()).extracting(DiscoveredWorkload::serviceName)
        .containsExactly("k8s-default-web-7d4b9c", "k8s-shop-checkout-5f6d", "k8s-shop-cart-0");
    server.verify();
  }

  @Test
  void emptyNamespaceYieldsNothing() {
    server.expect(requestTo(BASE + "/api/v1/namespaces/batch/pods"))
        .andRespond(withSuccess("{\"kind\":\"PodList\",\"items\":[]}", MediaType.APPLICATION_JSON));

    assertThat(discovery.discoverPods("batch")).isEmpty();
  }

  @Test
  void forbiddenIsUnavailable() {
    server.expect(requestTo(BASE + "/api/v1/namespaces/kube-system/pods"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> discovery.discoverPods("kube-system"))
        .isInstanceOf(DiscoveryUnavailableException.class)
        .hasMessageContaining("namespace kube-system");
  }

  @Test
  void blankNamespaceIsRejected() {
    assertThatThrownBy(() -> discovery.discoverPods(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
