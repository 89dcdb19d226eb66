package com.observatory.anomaly.service;

import com.observatory.anomaly.model.AnomalyRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Fans new anomaly records out to Kafka as Avro binary, keyed by service. Failures never reach
 * the collection path.
 */
@Component
public class AnomalyEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(AnomalyEventPublisher.class);

  private final ObjectProvider<KafkaTemplate<String, byte[]>> kafka;
  private final boolean enabled;
  private final String topic;
  private final Schema schema;
  private final Counter published;
  private final Counter publishFailures;

  public AnomalyEventPublisher(ObjectProvider<KafkaTemplate<String, byte[]>> kafka,
                               @Value("${observatory.anomalies.publish.enabled:false}") boolean enabled,
                               @Value("${observatory.anomalies.topic:metric_anomalies}") String topic,
                               MeterRegistry metrics) {
    this.kafka = kafka;
    this.enabled = enabled;
    this.topic = topic;
    this.schema = loadSchema("/avro/metric_anomaly.avsc");
    this.published = metrics.counter("observatory_anomalies_published_total");
    this.publishFailures = metrics.counter("observatory_anomalies_publish_failures_total");
  }

  private Schema loadSchema(String path) {
    try (InputStream in = Objects.requireNonNull(getClass().getResourceAsStream(path))) {
      return new Schema.Parser().parse(in);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load Avro schema: " + path, e);
    }
  }

  public void publish(AnomalyRecord anomaly) {
    if (!enabled) {
      return;
    }
    KafkaTemplate<String, byte[]> template = kafka.getIfAvailable();
    if (template == null) {
      log.debug("[publish] No KafkaTemplate available, skipping anomaly for {}", anomaly.serviceName());
      return;
    }
    try {
      template.send(topic, anomaly.serviceName(), encode(anomaly));
      published.increment();
    } catch (Exception ex) {
      publishFailures.increment();
      log.warn("Kafka anomaly publish failed (non-fatal): {}", ex.getMessage());
    }
  }

  byte[] encode(AnomalyRecord anomaly) throws IOException {
    GenericData.Record record = new GenericData.Record(schema);
    record.put("id", anomaly.id());
    record.put("service_name", anomaly.serviceName());
    record.put("timestamp", anomaly.timestamp().toEpochMilli());
    record.put("anomaly_type", anomaly.anomalyType());
    record.put("severity", new GenericData.EnumSymbol(schema.getField("severity").schema(), anomaly.severity().name()));
    record.put("anomaly_score", anomaly.anomalyScore());
    record.put("affected_metrics", anomaly.affectedMetrics());
    record.put("description", anomaly.description());
    record.put("detected_at", anomaly.detectedAt().toEpochMilli());

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
    new GenericDatumWriter<GenericRecord>(schema).write(record, encoder);
    encoder.flush();
    return out.toByteArray();
  }

  Schema schema() {
    return schema;
  }
}
