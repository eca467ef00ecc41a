package com.ivamare.eventbus.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A message handed from the broker to a consumer.
 *
 * <p>Retry state lives entirely in the headers, so a delivery fully describes how many times
 * it has been retried even across process restarts.
 *
 * @param deliveryTag Channel-scoped tag used to settle the delivery
 * @param exchange Exchange the message was published to (empty for the default exchange)
 * @param routingKey Routing key the message was published with
 * @param redelivered Broker redelivery flag
 * @param headers Message headers (string values already decoded)
 * @param messageId AMQP message id, may be null
 * @param appId AMQP app id (publishing microservice), may be null
 * @param timestamp AMQP timestamp, may be null
 * @param body Raw message body
 */
public record Delivery(
    long deliveryTag,
    String exchange,
    String routingKey,
    boolean redelivered,
    Map<String, Object> headers,
    String messageId,
    String appId,
    Instant timestamp,
    byte[] body
) {
    public Delivery {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(headers));
        body = body == null ? new byte[0] : body;
        exchange = exchange == null ? "" : exchange;
        routingKey = routingKey == null ? "" : routingKey;
    }

    /**
     * @return raw value of the event kind header, if present
     */
    public Optional<String> eventKindHeader() {
        Object value = headers.get(MessageHeaders.EVENT_KIND);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /**
     * Number of retries already performed. A missing or malformed header counts as zero.
     *
     * @return retry count, never negative
     */
    public int retryCount() {
        return intHeader(MessageHeaders.RETRY_COUNT);
    }

    /**
     * @return fibonacci occurrence of the previous retry, zero when absent
     */
    public int occurrence() {
        return intHeader(MessageHeaders.OCCURRENCE);
    }

    /**
     * @return the publishing microservice, or {@code "unknown"}
     */
    public String publisher() {
        return appId == null || appId.isBlank() ? MessageHeaders.UNKNOWN : appId;
    }

    /**
     * @return the message id, or {@code "unknown"}
     */
    public String eventId() {
        return messageId == null || messageId.isBlank() ? MessageHeaders.UNKNOWN : messageId;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    private int intHeader(String name) {
        Object value = headers.get(name);
        int parsed = 0;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value != null) {
            try {
                parsed = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                parsed = 0;
            }
        }
        return Math.max(parsed, 0);
    }
}
