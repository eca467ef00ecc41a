package com.ivamare.eventbus.broker;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A message about to be published, with the AMQP properties the bus sets.
 *
 * @param body Serialized payload
 * @param headers Message headers
 * @param messageId AMQP message id
 * @param appId AMQP app id (publishing microservice)
 * @param timestamp Publish time
 * @param expiration Per-message TTL in milliseconds, or null for none
 * @param type AMQP type property (event kind wire value)
 */
public record OutboundMessage(
    byte[] body,
    Map<String, Object> headers,
    String messageId,
    String appId,
    Instant timestamp,
    String expiration,
    String type
) {
    public static final String CONTENT_TYPE = "application/json";

    public OutboundMessage {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(headers));
    }
}
