package com.ivamare.eventbus.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.exception.EventSerializationException;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.EventPayload;

import java.io.IOException;

/**
 * JSON conversion of event payloads.
 */
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param payload payload to serialize
     * @return UTF-8 JSON bytes
     * @throws EventSerializationException if Jackson cannot serialize the payload
     */
    public byte[] encode(EventPayload payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                "Failed to serialize " + payload.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode a body into the payload record registered for its kind.
     *
     * @param kind event kind the body was published as
     * @param body raw body
     * @return the decoded payload
     * @throws EventSerializationException if the body does not match the payload shape
     */
    public EventPayload decode(EventKind kind, byte[] body) {
        return decode(body, kind.getPayloadType());
    }

    public <T> T decode(byte[] body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new EventSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
