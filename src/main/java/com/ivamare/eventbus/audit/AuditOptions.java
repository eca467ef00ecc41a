package com.ivamare.eventbus.audit;

import java.nio.charset.StandardCharsets;

/**
 * Options for audit emission.
 *
 * @param enabled Whether business workers emit audit records at all
 * @param capturePayload Whether received and dead-letter records carry the event body
 * @param maxPayloadBytes Size cap for a captured body, in UTF-8 bytes
 */
public record AuditOptions(boolean enabled, boolean capturePayload, int maxPayloadBytes) {

    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 4096;

    public AuditOptions {
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive");
        }
    }

    /**
     * Audit enabled, bodies not captured.
     */
    public static AuditOptions defaults() {
        return new AuditOptions(true, false, DEFAULT_MAX_PAYLOAD_BYTES);
    }

    /**
     * Apply the capture settings to a body.
     *
     * @param body raw event body
     * @return the captured text, or null when capture is off
     */
    public CapturedPayload capture(byte[] body) {
        if (!capturePayload || body == null) {
            return CapturedPayload.NONE;
        }
        if (body.length <= maxPayloadBytes) {
            return new CapturedPayload(new String(body, StandardCharsets.UTF_8), false);
        }
        int end = maxPayloadBytes;
        // Do not split a multi-byte character: back off over continuation bytes.
        while (end > 0 && (body[end] & 0xC0) == 0x80) {
            end--;
        }
        return new CapturedPayload(new String(body, 0, end, StandardCharsets.UTF_8), true);
    }

    /**
     * @param text Captured body, null when nothing was captured
     * @param truncated Whether the body was cut at the cap
     */
    public record CapturedPayload(String text, boolean truncated) {
        static final CapturedPayload NONE = new CapturedPayload(null, false);
    }
}
