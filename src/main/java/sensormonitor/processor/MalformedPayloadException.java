package sensormonitor.processor;

import java.nio.charset.StandardCharsets;

/**
 * Thrown when a message payload cannot be decoded into a {@link sensormonitor.domain.Sample}.
 * Carries the raw payload so the failure can be reported for diagnosis.
 */
public class MalformedPayloadException extends IllegalArgumentException {

    private final String topic;
    private final byte[] rawPayload;

    public MalformedPayloadException(String topic, byte[] rawPayload, String reason, Throwable cause) {
        super("Malformed payload on topic '" + topic + "': " + reason
                + " (payload: " + new String(rawPayload, StandardCharsets.UTF_8) + ")", cause);
        this.topic = topic;
        this.rawPayload = rawPayload.clone();
    }

    public MalformedPayloadException(String topic, byte[] rawPayload, String reason) {
        this(topic, rawPayload, reason, null);
    }

    public String getTopic() {
        return topic;
    }

    public byte[] getRawPayload() {
        return rawPayload.clone();
    }

    public String getRawPayloadText() {
        return new String(rawPayload, StandardCharsets.UTF_8);
    }
}
