package sensormonitor.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.domain.RoutedMessage;
import sensormonitor.domain.Sample;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an inbound topic and raw payload into a device id and a decoded {@link Sample}.
 * Stateless and safe to share between threads.
 */
public class MessageRouter {
    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    public static final String UNKNOWN_DEVICE = "unknown";
    private static final String TOPIC_DELIMITER = "/";

    private final ObjectMapper objectMapper;

    public MessageRouter() {
        // Firmware prints nan for a failed sensor read; accept the token and drop the field later
        this.objectMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    /**
     * Route one message.
     *
     * @param topic the topic the message was published on
     * @param rawPayload the raw message payload
     * @return the device id and its decoded sample
     * @throws MalformedPayloadException if the payload is not a JSON object
     */
    public RoutedMessage route(String topic, byte[] rawPayload) {
        Objects.requireNonNull(rawPayload, "rawPayload cannot be null");
        String deviceId = deviceIdOf(topic);
        Sample sample = decode(topic, rawPayload);
        logger.debug("Routed {} field(s) from topic {} to device {}",
                sample.values().size(), topic, deviceId);
        return new RoutedMessage(deviceId, sample);
    }

    /**
     * Device id is the last topic segment, e.g. {@code sensor/jadwiga -> jadwiga}.
     * Topics without a delimiter, or ending with one, map to {@value #UNKNOWN_DEVICE}.
     */
    public static String deviceIdOf(String topic) {
        if (topic == null) {
            return UNKNOWN_DEVICE;
        }
        String[] segments = topic.split(TOPIC_DELIMITER, -1);
        if (segments.length < 2) {
            return UNKNOWN_DEVICE;
        }
        String last = segments[segments.length - 1];
        return last.isBlank() ? UNKNOWN_DEVICE : last;
    }

    private Sample decode(String topic, byte[] rawPayload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(topic, rawPayload, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedPayloadException(topic, rawPayload, e.getMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new MalformedPayloadException(topic, rawPayload, "empty payload");
        }
        if (!root.isObject()) {
            throw new MalformedPayloadException(topic, rawPayload,
                    "expected a JSON object but got " + root.getNodeType());
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (node.isBoolean()) {
                values.put(field.getKey(), node.booleanValue());
            } else if (node.isNumber()) {
                if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                    logger.debug("Skipping non-finite value for field {}", field.getKey());
                    continue;
                }
                values.put(field.getKey(), node.numberValue());
            }
        }
        return new Sample(values);
    }
}
