package com.phillippitts.interviewcopilot.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.interviewcopilot.exception.ProtocolException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * JSON codec for {@code {"type": ..., "payload": {...}}} text frames.
 *
 * <p>Uses a private copy of the application {@link ObjectMapper} configured for snake_case
 * field names and lenient unknown-property handling, so newer peers can add fields.
 *
 * <p>Thread-safe: the mapper is configured once and only read afterwards.
 */
@Component
public class EnvelopeCodec {

    private static final String TYPE = "type";
    private static final String PAYLOAD = "payload";

    private final ObjectMapper mapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.mapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Encodes a message; a {@code null} payload becomes an empty object.
     *
     * @throws ProtocolException if the payload cannot be serialised
     */
    public String encode(MessageType type, Object payload) {
        ObjectNode root = mapper.createObjectNode();
        root.put(TYPE, type.wireName());
        root.set(PAYLOAD, payload == null ? mapper.createObjectNode() : mapper.valueToTree(payload));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + type.wireName() + " message", e);
        }
    }

    /**
     * Decodes a text frame into an envelope.
     *
     * @throws ProtocolException for invalid JSON, a missing or unknown type, or a non-object payload
     */
    public Envelope decode(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty message");
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON message", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Message must be a JSON object");
        }
        String typeName = root.path(TYPE).asText(null);
        MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName));
        JsonNode payload = root.get(PAYLOAD);
        if (payload == null || payload.isNull()) {
            payload = mapper.createObjectNode();
        }
        if (!payload.isObject()) {
            throw new ProtocolException("Payload of " + type.wireName() + " must be a JSON object");
        }
        return new Envelope(type, payload);
    }

    /**
     * Binds an envelope payload to a typed record.
     *
     * @throws ProtocolException if the payload does not match the target type
     */
    public <T> T payload(Envelope envelope, Class<T> type) {
        try {
            return mapper.treeToValue(envelope.payload(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Malformed " + envelope.type().wireName() + " payload", e);
        }
    }
}
