package com.ivamare.ordersaga.message;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ivamare.ordersaga.exception.MalformedMessageException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts inbox payloads to and from {@link InboundMessage} values.
 *
 * <p>The payload is a flat JSON object with camelCase fields and a {@code type}
 * discriminator holding the message's wire name, for example
 * {@code {"type": "PaymentAuthorized", "messageId": "...", "orderId": "...", "authorizationId": "A-1", "amount": 42.00}}.
 * Unknown fields are ignored.
 */
public class InboundMessageCodec {

    public static final String TYPE_FIELD = "type";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public InboundMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Decode a payload read from the inbox.
     *
     * @param payload Message payload
     * @return Typed message
     * @throws MalformedMessageException if the type is missing or unknown, the fields
     *         cannot be bound, or the message or order id is absent
     */
    public InboundMessage decode(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            throw new MalformedMessageException("Empty message payload");
        }
        Object typeValue = payload.get(TYPE_FIELD);
        if (!(typeValue instanceof String wireName) || wireName.isBlank()) {
            throw new MalformedMessageException("Message has no type");
        }

        InboundMessageType type;
        try {
            type = InboundMessageType.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }

        Map<String, Object> fields = new LinkedHashMap<>(payload);
        fields.remove(TYPE_FIELD);

        InboundMessage message;
        try {
            message = objectMapper.convertValue(fields, type.messageClass());
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Cannot bind " + wireName + ": " + e.getMessage(), e);
        }

        if (message.messageId() == null) {
            throw new MalformedMessageException(wireName + " has no messageId");
        }
        if (message.orderId() == null) {
            throw new MalformedMessageException(wireName + " has no orderId");
        }
        return message;
    }

    /**
     * Encode a message into an inbox payload.
     */
    public Map<String, Object> encode(InboundMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE_FIELD, message.type().wireName());
        payload.putAll(objectMapper.convertValue(message, MAP_TYPE));
        return payload;
    }
}
