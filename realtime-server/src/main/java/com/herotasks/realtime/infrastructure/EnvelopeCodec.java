package com.herotasks.realtime.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herotasks.realtime.domain.BusMessage;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.domain.EnvelopeType;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON wire format for client envelopes and bus messages.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new InvalidEnvelopeException("Failed to serialize envelope: type=" + envelope.getType(), e);
        }
    }

    /**
     * Parses an inbound frame. A missing or unrecognised {@code type}
     * yields {@link EnvelopeType#UNKNOWN} rather than a failure.
     *
     * @throws InvalidEnvelopeException if the frame is not a JSON object
     */
    public Envelope decode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new InvalidEnvelopeException("Empty frame");
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                throw new InvalidEnvelopeException("Envelope must be a JSON object");
            }
            JsonNode data = node.get("data");
            if (data != null && !data.isNull() && !data.isObject()) {
                throw new InvalidEnvelopeException("Envelope data must be a JSON object");
            }
            Envelope envelope = objectMapper.treeToValue(node, Envelope.class);
            if (envelope.getType() == null) {
                return envelope.toBuilder().type(EnvelopeType.UNKNOWN).build();
            }
            return envelope;
        } catch (IOException e) {
            throw new InvalidEnvelopeException("Malformed envelope: " + e.getMessage(), e);
        }
    }

    public String encodeBus(BusMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new InvalidEnvelopeException("Failed to serialize bus message", e);
        }
    }

    public BusMessage decodeBus(String payload) {
        try {
            BusMessage message = objectMapper.readValue(payload, BusMessage.class);
            if (message.getEnvelope() == null || message.getScope() == null) {
                throw new InvalidEnvelopeException("Bus message without envelope or scope");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new InvalidEnvelopeException("Malformed bus message: " + e.getOriginalMessage(), e);
        }
    }
}
