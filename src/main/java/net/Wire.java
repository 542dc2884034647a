package net;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import common.dto.cmd.ClientCommand;
import common.dto.msg.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Wire helpers for NDJSON messages: one JSON object per line, snake_case keys,
 * the message kind in {@code type}.
 * The ObjectMapper stays private; callers use the encode/decode helpers.
 */
public final class Wire {
    private static final Logger log = LoggerFactory.getLogger(Wire.class);

    private static final ObjectMapper M = newMapper();

    private static final ObjectWriter SERVER_WRITER = M.writerFor(ServerMessage.class);

    private Wire() {}

    private static ObjectMapper newMapper() {
        ObjectMapper m = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // inbound scalars must arrive with their own JSON type: no "12" for 12, no 5.9 for 5, no 1 for true
        m.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        m.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        m.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return m;
    }

    /** Encode as a single NDJSON line (newline appended). */
    public static String encode(ServerMessage m) {
        try { return SERVER_WRITER.writeValueAsString(m) + "\n"; }
        catch (JsonProcessingException ex) { throw new IllegalStateException("encode failed: " + m, ex); }
    }

    /**
     * Decode one client line.
     *
     * @return the command, or empty when the line is valid JSON but not a command we know
     *         (unknown or missing {@code type}, payload that does not bind)
     * @throws ProtocolException when the line is not a JSON object at all
     */
    public static Optional<ClientCommand> decode(String line) throws ProtocolException {
        JsonNode node = tree(line);
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) return Optional.empty();
        try {
            return Optional.ofNullable(M.treeToValue(node, ClientCommand.class));
        } catch (JsonProcessingException ex) {
            log.debug("ignoring {} with unusable payload: {}", type.asText(), ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Parse any line into a JSON object tree. */
    public static JsonNode tree(String line) throws ProtocolException {
        JsonNode node;
        try {
            node = M.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("not JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || !node.isObject()) throw new ProtocolException("not a JSON object");
        return node;
    }
}
