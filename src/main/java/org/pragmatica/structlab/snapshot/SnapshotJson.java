package org.pragmatica.structlab.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;

/**
 * JSON rendering of snapshots and traces for external renderers.
 */
public final class SnapshotJson {
    private SnapshotJson() {}

    private static final ObjectMapper MAPPER = new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    private static final ObjectMapper PRETTY = MAPPER.copy()
                                                     .enable(SerializationFeature.INDENT_OUTPUT);

    public static Result<String> toJson(Snapshot snapshot) {
        return write(MAPPER, snapshot);
    }

    public static Result<String> toJson(StepTrace trace) {
        return write(MAPPER, trace);
    }

    public static Result<String> toJson(JsonNode node) {
        return write(MAPPER, node);
    }

    public static Result<String> toPrettyJson(JsonNode node) {
        return write(PRETTY, node);
    }

    /**
     * Convert a snapshot, trace or detail into a JSON tree for further composition.
     */
    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }

    private static Result<String> write(ObjectMapper mapper, Object value) {
        try {
            return Result.success(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return new CommandError.InternalFailure("serialize", e).result();
        }
    }
}
