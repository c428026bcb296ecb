package net.clusterpool.core.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import net.clusterpool.core.error.ParseRequestException;
import net.clusterpool.core.json.Json;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the body that triggered a scheduling pass and tells which work units the pass covers.
 * <ul>
 *   <li>no body: every pending unit</li>
 *   <li>scheduled-job body (has {@code execution_id}): every pending unit</li>
 *   <li>queue message (has {@code topic}): the ids in {@code msg.steps}</li>
 * </ul>
 * {@link Optional#empty()} means "every pending unit".
 */
public final class TriggerParser {

    public Optional<List<Long>> parse(String body) throws ParseRequestException {
        if (body == null || body.isBlank()) return Optional.empty();

        JsonNode root;
        try {
            root = Json.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new ParseRequestException("Request body is not JSON - msg: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isNull() || (root.isObject() && root.isEmpty())) return Optional.empty();
        if (!root.isObject()) throw unknownShape();

        if (truthy(root.get("execution_id"))) return Optional.empty();
        if (truthy(root.get("topic"))) return fromQueueMessage(root);

        throw unknownShape();
    }

    private static Optional<List<Long>> fromQueueMessage(JsonNode root) throws ParseRequestException {
        JsonNode steps = root.path("msg").path("steps");
        if (!steps.isArray()) {
            throw new ParseRequestException("Error parsing queue message: msg.steps is required and must be a list");
        }
        List<Long> ids = new ArrayList<>();
        for (JsonNode n : steps) {
            if (!n.canConvertToLong() || !n.isIntegralNumber()) {
                throw new ParseRequestException("Error parsing queue message: not a work unit id: " + n);
            }
            ids.add(n.asLong());
        }
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids);
    }

    private static boolean truthy(JsonNode n) {
        if (n == null || n.isNull()) return false;
        if (n.isTextual()) return !n.asText().isEmpty();
        if (n.isNumber()) return n.asDouble() != 0;
        if (n.isBoolean()) return n.asBoolean();
        if (n.isContainerNode()) return !n.isEmpty();
        return true;
    }

    private static ParseRequestException unknownShape() {
        return new ParseRequestException("Unable to identify request body type. Valid body types are: "
                + "no body; scheduled job body (must contain 'execution_id' field); "
                + "queue message body (must contain 'topic' field)");
    }
}
