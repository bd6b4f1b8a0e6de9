package com.questrail.janus.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Optional structured context attached to a {@link StructuredError}.
 *
 * <p>Carried on the wire as the {@code error.data} object. Every field is
 * optional; absent fields are omitted when encoded.</p>
 *
 * @param details     free-text detail
 * @param field       offending field name (validation failures)
 * @param value       offending value (validation failures)
 * @param constraints violated constraints, keyed by constraint name
 * @param context     arbitrary additional context
 */
public record ErrorContext(
    String details,
    String field,
    JsonNode value,
    Map<String, JsonNode> constraints,
    Map<String, JsonNode> context
) {
    public ErrorContext {
        constraints = constraints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        value = value == null ? null : value.deepCopy();
    }

    public static ErrorContext ofDetails(String details) {
        return new ErrorContext(details, null, null, null, null);
    }

    public Optional<String> detailsOpt() {
        return Optional.ofNullable(details);
    }

    public Optional<String> fieldOpt() {
        return Optional.ofNullable(field);
    }

    public boolean isEmpty() {
        return details == null && field == null && value == null && constraints.isEmpty() && context.isEmpty();
    }
}
