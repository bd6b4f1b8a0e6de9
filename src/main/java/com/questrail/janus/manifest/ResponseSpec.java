package com.questrail.janus.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declared shape of a command's successful result.
 *
 * @param type        declared top-level type
 * @param properties  property specs when {@code type} is object
 * @param items       element spec when {@code type} is array
 * @param modelRef    model name when {@code type} is a reference
 * @param description human-readable description
 */
public record ResponseSpec(
    ArgumentType type,
    Map<String, ArgumentSpec> properties,
    ArgumentSpec items,
    String modelRef,
    String description
) {
    public ResponseSpec {
        Objects.requireNonNull(type, "type");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        if (type == ArgumentType.REFERENCE && (modelRef == null || modelRef.isBlank())) {
            throw new IllegalArgumentException("reference type requires a model name");
        }
    }

    public static ResponseSpec object(Map<String, ArgumentSpec> properties) {
        return new ResponseSpec(ArgumentType.OBJECT, properties, null, null, null);
    }

    public static ResponseSpec of(ArgumentType type) {
        return new ResponseSpec(type, null, null, null, null);
    }

    /** The response viewed as a single value spec, for the shared validation engine. */
    ArgumentSpec asValueSpec() {
        return new ArgumentSpec(type, false, description, null, null, items, modelRef);
    }
}
