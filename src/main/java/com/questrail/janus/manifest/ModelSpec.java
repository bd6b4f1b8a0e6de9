package com.questrail.janus.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, reusable structural type. Values referencing a model must be JSON
 * objects whose properties satisfy the property specs; every name in
 * {@link #required()} must be present.
 */
public record ModelSpec(
    String name,
    Map<String, ArgumentSpec> properties,
    List<String> required,
    String description
) {
    public ModelSpec {
        Objects.requireNonNull(name, "name");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? List.of() : List.copyOf(required);
    }

    /** A property is required if the model lists it or its own spec says so. */
    public boolean isRequired(String property) {
        if (required.contains(property)) {
            return true;
        }
        ArgumentSpec spec = properties.get(property);
        return spec != null && spec.required();
    }
}
