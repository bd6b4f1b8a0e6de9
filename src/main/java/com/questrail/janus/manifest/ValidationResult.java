package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.janus.api.StructuredError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating arguments or a result against a manifest.
 *
 * <p>An accepted argument validation carries the effective arguments: the
 * caller's arguments plus defaults for absent optional ones.</p>
 */
public final class ValidationResult
{
    private final StructuredError error;
    private final Map<String, JsonNode> effectiveArgs;

    private ValidationResult(StructuredError error, Map<String, JsonNode> effectiveArgs) {
        this.error = error;
        this.effectiveArgs = effectiveArgs;
    }

    public static ValidationResult accepted(Map<String, JsonNode> effectiveArgs) {
        return new ValidationResult(null, effectiveArgs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(effectiveArgs)));
    }

    public static ValidationResult accepted() {
        return new ValidationResult(null, Map.of());
    }

    public static ValidationResult rejected(StructuredError error) {
        return new ValidationResult(Objects.requireNonNull(error, "error"), Map.of());
    }

    public boolean isValid() {
        return error == null;
    }

    public Optional<StructuredError> error() {
        return Optional.ofNullable(error);
    }

    public Map<String, JsonNode> effectiveArgs() {
        return effectiveArgs;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[accepted]" : "ValidationResult[rejected: " + error + "]";
    }
}
