package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Optional constraints applied after a value passed its type check.
 *
 * <p>Every field may be {@code null}; an absent constraint leaves that axis
 * unconstrained. {@code minLength}/{@code maxLength} apply to strings (code
 * points) and arrays (elements); {@code pattern} applies to strings only;
 * {@code minimum}/{@code maximum} to numbers only.</p>
 */
public record ValidationConstraints(
    Integer minLength,
    Integer maxLength,
    String pattern,
    Double minimum,
    Double maximum,
    List<JsonNode> enumValues
) {
    public ValidationConstraints {
        enumValues = enumValues == null
                ? null
                : enumValues.stream().<JsonNode>map(JsonNode::deepCopy).collect(Collectors.toUnmodifiableList());
    }

    public static ValidationConstraints none() {
        return new ValidationConstraints(null, null, null, null, null, null);
    }

    public ValidationConstraints withMinLength(Integer v) {
        return new ValidationConstraints(v, maxLength, pattern, minimum, maximum, enumValues);
    }

    public ValidationConstraints withMaxLength(Integer v) {
        return new ValidationConstraints(minLength, v, pattern, minimum, maximum, enumValues);
    }

    public ValidationConstraints withPattern(String v) {
        return new ValidationConstraints(minLength, maxLength, v, minimum, maximum, enumValues);
    }

    public ValidationConstraints withMinimum(Double v) {
        return new ValidationConstraints(minLength, maxLength, pattern, v, maximum, enumValues);
    }

    public ValidationConstraints withMaximum(Double v) {
        return new ValidationConstraints(minLength, maxLength, pattern, minimum, v, enumValues);
    }

    public ValidationConstraints withEnumValues(List<JsonNode> v) {
        return new ValidationConstraints(minLength, maxLength, pattern, minimum, maximum, v);
    }

    public boolean isEmpty() {
        return minLength == null && maxLength == null && pattern == null
                && minimum == null && maximum == null && enumValues == null;
    }
}
