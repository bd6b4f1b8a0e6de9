package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * ArgumentSpec
 * =============================================================================
 * Declaration of one argument, model property or array element.
 *
 * <h2>Recursion</h2>
 * Array element types are held by reference in {@link #items()}, and model
 * references are resolved by name against {@link Manifest#models()} at
 * validation time. Neither embeds the nested spec by value, so array-of-array
 * and self-referencing models are representable. Cycle detection is not
 * performed; a schema whose recursion never reaches a leaf is the author's
 * error.
 *
 * @param type         declared type
 * @param required     whether the argument must be present
 * @param description  human-readable description
 * @param defaultValue value substituted when an optional argument is absent
 * @param validation   optional constraints
 * @param items        element spec for {@link ArgumentType#ARRAY}
 * @param modelRef     model name for {@link ArgumentType#REFERENCE}
 */
public record ArgumentSpec(
    ArgumentType type,
    boolean required,
    String description,
    JsonNode defaultValue,
    ValidationConstraints validation,
    ArgumentSpec items,
    String modelRef
) {
    public ArgumentSpec {
        Objects.requireNonNull(type, "type");
        if (type == ArgumentType.REFERENCE && (modelRef == null || modelRef.isBlank())) {
            throw new IllegalArgumentException("reference type requires a model name");
        }
        defaultValue = defaultValue == null ? null : defaultValue.deepCopy();
    }

    public static ArgumentSpec of(ArgumentType type) {
        return new ArgumentSpec(type, false, null, null, null, null, null);
    }

    public static ArgumentSpec arrayOf(ArgumentSpec items) {
        return new ArgumentSpec(ArgumentType.ARRAY, false, null, null, null,
                Objects.requireNonNull(items, "items"), null);
    }

    public static ArgumentSpec reference(String modelName) {
        return new ArgumentSpec(ArgumentType.REFERENCE, false, null, null, null, null, modelName);
    }

    public ArgumentSpec asRequired() {
        return new ArgumentSpec(type, true, description, defaultValue, validation, items, modelRef);
    }

    public ArgumentSpec withDescription(String v) {
        return new ArgumentSpec(type, required, v, defaultValue, validation, items, modelRef);
    }

    public ArgumentSpec withDefault(JsonNode v) {
        return new ArgumentSpec(type, required, description, v, validation, items, modelRef);
    }

    public ArgumentSpec withValidation(ValidationConstraints v) {
        return new ArgumentSpec(type, required, description, defaultValue, v, items, modelRef);
    }

    public Optional<JsonNode> defaultValueOpt() {
        return Optional.ofNullable(defaultValue);
    }

    public Optional<ValidationConstraints> validationOpt() {
        return Optional.ofNullable(validation);
    }

    public Optional<ArgumentSpec> itemsOpt() {
        return Optional.ofNullable(items);
    }

    /** Type name as written in manifests and error messages. */
    public String typeName() {
        return type == ArgumentType.REFERENCE ? modelRef : type.wireName();
    }
}
