package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.StructuredError;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ValueValidator
 * =============================================================================
 * Shared engine that checks one dynamic value against an {@link ArgumentSpec}.
 *
 * <h2>Order of checks</h2>
 * <ol>
 *   <li>Runtime shape against the declared type</li>
 *   <li>Length bounds (strings, arrays)</li>
 *   <li>Pattern (strings)</li>
 *   <li>Numeric bounds (numbers)</li>
 *   <li>Enumeration membership</li>
 *   <li>Array elements against {@code items}, model references against the model</li>
 * </ol>
 * The first violation wins. The engine is stateless apart from a pattern cache,
 * so the same manifest and value always produce the same decision and field.
 *
 * <h2>Field naming</h2>
 * Array elements are reported as {@code name[i]}, model properties as
 * {@code name.property}.
 */
final class ValueValidator
{
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Manifest manifest;
    private final ErrorCode errorCode;
    private final String subject;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * @param manifest  manifest used to resolve model references
     * @param errorCode code reported for every violation
     * @param subject   noun used in messages ("Argument", "Field")
     */
    ValueValidator(Manifest manifest, ErrorCode errorCode, String subject) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.subject = Objects.requireNonNull(subject, "subject");
    }

    Optional<StructuredError> validate(String field, JsonNode value, ArgumentSpec spec) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(spec, "spec");

        if (!matchesType(value, spec.type())) {
            return Optional.of(violation(field, value,
                    subject + " '" + field + "' must be of type " + spec.typeName()
                            + " but was " + describe(value),
                    Map.of("expectedType", NODES.textNode(spec.typeName()))));
        }

        ValidationConstraints c = spec.validation();
        if (c != null) {
            Optional<StructuredError> violated = checkConstraints(field, value, c);
            if (violated.isPresent()) {
                return violated;
            }
        }

        if (spec.type() == ArgumentType.ARRAY && spec.items() != null) {
            for (int i = 0; i < value.size(); i++) {
                Optional<StructuredError> e = validate(field + "[" + i + "]", value.get(i), spec.items());
                if (e.isPresent()) {
                    return e;
                }
            }
        }

        if (spec.type() == ArgumentType.REFERENCE) {
            Optional<ModelSpec> model = manifest.model(spec.modelRef());
            if (model.isEmpty()) {
                return Optional.of(violation(field, value,
                        subject + " '" + field + "' references unknown model '" + spec.modelRef() + "'",
                        Map.of("modelRef", NODES.textNode(spec.modelRef()))));
            }
            return validateModel(field, value, model.get());
        }

        return Optional.empty();
    }

    Optional<StructuredError> validateModel(String field, JsonNode value, ModelSpec model) {
        Optional<StructuredError> e = validateProperties(field, value, model.properties(), model::isRequired);
        if (e.isPresent()) {
            return e;
        }
        // Required names the model lists without declaring a property spec.
        for (String name : model.required()) {
            if (!model.properties().containsKey(name) && !value.has(name)) {
                return Optional.of(missing(qualify(field, name)));
            }
        }
        return Optional.empty();
    }

    /**
     * Validate the properties of an object value. Properties present in the
     * value but not declared are ignored.
     */
    Optional<StructuredError> validateProperties(String prefix,
                                                 JsonNode object,
                                                 Map<String, ArgumentSpec> properties,
                                                 Predicate<String> isRequired) {
        for (Map.Entry<String, ArgumentSpec> e : properties.entrySet()) {
            String name = qualify(prefix, e.getKey());
            JsonNode v = object.get(e.getKey());
            if (v == null) {
                if (isRequired.test(e.getKey())) {
                    return Optional.of(missing(name));
                }
                continue;
            }
            Optional<StructuredError> err = validate(name, v, e.getValue());
            if (err.isPresent()) {
                return err;
            }
        }
        return Optional.empty();
    }

    StructuredError missing(String field) {
        return StructuredError.validation(errorCode,
                "Missing required " + subject.toLowerCase(Locale.ROOT) + ": " + field,
                field, null, Map.of("required", NODES.booleanNode(true)));
    }

    // -------------------------------------------------------------------------
    // Constraints
    // -------------------------------------------------------------------------

    private Optional<StructuredError> checkConstraints(String field, JsonNode value, ValidationConstraints c) {
        // 1) length bounds
        if (c.minLength() != null || c.maxLength() != null) {
            int length = -1;
            if (value.isTextual()) {
                String s = value.textValue();
                length = s.codePointCount(0, s.length());
            } else if (value.isArray()) {
                length = value.size();
            }
            if (length >= 0) {
                if (c.minLength() != null && length < c.minLength()) {
                    return Optional.of(violation(field, value,
                            subject + " '" + field + "' length " + length + " is less than minimum length " + c.minLength(),
                            Map.of("minLength", NODES.numberNode(c.minLength()))));
                }
                if (c.maxLength() != null && length > c.maxLength()) {
                    return Optional.of(violation(field, value,
                            subject + " '" + field + "' length " + length + " exceeds maximum length " + c.maxLength(),
                            Map.of("maxLength", NODES.numberNode(c.maxLength()))));
                }
            }
        }

        // 2) pattern
        if (c.pattern() != null && value.isTextual()) {
            if (!compile(c.pattern()).matcher(value.textValue()).find()) {
                return Optional.of(violation(field, value,
                        subject + " '" + field + "' does not match pattern " + c.pattern(),
                        Map.of("pattern", NODES.textNode(c.pattern()))));
            }
        }

        // 3) numeric bounds
        if (value.isNumber()) {
            double d = value.doubleValue();
            if (c.minimum() != null && d < c.minimum()) {
                return Optional.of(violation(field, value,
                        subject + " '" + field + "' value " + value.asText() + " is less than minimum " + c.minimum(),
                        Map.of("minimum", NODES.numberNode(c.minimum()))));
            }
            if (c.maximum() != null && d > c.maximum()) {
                return Optional.of(violation(field, value,
                        subject + " '" + field + "' value " + value.asText() + " is greater than maximum " + c.maximum(),
                        Map.of("maximum", NODES.numberNode(c.maximum()))));
            }
        }

        // 4) enumeration
        if (c.enumValues() != null && !c.enumValues().isEmpty()) {
            boolean found = c.enumValues().stream().anyMatch(allowed -> sameValue(allowed, value));
            if (!found) {
                ArrayNode allowed = NODES.arrayNode().addAll(c.enumValues());
                return Optional.of(violation(field, value,
                        subject + " '" + field + "' must be one of " + allowed,
                        Map.of("enum", allowed)));
            }
        }
        return Optional.empty();
    }

    private Pattern compile(String regex) {
        return patterns.computeIfAbsent(regex, r -> {
            try {
                return Pattern.compile(r);
            } catch (PatternSyntaxException e) {
                throw new ManifestException("Invalid regex pattern '" + r + "': " + e.getDescription(), e);
            }
        });
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    static boolean matchesType(JsonNode value, ArgumentType type) {
        switch (type) {
            case STRING:
                return value.isTextual();
            case INTEGER:
                return value.isNumber() && value.canConvertToExactIntegral();
            case NUMBER:
                return value.isNumber();
            case BOOLEAN:
                return value.isBoolean();
            case ARRAY:
                return value.isArray();
            case OBJECT:
            case REFERENCE:
                return value.isObject();
            case NULL:
                return value.isNull();
            default:
                return false;
        }
    }

    static String describe(JsonNode value) {
        if (value.isTextual()) {
            return "string";
        } else if (value.isIntegralNumber()) {
            return "integer";
        } else if (value.isNumber()) {
            return "number";
        } else if (value.isBoolean()) {
            return "boolean";
        } else if (value.isArray()) {
            return "array";
        } else if (value.isObject()) {
            return "object";
        } else if (value.isNull()) {
            return "null";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /** Numbers compare by value ({@code 1 == 1.0}); everything else by JSON equality. */
    static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    private static String qualify(String prefix, String name) {
        return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
    }

    private StructuredError violation(String field, JsonNode value, String details, Map<String, JsonNode> constraints) {
        return StructuredError.validation(errorCode, details, field, value, new LinkedHashMap<>(constraints));
    }
}
