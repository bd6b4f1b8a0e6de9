package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.StructuredError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ArgumentValidator
 * =============================================================================
 * Accepts or rejects a command invocation against a {@link Manifest}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>An unknown command is rejected with {@link ErrorCode#METHOD_NOT_FOUND}
 *       before any argument is examined.</li>
 *   <li>Declared arguments are visited in declaration order; the first
 *       violation is reported as {@link ErrorCode#INVALID_PARAMS} naming the
 *       offending field.</li>
 *   <li>Absent optional arguments receive their declared default, if any.</li>
 *   <li>Arguments that are present but not declared are passed through
 *       untouched.</li>
 * </ul>
 *
 * <p>Instances are immutable apart from a compiled-pattern cache and may be
 * shared between threads.</p>
 */
public final class ArgumentValidator
{
    private final Manifest manifest;
    private final ValueValidator values;

    public ArgumentValidator(Manifest manifest) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.values = new ValueValidator(manifest, ErrorCode.INVALID_PARAMS, "Argument");
    }

    public Manifest manifest() {
        return manifest;
    }

    public ValidationResult validate(String command, Map<String, JsonNode> args) {
        Objects.requireNonNull(command, "command");
        Map<String, JsonNode> supplied = args == null ? Map.of() : args;

        Optional<CommandSpec> spec = manifest.command(command);
        if (spec.isEmpty()) {
            return ValidationResult.rejected(
                    StructuredError.of(ErrorCode.METHOD_NOT_FOUND, "Command '" + command + "' not found"));
        }

        Map<String, JsonNode> effective = new LinkedHashMap<>(supplied);
        for (Map.Entry<String, ArgumentSpec> e : spec.get().args().entrySet()) {
            String name = e.getKey();
            ArgumentSpec argSpec = e.getValue();
            JsonNode value = supplied.get(name);

            if (value == null) {
                if (argSpec.required()) {
                    return ValidationResult.rejected(values.missing(name));
                }
                if (argSpec.defaultValue() != null) {
                    effective.put(name, argSpec.defaultValue().deepCopy());
                }
                continue;
            }

            Optional<StructuredError> error = values.validate(name, value, argSpec);
            if (error.isPresent()) {
                return ValidationResult.rejected(error.get());
            }
        }
        return ValidationResult.accepted(effective);
    }
}
