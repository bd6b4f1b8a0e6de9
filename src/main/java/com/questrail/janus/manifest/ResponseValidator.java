package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.StructuredError;

import java.util.Objects;
import java.util.Optional;

/**
 * Checks a handler's result against the command's declared {@link ResponseSpec}.
 *
 * <p>Response validation is advisory: callers report a rejection but still
 * deliver the response. Commands without a response spec, and commands the
 * manifest does not know, are accepted. Violations are reported as
 * {@link ErrorCode#VALIDATION_FAILED}.</p>
 */
public final class ResponseValidator
{
    private final Manifest manifest;
    private final ValueValidator values;

    public ResponseValidator(Manifest manifest) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.values = new ValueValidator(manifest, ErrorCode.VALIDATION_FAILED, "Field");
    }

    public ValidationResult validate(String command, JsonNode result) {
        Objects.requireNonNull(command, "command");
        JsonNode value = result == null ? NullNode.getInstance() : result;

        Optional<ResponseSpec> spec = manifest.command(command).flatMap(CommandSpec::responseOpt);
        if (spec.isEmpty()) {
            return ValidationResult.accepted();
        }
        ResponseSpec rs = spec.get();

        Optional<StructuredError> error = values.validate("result", value, rs.asValueSpec());
        if (error.isEmpty() && rs.type() == ArgumentType.OBJECT && !rs.properties().isEmpty()) {
            error = values.validateProperties("", value, rs.properties(),
                    name -> rs.properties().get(name).required());
        }
        return error.map(ValidationResult::rejected).orElseGet(ValidationResult::accepted);
    }
}
