package com.questrail.janus.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Specification of one command: its arguments (in declaration order), the
 * shape of its result and the error codes it documents.
 */
public record CommandSpec(
    String name,
    String description,
    Map<String, ArgumentSpec> args,
    ResponseSpec response,
    List<String> errorCodes
) {
    public CommandSpec {
        Objects.requireNonNull(name, "name");
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        errorCodes = errorCodes == null ? List.of() : List.copyOf(errorCodes);
    }

    public static CommandSpec of(String name, Map<String, ArgumentSpec> args) {
        return new CommandSpec(name, null, args, null, null);
    }

    public CommandSpec withResponse(ResponseSpec response) {
        return new CommandSpec(name, description, args, response, errorCodes);
    }

    public Optional<ResponseSpec> responseOpt() {
        return Optional.ofNullable(response);
    }
}
