package com.questrail.janus.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Manifest
 * =============================================================================
 * Declarative schema describing the commands a server accepts.
 *
 * <p>Instances are immutable. Use {@link ManifestParser} to load one from JSON
 * or YAML; parsed manifests have already passed {@link ManifestValidator}.</p>
 *
 * @param version     manifest version, never empty
 * @param name        optional display name
 * @param description optional description
 * @param models      reusable structural types, by name
 * @param commands    command specifications, by name
 */
public record Manifest(
    String version,
    String name,
    String description,
    Map<String, ModelSpec> models,
    Map<String, CommandSpec> commands
) {
    public Manifest {
        Objects.requireNonNull(version, "version");
        models = models == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(models));
        commands = commands == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    }

    public static Manifest of(String version, Map<String, CommandSpec> commands) {
        return new Manifest(version, null, null, null, commands);
    }

    public Manifest withModels(Map<String, ModelSpec> models) {
        return new Manifest(version, name, description, models, commands);
    }

    public Optional<CommandSpec> command(String commandName) {
        return Optional.ofNullable(commands.get(commandName));
    }

    public Optional<ModelSpec> model(String modelName) {
        return Optional.ofNullable(models.get(modelName));
    }

    public boolean hasCommand(String commandName) {
        return commands.containsKey(commandName);
    }
}
