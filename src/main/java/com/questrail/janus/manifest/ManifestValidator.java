package com.questrail.janus.manifest;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ManifestValidator
 * =============================================================================
 * Load-time consistency checks for a {@link Manifest}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>the version is not blank</li>
 *   <li>command names are not blank and do not shadow a built-in command</li>
 *   <li>{@code minLength <= maxLength} and {@code minimum <= maximum}</li>
 *   <li>every pattern compiles</li>
 *   <li>every model reference names a declared model</li>
 *   <li>array element specs obey the same rules, recursively</li>
 * </ul>
 * Any violation raises a {@link ManifestException}.
 */
public final class ManifestValidator
{
    /** Command names served by the server itself. */
    public static final Set<String> RESERVED_COMMANDS = Set.of(
            "ping", "echo", "get_info", "validate", "slow_process", "manifest", "server_stats");

    private ManifestValidator() {
    }

    public static void validate(Manifest manifest) {
        Objects.requireNonNull(manifest, "manifest");

        if (manifest.version().isBlank()) {
            throw new ManifestException("Manifest version is required");
        }

        for (Map.Entry<String, ModelSpec> e : manifest.models().entrySet()) {
            if (e.getKey().isBlank()) {
                throw new ManifestException("Model name cannot be empty");
            }
            for (Map.Entry<String, ArgumentSpec> p : e.getValue().properties().entrySet()) {
                checkArgument(manifest, "model '" + e.getKey() + "' property '" + p.getKey() + "'", p.getValue());
            }
        }

        for (Map.Entry<String, CommandSpec> e : manifest.commands().entrySet()) {
            String name = e.getKey();
            if (name.isBlank()) {
                throw new ManifestException("Command name cannot be empty");
            }
            if (RESERVED_COMMANDS.contains(name)) {
                throw new ManifestException("Command '" + name + "' is reserved and cannot be defined in a manifest");
            }
            CommandSpec command = e.getValue();
            for (Map.Entry<String, ArgumentSpec> a : command.args().entrySet()) {
                if (a.getKey().isBlank()) {
                    throw new ManifestException("Argument name cannot be empty in command '" + name + "'");
                }
                checkArgument(manifest, "command '" + name + "' argument '" + a.getKey() + "'", a.getValue());
            }
            if (command.response() != null) {
                ResponseSpec rs = command.response();
                checkArgument(manifest, "command '" + name + "' response", rs.asValueSpec());
                for (Map.Entry<String, ArgumentSpec> p : rs.properties().entrySet()) {
                    checkArgument(manifest, "command '" + name + "' response property '" + p.getKey() + "'", p.getValue());
                }
            }
        }
    }

    private static void checkArgument(Manifest manifest, String where, ArgumentSpec spec) {
        if (spec.type() == ArgumentType.REFERENCE && !manifest.models().containsKey(spec.modelRef())) {
            throw new ManifestException("Unknown model '" + spec.modelRef() + "' referenced by " + where);
        }

        ValidationConstraints c = spec.validation();
        if (c != null) {
            if (c.minLength() != null && c.minLength() < 0) {
                throw new ManifestException("minLength must be >= 0 for " + where);
            }
            if (c.minLength() != null && c.maxLength() != null && c.minLength() > c.maxLength()) {
                throw new ManifestException("minLength " + c.minLength() + " exceeds maxLength "
                        + c.maxLength() + " for " + where);
            }
            if (c.minimum() != null && c.maximum() != null && c.minimum() > c.maximum()) {
                throw new ManifestException("minimum " + c.minimum() + " exceeds maximum "
                        + c.maximum() + " for " + where);
            }
            if (c.pattern() != null) {
                try {
                    Pattern.compile(c.pattern());
                } catch (PatternSyntaxException ex) {
                    throw new ManifestException("Invalid regex pattern '" + c.pattern() + "' for " + where, ex);
                }
            }
        }

        if (spec.items() != null) {
            checkArgument(manifest, where + " items", spec.items());
        }
    }
}
