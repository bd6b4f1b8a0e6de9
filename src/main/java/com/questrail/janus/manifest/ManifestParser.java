package com.questrail.janus.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ManifestParser
 * =============================================================================
 * Reads manifest documents (JSON or YAML) into {@link Manifest} instances and
 * renders them back to JSON.
 *
 * <h2>Document shape</h2>
 * <pre>
 *   { version, name?, description?, models?, commands | channels }
 * </pre>
 * A legacy {@code channels} map is accepted; the {@code commands} of every
 * channel are flattened into the single command table.
 *
 * <h2>Type notation</h2>
 * An argument may name its type as one of the primitive names, as
 * {@code "reference"} with a {@code modelRef}, as the bare name of a declared
 * model, or through {@code "$ref": "#/models/Name"}.
 *
 * <p>Every successfully parsed manifest has passed {@link ManifestValidator}.
 * Duplicate keys anywhere in a document are rejected.</p>
 */
public final class ManifestParser
{
    private static final String MODEL_REF_PREFIX = "#/models/";

    private final ObjectMapper json;
    private final ObjectMapper yaml;

    public ManifestParser() {
        this.json = JsonMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
        this.yaml = YAMLMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
    }

    // -------------------------------------------------------------------------
    // Entry points
    // -------------------------------------------------------------------------

    public Manifest parseJson(String document) {
        Objects.requireNonNull(document, "document");
        return fromTree(readTree(json, document, "JSON"));
    }

    public Manifest parseYaml(String document) {
        Objects.requireNonNull(document, "document");
        return fromTree(readTree(yaml, document, "YAML"));
    }

    /**
     * Parse a manifest file; the format is chosen by extension
     * ({@code .json}, {@code .yaml}, {@code .yml}).
     */
    public Manifest parseFile(Path path) {
        Objects.requireNonNull(path, "path");
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestException("Failed to read manifest file " + path + ": " + e.getMessage(), e);
        }

        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return parseJson(content);
        } else if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return parseYaml(content);
        }
        throw new ManifestException("Unsupported manifest file format: " + path);
    }

    /**
     * Parse and merge several manifest files in order. Commands declared by a
     * later file replace those of an earlier one; a model declared twice is a
     * conflict. The version, name and description of the first file are kept.
     */
    public Manifest parseFiles(List<Path> paths) {
        Objects.requireNonNull(paths, "paths");
        if (paths.isEmpty()) {
            throw new ManifestException("No manifest files given");
        }

        Manifest first = null;
        Map<String, ModelSpec> models = new LinkedHashMap<>();
        Map<String, CommandSpec> commands = new LinkedHashMap<>();
        for (Path p : paths) {
            Manifest m = parseFile(p);
            if (first == null) {
                first = m;
            }
            for (Map.Entry<String, ModelSpec> e : m.models().entrySet()) {
                if (models.putIfAbsent(e.getKey(), e.getValue()) != null) {
                    throw new ManifestException("Model '" + e.getKey() + "' is declared in more than one manifest file");
                }
            }
            commands.putAll(m.commands());
        }

        Manifest merged = new Manifest(first.version(), first.name(), first.description(), models, commands);
        ManifestValidator.validate(merged);
        return merged;
    }

    public String toJson(Manifest manifest) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(manifest));
        } catch (JsonProcessingException e) {
            throw new ManifestException("Failed to render manifest: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectNode toJsonNode(Manifest manifest) {
        Objects.requireNonNull(manifest, "manifest");
        ObjectNode root = json.createObjectNode();
        root.put("version", manifest.version());
        if (manifest.name() != null) {
            root.put("name", manifest.name());
        }
        if (manifest.description() != null) {
            root.put("description", manifest.description());
        }
        if (!manifest.models().isEmpty()) {
            ObjectNode models = root.putObject("models");
            manifest.models().forEach((name, model) -> {
                ObjectNode m = models.putObject(name);
                m.put("type", "object");
                if (model.description() != null) {
                    m.put("description", model.description());
                }
                writeProperties(m.putObject("properties"), model.properties());
                if (!model.required().isEmpty()) {
                    ArrayNode req = m.putArray("required");
                    model.required().forEach(req::add);
                }
            });
        }
        ObjectNode commands = root.putObject("commands");
        manifest.commands().forEach((name, command) -> {
            ObjectNode c = commands.putObject(name);
            if (command.description() != null) {
                c.put("description", command.description());
            }
            if (!command.args().isEmpty()) {
                writeProperties(c.putObject("args"), command.args());
            }
            if (command.response() != null) {
                ResponseSpec rs = command.response();
                ObjectNode r = c.putObject("response");
                r.put("type", rs.type().wireName());
                if (rs.modelRef() != null) {
                    r.put("modelRef", rs.modelRef());
                }
                if (rs.description() != null) {
                    r.put("description", rs.description());
                }
                if (!rs.properties().isEmpty()) {
                    writeProperties(r.putObject("properties"), rs.properties());
                }
                if (rs.items() != null) {
                    writeArgument(r.putObject("items"), rs.items());
                }
            }
            if (!command.errorCodes().isEmpty()) {
                ArrayNode codes = c.putArray("errorCodes");
                command.errorCodes().forEach(codes::add);
            }
        });
        return root;
    }

    // -------------------------------------------------------------------------
    // Reading
    // -------------------------------------------------------------------------

    private static JsonNode readTree(ObjectMapper mapper, String document, String format) {
        if (document.isBlank()) {
            throw new ManifestException("Manifest document is empty");
        }
        try {
            JsonNode root = mapper.readTree(document);
            if (root == null || !root.isObject()) {
                throw new ManifestException("Manifest " + format + " document must be an object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ManifestException("Invalid " + format + " manifest: " + e.getOriginalMessage(), e);
        }
    }

    private Manifest fromTree(JsonNode root) {
        JsonNode version = root.get("version");
        if (version == null || version.isNull() || version.asText().isBlank()) {
            throw new ManifestException("Manifest version is required");
        }

        // Model names first so that bare-name type references can be resolved.
        JsonNode modelsNode = optionalObject(root, "models", "models");
        Set<String> modelNames = new LinkedHashSet<>();
        modelsNode.fieldNames().forEachRemaining(modelNames::add);

        Map<String, ModelSpec> models = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = modelsNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            models.put(e.getKey(), parseModel(e.getKey(), e.getValue(), modelNames));
        }

        Map<String, CommandSpec> commands = new LinkedHashMap<>();
        if (root.has("commands")) {
            parseCommands(root.get("commands"), modelNames, commands);
        }
        for (Iterator<JsonNode> channels = root.path("channels").elements(); channels.hasNext(); ) {
            JsonNode channel = channels.next();
            if (channel.has("commands")) {
                parseCommands(channel.get("commands"), modelNames, commands);
            }
        }

        Manifest manifest = new Manifest(
                version.asText(),
                textOrNull(root, "name"),
                textOrNull(root, "description"),
                models,
                commands);
        ManifestValidator.validate(manifest);
        return manifest;
    }

    private void parseCommands(JsonNode node, Set<String> modelNames, Map<String, CommandSpec> out) {
        requireObject(node, "commands");
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), parseCommand(e.getKey(), e.getValue(), modelNames));
        }
    }

    private CommandSpec parseCommand(String name, JsonNode node, Set<String> modelNames) {
        requireObject(node, "command '" + name + "'");

        Map<String, ArgumentSpec> args = new LinkedHashMap<>();
        JsonNode argsNode = optionalObject(node, "args", "command '" + name + "' args");
        for (Iterator<Map.Entry<String, JsonNode>> it = argsNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            args.put(e.getKey(), parseArgument(e.getValue(),
                    "command '" + name + "' argument '" + e.getKey() + "'", modelNames));
        }

        ResponseSpec response = node.has("response")
                ? parseResponse(node.get("response"), "command '" + name + "' response", modelNames)
                : null;

        List<String> errorCodes = new ArrayList<>();
        node.path("errorCodes").elements().forEachRemaining(c -> errorCodes.add(c.asText()));
        node.path("errors").fieldNames().forEachRemaining(errorCodes::add);

        String commandName = textOrNull(node, "name");
        return new CommandSpec(
                commandName != null && !commandName.isBlank() ? commandName : name,
                textOrNull(node, "description"),
                args,
                response,
                errorCodes);
    }

    private ModelSpec parseModel(String name, JsonNode node, Set<String> modelNames) {
        requireObject(node, "model '" + name + "'");
        Map<String, ArgumentSpec> properties = new LinkedHashMap<>();
        JsonNode propertiesNode = optionalObject(node, "properties", "model '" + name + "' properties");
        for (Iterator<Map.Entry<String, JsonNode>> it = propertiesNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            properties.put(e.getKey(), parseArgument(e.getValue(),
                    "model '" + name + "' property '" + e.getKey() + "'", modelNames));
        }
        List<String> required = new ArrayList<>();
        node.path("required").elements().forEachRemaining(r -> required.add(r.asText()));
        return new ModelSpec(name, properties, required, textOrNull(node, "description"));
    }

    private ResponseSpec parseResponse(JsonNode node, String where, Set<String> modelNames) {
        requireObject(node, where);
        Map<String, ArgumentSpec> properties = new LinkedHashMap<>();
        JsonNode propertiesNode = optionalObject(node, "properties", where + " properties");
        for (Iterator<Map.Entry<String, JsonNode>> it = propertiesNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            properties.put(e.getKey(), parseArgument(e.getValue(),
                    where + " property '" + e.getKey() + "'", modelNames));
        }
        ArgumentSpec items = node.has("items") ? parseArgument(node.get("items"), where + " items", modelNames) : null;

        TypeRef type = node.has("type") || node.has("$ref")
                ? resolveType(node, where, modelNames)
                : new TypeRef(ArgumentType.OBJECT, null);
        return new ResponseSpec(type.type(), properties, items, type.modelRef(), textOrNull(node, "description"));
    }

    private ArgumentSpec parseArgument(JsonNode node, String where, Set<String> modelNames) {
        requireObject(node, where);
        TypeRef type = resolveType(node, where, modelNames);

        JsonNode def = node.has("defaultValue") ? node.get("defaultValue") : node.get("default");
        ArgumentSpec items = node.has("items") ? parseArgument(node.get("items"), where + " items", modelNames) : null;

        return new ArgumentSpec(
                type.type(),
                node.path("required").asBoolean(false),
                textOrNull(node, "description"),
                def,
                parseConstraints(node, where),
                items,
                type.modelRef());
    }

    private static ValidationConstraints parseConstraints(JsonNode arg, String where) {
        JsonNode v = arg.path("validation");
        if (!v.isMissingNode() && !v.isNull()) {
            requireObject(v, where + " validation");
        }
        JsonNode enumNode = v.has("enum") ? v.get("enum") : arg.get("enum");

        List<JsonNode> enumValues = null;
        if (enumNode != null && !enumNode.isNull()) {
            if (!enumNode.isArray()) {
                throw new ManifestException("enum must be an array for " + where);
            }
            enumValues = new ArrayList<>();
            enumNode.elements().forEachRemaining(enumValues::add);
        }

        ValidationConstraints c = new ValidationConstraints(
                intOrNull(v, "minLength", where),
                intOrNull(v, "maxLength", where),
                textOrNull(v, "pattern"),
                doubleOrNull(v, "minimum", where),
                doubleOrNull(v, "maximum", where),
                enumValues);
        return c.isEmpty() ? null : c;
    }

    private static TypeRef resolveType(JsonNode node, String where, Set<String> modelNames) {
        String ref = textOrNull(node, "$ref");
        if (ref != null) {
            String model = ref.startsWith(MODEL_REF_PREFIX) ? ref.substring(MODEL_REF_PREFIX.length()) : ref;
            return new TypeRef(ArgumentType.REFERENCE, model);
        }

        String typeName = textOrNull(node, "type");
        if (typeName == null || typeName.isBlank()) {
            throw new ManifestException("Missing type for " + where);
        }
        Optional<ArgumentType> primitive = ArgumentType.fromWireName(typeName);
        if (primitive.isPresent()) {
            if (primitive.get() == ArgumentType.REFERENCE) {
                String modelRef = textOrNull(node, "modelRef");
                if (modelRef == null || modelRef.isBlank()) {
                    throw new ManifestException("Reference type requires modelRef for " + where);
                }
                return new TypeRef(ArgumentType.REFERENCE, modelRef);
            }
            return new TypeRef(primitive.get(), null);
        }
        if (modelNames.contains(typeName)) {
            return new TypeRef(ArgumentType.REFERENCE, typeName);
        }
        throw new ManifestException("Unknown type '" + typeName + "' for " + where);
    }

    // -------------------------------------------------------------------------
    // Writing
    // -------------------------------------------------------------------------

    private static void writeProperties(ObjectNode out, Map<String, ArgumentSpec> props) {
        props.forEach((name, spec) -> writeArgument(out.putObject(name), spec));
    }

    private static void writeArgument(ObjectNode out, ArgumentSpec spec) {
        out.put("type", spec.type().wireName());
        if (spec.modelRef() != null) {
            out.put("modelRef", spec.modelRef());
        }
        if (spec.required()) {
            out.put("required", true);
        }
        if (spec.description() != null) {
            out.put("description", spec.description());
        }
        if (spec.defaultValue() != null) {
            out.set("defaultValue", spec.defaultValue());
        }
        ValidationConstraints c = spec.validation();
        if (c != null && !c.isEmpty()) {
            ObjectNode v = out.putObject("validation");
            if (c.minLength() != null) {
                v.put("minLength", c.minLength());
            }
            if (c.maxLength() != null) {
                v.put("maxLength", c.maxLength());
            }
            if (c.pattern() != null) {
                v.put("pattern", c.pattern());
            }
            if (c.minimum() != null) {
                v.put("minimum", c.minimum());
            }
            if (c.maximum() != null) {
                v.put("maximum", c.maximum());
            }
            if (c.enumValues() != null) {
                v.putArray("enum").addAll(c.enumValues());
            }
        }
        if (spec.items() != null) {
            writeArgument(out.putObject("items"), spec.items());
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static void requireObject(JsonNode node, String where) {
        if (node == null || !node.isObject()) {
            throw new ManifestException("Expected an object for " + where);
        }
    }

    /**
     * A field that may be absent or null but, when given, must be an object.
     */
    private static JsonNode optionalObject(JsonNode parent, String field, String where) {
        JsonNode v = parent.path(field);
        if (v.isMissingNode() || v.isNull()) {
            return MissingNode.getInstance();
        }
        requireObject(v, where);
        return v;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static Integer intOrNull(JsonNode node, String field, String where) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isNumber() || !v.canConvertToExactIntegral() || !v.canConvertToInt()) {
            throw new ManifestException(field + " must be an integer for " + where);
        }
        return v.intValue();
    }

    private static Double doubleOrNull(JsonNode node, String field, String where) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isNumber()) {
            throw new ManifestException(field + " must be a number for " + where);
        }
        return v.doubleValue();
    }

    private record TypeRef(ArgumentType type, String modelRef) {
    }
}
