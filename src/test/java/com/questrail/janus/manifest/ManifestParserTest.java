package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.janus.api.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestParserTest {

    private static final String JSON_MANIFEST = "{\n"
            + "  \"version\": \"1.0.0\",\n"
            + "  \"name\": \"workspace-service\",\n"
            + "  \"models\": {\n"
            + "    \"User\": {\n"
            + "      \"type\": \"object\",\n"
            + "      \"properties\": {\n"
            + "        \"id\": {\"type\": \"string\"},\n"
            + "        \"age\": {\"type\": \"integer\", \"validation\": {\"minimum\": 0, \"maximum\": 150}}\n"
            + "      },\n"
            + "      \"required\": [\"id\"]\n"
            + "    }\n"
            + "  },\n"
            + "  \"commands\": {\n"
            + "    \"createWorkspace\": {\n"
            + "      \"description\": \"Create a workspace\",\n"
            + "      \"args\": {\n"
            + "        \"name\": {\"type\": \"string\", \"required\": true,\n"
            + "                 \"validation\": {\"pattern\": \"^[a-zA-Z0-9_-]+$\", \"maxLength\": 100}},\n"
            + "        \"owner\": {\"$ref\": \"#/models/User\"},\n"
            + "        \"members\": {\"type\": \"array\", \"items\": {\"type\": \"User\"}},\n"
            + "        \"tier\": {\"type\": \"string\", \"enum\": [\"free\", \"pro\"], \"default\": \"free\"}\n"
            + "      },\n"
            + "      \"response\": {\"type\": \"object\", \"properties\": {\"id\": {\"type\": \"string\", \"required\": true}}},\n"
            + "      \"errorCodes\": [\"VALIDATION_FAILED\"]\n"
            + "    }\n"
            + "  }\n"
            + "}\n";

    private static final String YAML_MANIFEST = ""
            + "version: \"2.0\"\n"
            + "commands:\n"
            + "  resize:\n"
            + "    args:\n"
            + "      width:\n"
            + "        type: integer\n"
            + "        required: true\n"
            + "        validation:\n"
            + "          minimum: 1\n"
            + "      mode:\n"
            + "        type: string\n"
            + "        defaultValue: fit\n";

    private final ManifestParser parser = new ManifestParser();

    @Test
    void parsesJsonManifestWithModelsAndReferences() {
        Manifest m = parser.parseJson(JSON_MANIFEST);

        assertEquals("1.0.0", m.version());
        assertEquals("workspace-service", m.name());

        ModelSpec user = m.model("User").orElseThrow();
        assertTrue(user.isRequired("id"));
        assertFalse(user.isRequired("age"));
        assertEquals(150.0, user.properties().get("age").validation().maximum());

        CommandSpec create = m.command("createWorkspace").orElseThrow();
        assertEquals("Create a workspace", create.description());
        assertEquals(List.of("name", "owner", "members", "tier"), List.copyOf(create.args().keySet()));

        ArgumentSpec name = create.args().get("name");
        assertTrue(name.required());
        assertEquals("^[a-zA-Z0-9_-]+$", name.validation().pattern());
        assertEquals(100, name.validation().maxLength());

        ArgumentSpec owner = create.args().get("owner");
        assertEquals(ArgumentType.REFERENCE, owner.type());
        assertEquals("User", owner.modelRef());

        ArgumentSpec members = create.args().get("members");
        assertEquals(ArgumentType.ARRAY, members.type());
        assertEquals("User", members.items().modelRef(), "bare model name resolves to a reference");

        ArgumentSpec tier = create.args().get("tier");
        assertEquals(List.of(TextNode.valueOf("free"), TextNode.valueOf("pro")), tier.validation().enumValues());
        assertEquals(TextNode.valueOf("free"), tier.defaultValue());

        assertEquals(ArgumentType.OBJECT, create.response().type());
        assertTrue(create.response().properties().get("id").required());
        assertEquals(List.of("VALIDATION_FAILED"), create.errorCodes());
    }

    @Test
    void parsesYamlManifest() {
        Manifest m = parser.parseYaml(YAML_MANIFEST);

        assertEquals("2.0", m.version());
        CommandSpec resize = m.command("resize").orElseThrow();
        assertEquals(ArgumentType.INTEGER, resize.args().get("width").type());
        assertEquals(1.0, resize.args().get("width").validation().minimum());
        assertEquals(TextNode.valueOf("fit"), resize.args().get("mode").defaultValue());
    }

    @Test
    void renderedManifestParsesBackToTheSameManifest() {
        Manifest m = parser.parseJson(JSON_MANIFEST);

        assertEquals(m, parser.parseJson(parser.toJson(m)));
    }

    @Test
    void rejectsStructuralProblems() {
        assertParseFails("{\"commands\":{}}", "Manifest version is required");
        assertParseFails("[]", "must be an object");
        assertParseFails("   ", "Manifest document is empty");
        assertParseFails("{\"version\":\"1\",\"commands\":{\"c\":{\"args\":{\"a\":{}}}}}", "Missing type");
        assertParseFails("{\"version\":\"1\",\"commands\":{\"c\":{\"args\":{\"a\":{\"type\":\"Ghost\"}}}}}",
                "Unknown type 'Ghost'");
        assertParseFails("{\"version\":\"1\",\"commands\":{\"c\":{\"args\":{\"a\":{\"$ref\":\"#/models/Ghost\"}}}}}",
                "Unknown model 'Ghost'");
        assertParseFails("{\"version\":\"1\",\"commands\":{\"ping\":{}}}", "reserved");
        assertParseFails("{\"version\":\"1\",\"commands\":{\"c\":{\"args\":{\"a\":"
                + "{\"type\":\"string\",\"validation\":{\"minLength\":1.5}}}}}}", "minLength must be an integer");
    }

    @Test
    void rejectsArgumentAndPropertyListsThatAreNotObjects() {
        assertParseFails("{\"version\":\"1\",\"commands\":{\"c\":{\"args\":[{\"type\":\"string\"}]}}}",
                "command 'c' args");
        assertParseFails("{\"version\":\"1\",\"models\":{\"M\":{\"properties\":[\"a\"]}}}",
                "model 'M' properties");
        assertParseFails("{\"version\":\"1\",\"commands\":{\"c\":{\"response\":{\"properties\":\"x\"}}}}",
                "command 'c' response properties");
        assertParseFails("{\"version\":\"1\",\"models\":[]}", "models");

        ManifestException e = assertThrows(ManifestException.class, () -> parser.parseYaml(
                "version: \"1\"\n"
                        + "commands:\n"
                        + "  c:\n"
                        + "    args:\n"
                        + "      - name\n"));
        assertTrue(e.error().details().orElse("").contains("command 'c' args"));

        Manifest explicitNull = parser.parseJson("{\"version\":\"1\",\"commands\":{\"c\":{\"args\":null}}}");
        assertTrue(explicitNull.command("c").orElseThrow().args().isEmpty());
    }

    private void assertParseFails(String document, String expectedFragment) {
        ManifestException e = assertThrows(ManifestException.class, () -> parser.parseJson(document));
        assertEquals(ErrorCode.CONFIGURATION_ERROR.code(), e.code());
        String details = e.error().details().orElse("");
        assertTrue(details.contains(expectedFragment), "'" + details + "' should mention '" + expectedFragment + "'");
    }

    @Test
    void parseFileChoosesFormatByExtension(@TempDir Path dir) throws Exception {
        Path json = dir.resolve("api.json");
        Path yaml = dir.resolve("api.YML");
        Path text = dir.resolve("api.txt");
        Files.writeString(json, JSON_MANIFEST, StandardCharsets.UTF_8);
        Files.writeString(yaml, YAML_MANIFEST, StandardCharsets.UTF_8);
        Files.writeString(text, JSON_MANIFEST, StandardCharsets.UTF_8);

        assertTrue(parser.parseFile(json).hasCommand("createWorkspace"));
        assertTrue(parser.parseFile(yaml).hasCommand("resize"));
        assertThrows(ManifestException.class, () -> parser.parseFile(text));
        assertThrows(ManifestException.class, () -> parser.parseFile(dir.resolve("missing.json")));
    }

    @Test
    void parseFilesMergesCommandsAndKeepsFirstVersion(@TempDir Path dir) throws Exception {
        Path a = dir.resolve("a.json");
        Path b = dir.resolve("b.yaml");
        Files.writeString(a, JSON_MANIFEST, StandardCharsets.UTF_8);
        Files.writeString(b, YAML_MANIFEST, StandardCharsets.UTF_8);

        Manifest merged = parser.parseFiles(List.of(a, b));

        assertEquals("1.0.0", merged.version());
        assertTrue(merged.hasCommand("createWorkspace"));
        assertTrue(merged.hasCommand("resize"));
        assertTrue(merged.model("User").isPresent());
    }

    @Test
    void parseFilesRejectsDuplicateModel(@TempDir Path dir) throws Exception {
        Path a = dir.resolve("a.json");
        Path b = dir.resolve("b.json");
        Files.writeString(a, JSON_MANIFEST, StandardCharsets.UTF_8);
        Files.writeString(b, JSON_MANIFEST, StandardCharsets.UTF_8);

        ManifestException e = assertThrows(ManifestException.class, () -> parser.parseFiles(List.of(a, b)));
        assertTrue(e.error().details().orElse("").contains("'User'"));
    }

    @Test
    void toJsonNodeWritesModelsAndCommands() {
        Manifest m = parser.parseJson(JSON_MANIFEST);

        ObjectNode node = parser.toJsonNode(m);
        assertEquals("1.0.0", node.get("version").asText());
        assertEquals("reference", node.get("commands").get("createWorkspace").get("args").get("owner").get("type").asText());
        assertEquals(100,
                node.get("commands").get("createWorkspace").get("args").get("name").get("validation").get("maxLength").asInt());
        assertEquals("id", node.get("models").get("User").get("required").get(0).asText());
    }
}
