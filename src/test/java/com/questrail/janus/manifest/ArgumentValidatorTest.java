package com.questrail.janus.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.StructuredError;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String s) {
        try {
            return MAPPER.readTree(s);
        } catch (Exception e) {
            throw new IllegalArgumentException(s, e);
        }
    }

    private static Manifest workspaceManifest() {
        Map<String, ArgumentSpec> args = new LinkedHashMap<>();
        args.put("name", ArgumentSpec.of(ArgumentType.STRING).asRequired()
                .withValidation(ValidationConstraints.none()
                        .withPattern("^[a-zA-Z0-9_-]+$")
                        .withMaxLength(100)));
        args.put("visibility", ArgumentSpec.of(ArgumentType.STRING)
                .withDefault(TextNode.valueOf("private"))
                .withValidation(ValidationConstraints.none()
                        .withEnumValues(List.of(TextNode.valueOf("private"), TextNode.valueOf("public")))));
        args.put("quota", ArgumentSpec.of(ArgumentType.INTEGER)
                .withValidation(ValidationConstraints.none().withMinimum(0.0).withMaximum(150.0)));
        args.put("tags", ArgumentSpec.arrayOf(ArgumentSpec.of(ArgumentType.STRING)
                .withValidation(ValidationConstraints.none().withMinLength(2))));
        args.put("settings", ArgumentSpec.of(ArgumentType.OBJECT).withDefault(json("{\"theme\":\"dark\"}")));
        return Manifest.of("1.0.0", Map.of("createWorkspace", CommandSpec.of("createWorkspace", args)));
    }

    private final ArgumentValidator validator = new ArgumentValidator(workspaceManifest());

    private static Map<String, JsonNode> args(Object... kv) {
        Map<String, JsonNode> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], (JsonNode) kv[i + 1]);
        }
        return m;
    }

    private StructuredError rejected(Map<String, JsonNode> args) {
        ValidationResult r = validator.validate("createWorkspace", args);
        assertFalse(r.isValid(), "expected rejection of " + args);
        return r.error().orElseThrow();
    }

    // ---------------------------------------------------------------------
    // Pattern and length on a required string
    // ---------------------------------------------------------------------

    @Test
    void nameWithSpaceAndBangViolatesPattern() {
        StructuredError e = rejected(args("name", TextNode.valueOf("My Workspace!")));

        assertTrue(e.is(ErrorCode.INVALID_PARAMS));
        assertEquals(Optional.of("name"), e.field());
        assertEquals(Optional.of("Argument 'name' does not match pattern ^[a-zA-Z0-9_-]+$"), e.details());
        assertEquals(TextNode.valueOf("^[a-zA-Z0-9_-]+$"), e.data().constraints().get("pattern"));
        assertEquals(TextNode.valueOf("My Workspace!"), e.data().value());
    }

    @Test
    void simpleNameIsAccepted() {
        ValidationResult r = validator.validate("createWorkspace", args("name", TextNode.valueOf("lib-1")));

        assertTrue(r.isValid());
        assertTrue(r.error().isEmpty());
    }

    @Test
    void maxLengthBoundaryIsInclusive() {
        assertTrue(validator.validate("createWorkspace", args("name", TextNode.valueOf("a".repeat(100)))).isValid());

        StructuredError e = rejected(args("name", TextNode.valueOf("a".repeat(101))));
        assertEquals(Optional.of("Argument 'name' length 101 exceeds maximum length 100"), e.details());
        assertEquals(IntNode.valueOf(100), e.data().constraints().get("maxLength"));
    }

    @Test
    void lengthCountsCodePointsNotUtf16Units() {
        // Two emoji are four UTF-16 units but two characters.
        ValidationResult r = validator.validate("createWorkspace",
                args("name", TextNode.valueOf("ok"), "tags", json("[\"\\uD83D\\uDE00\\uD83D\\uDE00\"]")));
        assertTrue(r.isValid(), () -> r.toString());
    }

    @Test
    void missingRequiredArgumentIsReported() {
        StructuredError e = rejected(args());

        assertTrue(e.is(ErrorCode.INVALID_PARAMS));
        assertEquals(Optional.of("name"), e.field());
        assertEquals(Optional.of("Missing required argument: name"), e.details());
        assertEquals(BooleanNode.TRUE, e.data().constraints().get("required"));
    }

    @Test
    void wrongTypeIsReportedWithExpectedType() {
        StructuredError e = rejected(args("name", IntNode.valueOf(5)));

        assertEquals(Optional.of("Argument 'name' must be of type string but was integer"), e.details());
        assertEquals(TextNode.valueOf("string"), e.data().constraints().get("expectedType"));
    }

    // ---------------------------------------------------------------------
    // Numbers
    // ---------------------------------------------------------------------

    @Test
    void numericBoundsAreInclusive() {
        assertTrue(validator.validate("createWorkspace",
                args("name", TextNode.valueOf("w"), "quota", IntNode.valueOf(0))).isValid());
        assertTrue(validator.validate("createWorkspace",
                args("name", TextNode.valueOf("w"), "quota", IntNode.valueOf(150))).isValid());

        StructuredError high = rejected(args("name", TextNode.valueOf("w"), "quota", IntNode.valueOf(151)));
        assertEquals(Optional.of("Argument 'quota' value 151 is greater than maximum 150.0"), high.details());

        StructuredError low = rejected(args("name", TextNode.valueOf("w"), "quota", IntNode.valueOf(-1)));
        assertEquals(Optional.of("Argument 'quota' value -1 is less than minimum 0.0"), low.details());
    }

    @Test
    void integerAcceptsWholeFloatsOnly() {
        assertTrue(validator.validate("createWorkspace",
                args("name", TextNode.valueOf("w"), "quota", DoubleNode.valueOf(3.0))).isValid());

        StructuredError e = rejected(args("name", TextNode.valueOf("w"), "quota", DoubleNode.valueOf(3.5)));
        assertEquals(Optional.of("quota"), e.field());
        assertEquals(Optional.of("Argument 'quota' must be of type integer but was number"), e.details());
    }

    @Test
    void numericEnumComparesByValue() {
        ArgumentSpec level = ArgumentSpec.of(ArgumentType.NUMBER)
                .withValidation(ValidationConstraints.none().withEnumValues(List.of(IntNode.valueOf(1), IntNode.valueOf(2))));
        ArgumentValidator v = new ArgumentValidator(
                Manifest.of("1", Map.of("setLevel", CommandSpec.of("setLevel", Map.of("level", level)))));

        assertTrue(v.validate("setLevel", args("level", DoubleNode.valueOf(1.0))).isValid());

        StructuredError e = v.validate("setLevel", args("level", IntNode.valueOf(3))).error().orElseThrow();
        assertEquals(Optional.of("Argument 'level' must be one of [1,2]"), e.details());
    }

    @Test
    void enumRejectsValueOutsideSet() {
        StructuredError e = rejected(args("name", TextNode.valueOf("w"), "visibility", TextNode.valueOf("team")));

        assertEquals(Optional.of("visibility"), e.field());
        assertTrue(e.data().constraints().get("enum").isArray());
    }

    // ---------------------------------------------------------------------
    // Defaults and pass-through
    // ---------------------------------------------------------------------

    @Test
    void defaultsFillAbsentOptionalArguments() {
        ValidationResult r = validator.validate("createWorkspace", args("name", TextNode.valueOf("w")));

        assertTrue(r.isValid());
        assertEquals(TextNode.valueOf("private"), r.effectiveArgs().get("visibility"));
        assertEquals(json("{\"theme\":\"dark\"}"), r.effectiveArgs().get("settings"));
        assertFalse(r.effectiveArgs().containsKey("quota"), "no default, nothing added");
    }

    @Test
    void defaultsAreCopiedNotShared() {
        ValidationResult first = validator.validate("createWorkspace", args("name", TextNode.valueOf("w")));
        ((ObjectNode) first.effectiveArgs().get("settings")).put("theme", "light");

        ValidationResult second = validator.validate("createWorkspace", args("name", TextNode.valueOf("w")));
        assertEquals(TextNode.valueOf("dark"), second.effectiveArgs().get("settings").get("theme"));
    }

    @Test
    void suppliedValueIsNotReplacedByDefault() {
        ValidationResult r = validator.validate("createWorkspace",
                args("name", TextNode.valueOf("w"), "visibility", TextNode.valueOf("public")));
        assertEquals(TextNode.valueOf("public"), r.effectiveArgs().get("visibility"));
    }

    @Test
    void undeclaredArgumentsPassThrough() {
        ValidationResult r = validator.validate("createWorkspace",
                args("name", TextNode.valueOf("w"), "extra", IntNode.valueOf(9)));

        assertTrue(r.isValid());
        assertEquals(IntNode.valueOf(9), r.effectiveArgs().get("extra"));
    }

    @Test
    void unknownCommandIsMethodNotFound() {
        ValidationResult r = validator.validate("doesNotExist", args());

        StructuredError e = r.error().orElseThrow();
        assertTrue(e.is(ErrorCode.METHOD_NOT_FOUND));
        assertEquals(Optional.of("Command 'doesNotExist' not found"), e.details());
    }

    // ---------------------------------------------------------------------
    // Arrays and models
    // ---------------------------------------------------------------------

    @Test
    void arrayElementsAreValidatedWithIndexedField() {
        StructuredError e = rejected(args("name", TextNode.valueOf("w"), "tags", json("[\"ok\",\"x\"]")));

        assertEquals(Optional.of("tags[1]"), e.field());
        assertEquals(Optional.of("Argument 'tags[1]' length 1 is less than minimum length 2"), e.details());
    }

    @Test
    void nestedArraysAreValidated() {
        ArgumentSpec matrix = ArgumentSpec.arrayOf(ArgumentSpec.arrayOf(ArgumentSpec.of(ArgumentType.INTEGER)));
        ArgumentValidator v = new ArgumentValidator(
                Manifest.of("1", Map.of("load", CommandSpec.of("load", Map.of("matrix", matrix)))));

        assertTrue(v.validate("load", args("matrix", json("[[1,2],[3]]"))).isValid());

        StructuredError e = v.validate("load", args("matrix", json("[[1,2],[3,\"x\"]]"))).error().orElseThrow();
        assertEquals(Optional.of("matrix[1][1]"), e.field());
    }

    private static ArgumentValidator treeValidator() {
        Map<String, ArgumentSpec> props = new LinkedHashMap<>();
        props.put("value", ArgumentSpec.of(ArgumentType.INTEGER));
        props.put("children", ArgumentSpec.arrayOf(ArgumentSpec.reference("TreeNode")));
        ModelSpec tree = new ModelSpec("TreeNode", props, List.of("value"), null);

        Manifest manifest = Manifest.of("1", Map.of("plant",
                        CommandSpec.of("plant", Map.of("root", ArgumentSpec.reference("TreeNode").asRequired()))))
                .withModels(Map.of("TreeNode", tree));
        return new ArgumentValidator(manifest);
    }

    @Test
    void selfReferencingModelValidatesAtDepth() {
        ArgumentValidator v = treeValidator();

        JsonNode ok = json("{\"value\":1,\"children\":[{\"value\":2,\"children\":[{\"value\":3}]}]}");
        assertTrue(v.validate("plant", args("root", ok)).isValid());

        JsonNode bad = json("{\"value\":1,\"children\":[{\"value\":2,\"children\":[{\"value\":\"three\"}]}]}");
        StructuredError e = v.validate("plant", args("root", bad)).error().orElseThrow();
        assertEquals(Optional.of("root.children[0].children[0].value"), e.field());
    }

    @Test
    void missingModelPropertyUsesQualifiedName() {
        StructuredError e = treeValidator()
                .validate("plant", args("root", json("{\"children\":[]}")))
                .error().orElseThrow();

        assertEquals(Optional.of("root.value"), e.field());
        assertEquals(Optional.of("Missing required argument: root.value"), e.details());
    }

    @Test
    void unknownModelReferenceIsReported() {
        Manifest manifest = Manifest.of("1", Map.of("c",
                CommandSpec.of("c", Map.of("thing", ArgumentSpec.reference("Ghost")))));
        StructuredError e = new ArgumentValidator(manifest)
                .validate("c", args("thing", json("{}")))
                .error().orElseThrow();

        assertEquals(Optional.of("Argument 'thing' references unknown model 'Ghost'"), e.details());
    }

    @Test
    void sameInputAlwaysYieldsSameDecision() {
        Map<String, JsonNode> input = args("name", TextNode.valueOf("bad name"), "quota", IntNode.valueOf(999));

        StructuredError first = rejected(input);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, rejected(input));
        }
        assertEquals(Optional.of("name"), first.field(), "declaration order decides the first violation");
    }

    // ---------------------------------------------------------------------
    // Boundaries
    // ---------------------------------------------------------------------

    @Test
    void commandWithoutDeclaredArgumentsAcceptsEmptyArguments() {
        ArgumentValidator v = new ArgumentValidator(
                Manifest.of("1.0.0", Map.of("listWorkspaces", CommandSpec.of("listWorkspaces", Map.of()))));

        ValidationResult r = v.validate("listWorkspaces", Map.of());

        assertTrue(r.isValid());
        assertTrue(r.effectiveArgs().isEmpty());
    }

    @Test
    void emptyRequiredStringIsPresentButTooShort() {
        Map<String, ArgumentSpec> declared = Map.of("title", ArgumentSpec.of(ArgumentType.STRING).asRequired()
                .withValidation(ValidationConstraints.none().withMinLength(1)));
        ArgumentValidator v = new ArgumentValidator(
                Manifest.of("1.0.0", Map.of("rename", CommandSpec.of("rename", declared))));

        ValidationResult r = v.validate("rename", args("title", TextNode.valueOf("")));

        assertFalse(r.isValid());
        StructuredError e = r.error().orElseThrow();
        assertTrue(e.is(ErrorCode.INVALID_PARAMS));
        assertEquals(Optional.of("title"), e.field());
        String details = e.details().orElse("");
        assertTrue(details.contains("less than minimum length 1"), details);
        assertFalse(details.startsWith("Missing required"), details);
        assertEquals(IntNode.valueOf(1), e.data().constraints().get("minLength"));
        assertNull(e.data().constraints().get("required"));
    }
}
