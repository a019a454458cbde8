package com.ciro.jsonui.validation;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.ast.LayoutReader;
import com.ciro.jsonui.schema.DataKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BindingValidatorTest {

    private final LayoutReader reader = new LayoutReader();
    private final BindingValidator validator = new BindingValidator();

    private List<ValidationWarning> validate(String json) {
        ComponentNode root = reader.read("test", json);
        return validator.validate(root);
    }

    @Test
    void undeclaredBindingOnBooleanAttributeSuggestsBoolean() {
        List<ValidationWarning> warnings = validate("""
                {"type": "View", "child": [
                  {"data": [{"name": "otherVar"}]},
                  {"type": "Label", "text": "hi", "hidden": "@{undefinedVar}"}
                ]}
                """);
        assertEquals(1, warnings.size());
        ValidationWarning w = warnings.get(0);
        assertEquals("Label.hidden", w.location());
        assertEquals(Severity.WARNING, w.severity());
        assertTrue(w.message().contains("'undefinedVar'"));
        assertTrue(w.message().contains("{ \"class\": \"Boolean\", \"name\": \"undefinedVar\" }"));
    }

    @Test
    void noSchemaMeansNoWarnings() {
        assertEquals(List.of(), validate("""
                {"type": "View", "width": 100, "child": [{"type": "Label", "text": "@{title}"}]}
                """));
    }

    @Test
    void viewModelDeclarationsDoNotCountAsData() {
        assertEquals(List.of(), validate("""
                {"type": "View", "child": [
                  {"data": [{"class": "HomeViewModel", "name": "viewModel"}]},
                  {"type": "Label", "text": "@{title}"}
                ]}
                """));
    }

    @Test
    void declaredPathIsCleanButLogicIsFlagged() {
        String template = """
                {"type": "View", "child": [
                  {"data": [{"class": "Int", "name": "count"}]},
                  {"type": "Label", "text": "%s"}
                ]}
                """;
        assertEquals(List.of(), validate(String.format(template, "@{count}")));

        List<ValidationWarning> warnings = validate(String.format(template, "@{count + 1}"));
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).message().contains("arithmetic operator"));
    }

    @Test
    void oneWarningPerBindingInPriorityOrder() {
        List<ValidationWarning> warnings = validate("""
                {"type": "View", "child": [
                  {"data": [{"name": "title"}]},
                  {"type": "Label", "text": "@{viewModel.total > 0}"},
                  {"type": "Label", "text": "@{a && b}"},
                  {"type": "Label", "text": "@{missing}"}
                ]}
                """);
        assertEquals(3, warnings.size());
        assertTrue(warnings.get(0).message().contains("'viewModel.' namespace"));
        assertTrue(warnings.get(1).message().contains("logical operator"));
        assertTrue(warnings.get(2).message().contains("'missing' in 'Label.text' is not defined"));
    }

    @Test
    void namespaceUseAnywhereInTheExpressionIsReported() {
        List<ValidationWarning> warnings = validate("""
                {"type": "View", "child": [
                  {"data": [{"name": "a"}]},
                  {"type": "Label", "text": "@{a && viewModel.secret}"},
                  {"type": "Label", "text": "@{a == 'viewModel.x'}"},
                  {"type": "Label", "text": "@{a.viewModel.x}"}
                ]}
                """);
        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).message().contains("uses the 'viewModel.' namespace"));
        assertTrue(warnings.get(1).message().contains("comparison operator"));
    }

    @Test
    void siblingDeclarationsAreNotVisible() {
        List<ValidationWarning> warnings = validate("""
                {"type": "View", "child": [
                  {"type": "View", "id": "a", "child": [
                    {"data": [{"class": "String", "name": "name"}]},
                    {"type": "Label", "text": "@{name}"}
                  ]},
                  {"type": "View", "id": "b", "child": [
                    {"type": "Label", "text": "@{name}"}
                  ]}
                ]}
                """);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).message().contains("'name'"));
    }

    @Test
    void ancestorDeclarationsAreVisible() {
        assertEquals(List.of(), validate("""
                {"type": "View", "child": [
                  {"data": [{"class": "Bool", "name": "isReady"}]},
                  {"type": "View", "child": [
                    {"type": "View", "child": [{"type": "Label", "text": "@{isReady}"}]}
                  ]}
                ]}
                """));
    }

    @Test
    void legacyDataPathsAndLiteralsAreSkipped() {
        assertEquals(List.of(), validate("""
                {"type": "View", "child": [
                  {"data": [{"name": "x"}]},
                  {"type": "Label", "text": "@{data.title}"},
                  {"type": "Switch", "isOn": "@{true}"},
                  {"type": "Label", "text": "@{!x}", "hidden": "@{x}"}
                ]}
                """));
    }

    @Test
    void nestedBindingsInsideMapsAreChecked() {
        List<ValidationWarning> warnings = validate("""
                {"type": "View", "child": [
                  {"data": [{"name": "x"}]},
                  {"type": "Button", "onClick": {"action": "link", "url": "@{pageUrl}"}}
                ]}
                """);
        assertEquals(1, warnings.size());
        assertEquals("Button.onClick", warnings.get(0).location());
    }

    @Test
    void documentLabelPrefixesMessages() {
        ComponentNode root = reader.read("home", """
                {"type": "View", "data": [{"name": "x"}], "child": [{"type": "Button", "onClick": "@{save}"}]}
                """);
        List<ValidationWarning> warnings = validator.validate(root, "Home");
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).message().startsWith("[Home] "));
        assertTrue(warnings.get(0).message().contains("\"class\": \"Function\""));
    }

    @Test
    void kindSuggestions() {
        assertEquals(DataKind.FUNCTION, BindingValidator.suggestKind("Button", "onClick", "tap"));
        assertEquals(DataKind.BOOLEAN, BindingValidator.suggestKind("Switch", "value", "on"));
        assertEquals(DataKind.STRING, BindingValidator.suggestKind("TextField", "value", "email"));
        assertEquals(DataKind.ARRAY, BindingValidator.suggestKind("Collection", "items", "rows"));
        assertEquals(DataKind.NUMBER, BindingValidator.suggestKind("Progress", "progress", "ratio"));
        assertEquals(DataKind.NUMBER, BindingValidator.suggestKind("Label", "text", "itemCount"));
        assertEquals(DataKind.BOOLEAN, BindingValidator.suggestKind("Label", "text", "isReady"));
        assertEquals(DataKind.FUNCTION, BindingValidator.suggestKind("Label", "text", "onSave"));
        assertEquals(DataKind.ARRAY, BindingValidator.suggestKind("Label", "text", "userList"));
        assertEquals(DataKind.STRING, BindingValidator.suggestKind("Label", "text", "title"));
    }

    @Test
    void logicDetection() {
        assertEquals(Optional.empty(), LogicConstruct.detect("user.name"));
        assertEquals(Optional.empty(), LogicConstruct.detect("user?.name"));
        assertEquals(Optional.of(LogicConstruct.TERNARY), LogicConstruct.detect("a ? 'x' : 'y'"));
        assertEquals(Optional.of(LogicConstruct.NIL_COALESCING), LogicConstruct.detect("a ?? b"));
        assertEquals(Optional.of(LogicConstruct.FUNCTION_CALL), LogicConstruct.detect("format(date)"));
        assertEquals(Optional.of(LogicConstruct.COMPARISON), LogicConstruct.detect("x == 'a-b'"));
        assertEquals(Optional.of(LogicConstruct.COMPARISON), LogicConstruct.detect("a >= b"));
    }

    @Test
    void sectionPartsAreValidatedInTheirOwnScope() {
        List<ValidationWarning> warnings = validate("""
                {"type": "View", "child": [
                  {"data": [{"class": "Array", "name": "rows"}]},
                  {"type": "Collection", "items": "@{rows}", "sections": [
                    {"header": {"type": "View", "child": [{"type": "Label", "text": "@{headerTitle}"}]},
                     "cell": {"type": "View", "data": [{"class": "String", "name": "caption"}], "child": [
                       {"type": "Label", "text": "@{caption}"},
                       {"type": "Label", "text": "@{data.name}"}
                     ]}}
                  ]}
                ]}
                """);
        assertEquals(1, warnings.size());
        assertEquals("Label.text", warnings.get(0).location());
        assertTrue(warnings.get(0).message().contains("'headerTitle'"));
    }

    @Test
    void declarationsInsideSectionPartsEnableValidation() {
        List<ValidationWarning> warnings = validate("""
                {"type": "Collection", "sections": [
                  {"cell": {"type": "View", "data": [{"name": "caption"}],
                            "child": [{"type": "Label", "text": "@{subtitle}"}]}}
                ]}
                """);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).message().contains("'subtitle'"));
    }
}
