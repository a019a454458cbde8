package com.ciro.jsonui.validation;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.BindingConventions;
import com.ciro.jsonui.binding.BindingResolver;
import com.ciro.jsonui.schema.DataKind;
import com.ciro.jsonui.schema.DataSchema;
import com.ciro.jsonui.schema.DataSchemaEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Análisis estático de bindings contra los datos declarados en el documento.
 * <p>
 * Cada binding produce como máximo un warning, por prioridad:
 * <ol>
 *   <li>uso del namespace {@code viewModel.};</li>
 *   <li>lógica dentro del binding ({@link LogicConstruct});</li>
 *   <li>identificador inicial no declarado en el ámbito.</li>
 * </ol>
 * Los documentos sin ninguna declaración de datos se saltan: se asume que se bindean desde
 * afuera. No modifica el árbol y no lanza excepciones.
 */
public final class BindingValidator {

    private static final Set<String> SKIPPED_KEYS =
            Set.of("type", "child", "children", "data", "shared_data", "style", "include", "sections");

    private static final Set<String> BOOLEAN_ATTRIBUTES = Set.of(
            "hidden", "visibility", "enabled", "disabled", "checked", "isChecked", "isOn", "selected",
            "editable", "secure", "userInteractionEnabled", "clipToBounds", "isOpen", "loading");

    private static final Set<String> ARRAY_ATTRIBUTES = Set.of(
            "items", "sections", "options", "cells", "dataSource", "segments", "tabs");

    private static final Set<String> NUMBER_ATTRIBUTES = Set.of(
            "progress", "rating", "minValue", "maxValue", "selectedIndex", "currentPage", "badge");

    private static final Set<String> TOGGLE_TYPES = Set.of("Switch", "Toggle", "Check", "CheckBox", "Checkbox");

    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("^[A-Za-z_$][\\w$]*");
    private static final Set<String> JS_LITERALS = Set.of("true", "false", "null", "undefined", "this");

    private final BindingConventions conventions;
    private final Pattern namespaceUse;

    public BindingValidator(BindingConventions conventions) {
        this.conventions = conventions;
        this.namespaceUse = Pattern.compile("(?<![\\w$.])" + Pattern.quote(conventions.root()) + "\\.");
    }

    public BindingValidator() {
        this(BindingConventions.STANDARD);
    }

    public List<ValidationWarning> validate(ComponentNode root, String documentLabel) {
        if (root == null || !hasAnyData(root)) return List.of();
        List<ValidationWarning> out = new ArrayList<>();
        visit(root, DataSchema.empty(), prefix(documentLabel), out);
        return Collections.unmodifiableList(out);
    }

    public List<ValidationWarning> validate(ComponentNode root) {
        return validate(root, null);
    }

    private void visit(ComponentNode node, DataSchema inherited, String prefix, List<ValidationWarning> out) {
        if (node.marker()) return;
        // las declaraciones de un marcador valen para todo el subárbol de su padre
        DataSchema scope = inherited.child(node.scopeDeclarations());
        String type = node.type() != null ? node.type() : (node.isInclude() ? "Include" : "View");

        for (Map.Entry<String, Object> e : node.attributes().entrySet()) {
            if (SKIPPED_KEYS.contains(e.getKey())) continue;
            checkValue(type, e.getKey(), e.getValue(), scope, prefix, out);
        }
        for (ComponentNode child : node.children()) {
            visit(child, scope, prefix, out);
        }
        // header/cell/footer inline: sin type se reportan con el tipo de la colección
        for (ComponentNode part : node.sectionParts()) {
            visit(part.type() == null ? part.withType(type) : part, scope, prefix, out);
        }
    }

    private void checkValue(String type, String attribute, Object value, DataSchema scope,
                            String prefix, List<ValidationWarning> out) {
        if (value instanceof String s) {
            if (!s.contains("@{")) return;
            for (String content : BindingResolver.bindingContents(s)) {
                checkBinding(type, attribute, content, scope, prefix).ifPresent(out::add);
            }
        } else if (value instanceof Map<?, ?> m) {
            for (Object v : m.values()) checkValue(type, attribute, v, scope, prefix, out);
        } else if (value instanceof List<?> l) {
            for (Object v : l) checkValue(type, attribute, v, scope, prefix, out);
        }
    }

    private Optional<ValidationWarning> checkBinding(String type, String attribute, String content,
                                                     DataSchema scope, String prefix) {
        String location = type + "." + attribute;
        String path = content.trim();
        while (path.startsWith("!")) path = path.substring(1).trim();

        // en cualquier posición de la expresión, no sólo al inicio
        if (namespaceUse.matcher(LogicConstruct.withoutStrings(content)).find()) {
            return Optional.of(new ValidationWarning(location,
                    prefix + "Binding '@{" + content + "}' in '" + location + "' uses the '"
                            + conventions.root() + ".' namespace. Bind data properties by name and declare them in data.",
                    Severity.WARNING));
        }

        Optional<LogicConstruct> logic = LogicConstruct.detect(content);
        if (logic.isPresent()) {
            return Optional.of(new ValidationWarning(location,
                    prefix + "Binding '@{" + content + "}' in '" + location + "' contains business logic ("
                            + logic.get().description() + "). Move it to the ViewModel and bind a computed property.",
                    Severity.WARNING));
        }

        // data.xxx son bindings de celda heredados; no se validan contra el esquema
        if (path.startsWith(conventions.legacy() + ".")) return Optional.empty();

        Matcher m = LEADING_IDENTIFIER.matcher(path);
        if (!m.find()) return Optional.empty();
        String name = m.group();
        if (JS_LITERALS.contains(name) || scope.declares(name)) return Optional.empty();

        DataKind kind = suggestKind(type, attribute, name);
        return Optional.of(new ValidationWarning(location,
                prefix + "Binding variable '" + name + "' in '" + location + "' is not defined in data. "
                        + "Add: { \"class\": \"" + kind.schemaName() + "\", \"name\": \"" + name + "\" }",
                Severity.WARNING));
    }

    /** Tipo sugerido: primero por el atributo, luego por el nombre; por defecto String. */
    static DataKind suggestKind(String type, String attribute, String name) {
        if (isEventAttribute(attribute)) return DataKind.FUNCTION;
        if (BOOLEAN_ATTRIBUTES.contains(attribute)) return DataKind.BOOLEAN;
        if (attribute.equals("value") && TOGGLE_TYPES.contains(type)) return DataKind.BOOLEAN;
        if (ARRAY_ATTRIBUTES.contains(attribute)) return DataKind.ARRAY;
        if (NUMBER_ATTRIBUTES.contains(attribute)) return DataKind.NUMBER;
        return kindFromName(name);
    }

    static DataKind kindFromName(String name) {
        if (name.matches("(is|has|should|can|show|enable|did|will)[A-Z].*")) return DataKind.BOOLEAN;
        if (name.matches("on[A-Z].*") || name.matches(".*(Handler|Action|Callback)")) return DataKind.FUNCTION;
        if (name.matches("(?i).*(count|index|total|amount|size|width|height|number|progress)")) return DataKind.NUMBER;
        if (name.matches(".*(Items|List|Array)") || name.equals("items")) return DataKind.ARRAY;
        return DataKind.STRING;
    }

    static boolean isEventAttribute(String attribute) {
        return attribute.length() > 2 && attribute.startsWith("on")
                && Character.isLetter(attribute.charAt(2));
    }

    static boolean hasAnyData(ComponentNode node) {
        for (DataSchemaEntry e : node.declarations()) {
            if (!e.isViewModelDeclaration()) return true;
        }
        for (ComponentNode c : node.children()) {
            if (hasAnyData(c)) return true;
        }
        for (ComponentNode part : node.sectionParts()) {
            if (hasAnyData(part)) return true;
        }
        return false;
    }

    private static String prefix(String label) {
        return label == null || label.isBlank() ? "" : "[" + label + "] ";
    }
}
