package com.ciro.jsonui.gen;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.BindingConventions;
import com.ciro.jsonui.binding.BindingLexer;
import com.ciro.jsonui.binding.TwoWayBindings;
import com.ciro.jsonui.schema.DataSchemaEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Módulo de tipos {@code <Name>Data}: cada entrada declarada (opcional salvo que traiga
 * default), las acciones {@code onclick} y los handlers por defecto de inputs
 * bidireccionales, más la fábrica {@code create<Name>Data()}.
 */
public final class DataModuleGenerator {

    private final ObjectMapper mapper;
    private final BindingConventions conventions;

    public DataModuleGenerator(ObjectMapper mapper, BindingConventions conventions) {
        this.mapper = mapper;
        this.conventions = conventions;
    }

    public String generate(String componentName, ComponentNode root, OutputFlavor flavor) {
        List<DataSchemaEntry> entries = collectEntries(root);
        Set<String> actions = collectSelectors(root);
        List<TwoWayBindings.TwoWay> handlers = TwoWayBindings.collect(root, conventions);
        String type = componentName + "Data";

        Set<String> names = new LinkedHashSet<>();
        entries.forEach(e -> names.add(e.name()));
        actions.removeIf(names::contains);
        handlers.removeIf(h -> names.contains(h.handlerName()) || actions.contains(h.handlerName()));

        return flavor == OutputFlavor.TYPESCRIPT
                ? typescript(type, entries, actions, handlers)
                : plain(type, entries, actions, handlers);
    }

    private String typescript(String type, List<DataSchemaEntry> entries, Set<String> actions,
                              List<TwoWayBindings.TwoWay> handlers) {
        StringBuilder sb = new StringBuilder(Banner.LINE).append("\n\n");
        sb.append("export interface ").append(type).append(" {\n");
        if (entries.isEmpty() && actions.isEmpty() && handlers.isEmpty()) {
            sb.append("  // no data declared\n");
        }
        for (DataSchemaEntry e : entries) {
            sb.append("  ").append(e.name()).append(e.hasDefault() ? ": " : "?: ").append(e.tsType()).append(";\n");
        }
        for (String a : actions) {
            sb.append("  ").append(a).append("?: () => void;\n");
        }
        for (TwoWayBindings.TwoWay h : handlers) {
            sb.append("  ").append(h.handlerName()).append("?: (value: ").append(valueType(h)).append(") => void;\n");
        }
        sb.append("}\n\n");
        sb.append("export const create").append(type).append(" = (): ").append(type).append(" => ({\n");
        factoryBody(sb, entries, actions, handlers);
        return sb.append("});\n").toString();
    }

    private String plain(String type, List<DataSchemaEntry> entries, Set<String> actions,
                         List<TwoWayBindings.TwoWay> handlers) {
        StringBuilder sb = new StringBuilder(Banner.LINE).append("\n\n");
        sb.append("/**\n * @typedef {Object} ").append(type).append('\n');
        for (DataSchemaEntry e : entries) {
            String name = e.hasDefault() ? e.name() : "[" + e.name() + "]";
            sb.append(" * @property {").append(e.tsType()).append("} ").append(name).append('\n');
        }
        for (String a : actions) {
            sb.append(" * @property {(() => void) | undefined} [").append(a).append("]\n");
        }
        for (TwoWayBindings.TwoWay h : handlers) {
            sb.append(" * @property {((value: ").append(valueType(h)).append(") => void) | undefined} [")
              .append(h.handlerName()).append("]\n");
        }
        sb.append(" */\n\n");
        sb.append("/** @returns {").append(type).append("} */\n");
        sb.append("export const create").append(type).append(" = () => ({\n");
        factoryBody(sb, entries, actions, handlers);
        return sb.append("});\n").toString();
    }

    private void factoryBody(StringBuilder sb, List<DataSchemaEntry> entries, Set<String> actions,
                             List<TwoWayBindings.TwoWay> handlers) {
        for (DataSchemaEntry e : entries) {
            sb.append("  ").append(e.name()).append(": ").append(literal(e.defaultValue())).append(",\n");
        }
        for (String a : actions) sb.append("  ").append(a).append(": undefined,\n");
        for (TwoWayBindings.TwoWay h : handlers) sb.append("  ").append(h.handlerName()).append(": undefined,\n");
    }

    /** Default como literal JS (vía JSON); sin default ⇒ {@code undefined}. */
    String literal(Object value) {
        if (value == null) return "undefined";
        // "@{...}" en un default no tiene sentido en la fábrica
        if (value instanceof String s && BindingLexer.containsBinding(s)) return "undefined";
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize default value " + value, e);
        }
    }

    static String valueType(TwoWayBindings.TwoWay h) {
        return h.valueType();
    }

    /** Entradas de todos los ámbitos, primera declaración gana; ViewModel excluido. */
    static List<DataSchemaEntry> collectEntries(ComponentNode root) {
        Map<String, DataSchemaEntry> out = new LinkedHashMap<>();
        collect(root, out);
        return new ArrayList<>(out.values());
    }

    private static void collect(ComponentNode node, Map<String, DataSchemaEntry> out) {
        for (DataSchemaEntry e : node.declarations()) {
            if (!e.isViewModelDeclaration()) out.putIfAbsent(e.name(), e);
        }
        for (ComponentNode c : node.children()) collect(c, out);
        for (ComponentNode part : node.sectionParts()) collect(part, out);
    }

    /** Selectores de {@code onclick}: nombres de método del view model. */
    static Set<String> collectSelectors(ComponentNode root) {
        Set<String> out = new LinkedHashSet<>();
        selectors(root, out);
        return out;
    }

    private static void selectors(ComponentNode node, Set<String> out) {
        if (node.attr("onclick") instanceof String s && !s.contains("@{")) {
            String name = s.trim();
            if (name.endsWith(":")) name = name.substring(0, name.length() - 1);
            if (name.matches("[A-Za-z_$][\\w$]*")) out.add(name);
        }
        for (ComponentNode c : node.children()) selectors(c, out);
    }
}
