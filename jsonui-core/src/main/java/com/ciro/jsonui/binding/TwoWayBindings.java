package com.ciro.jsonui.binding;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.util.Names;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inputs con binding de valor y sin handler de cambio propio. Para cada uno se genera un
 * handler por defecto {@code on<Prop>Change}, tanto en el markup como en el hook.
 */
public final class TwoWayBindings {

    /**
     * @param widget      tipo del nodo
     * @param property    path de datos sin prefijo ({@code email}, {@code form.email})
     * @param handlerName {@code onEmailChange}
     * @param valueType   tipo TS del valor que recibe el handler
     */
    public record TwoWay(String widget, String property, String handlerName, String valueType) {}

    /** Atributos de valor y de handler de un tipo de input, en orden de preferencia. */
    private record InputShape(List<String> values, List<String> handlers, String valueType) {}

    private static final Map<String, InputShape> SHAPES = new HashMap<>();

    static {
        InputShape text = new InputShape(List.of("text", "value"), List.of("onTextChange", "onChange"), "string");
        InputShape check = new InputShape(List.of("isOn", "checked", "value"),
                List.of("onValueChange", "onValueChanged", "onChange"), "boolean");
        List<String> valueHandlers = List.of("onValueChange", "onValueChanged", "onChange");
        for (String t : List.of("TextField", "TextView")) SHAPES.put(t, text);
        for (String t : List.of("Switch", "Toggle", "Check", "CheckBox", "Checkbox")) SHAPES.put(t, check);
        SHAPES.put("Slider", new InputShape(List.of("value"), valueHandlers, "number"));
        SHAPES.put("SelectBox", new InputShape(List.of("selectedValue", "value"), valueHandlers, "string"));
        SHAPES.put("Segment", new InputShape(List.of("selectedIndex", "selectedTabIndex"), valueHandlers, "number"));
        SHAPES.put("Radio", new InputShape(List.of("selectedValue"), valueHandlers, "string"));
    }

    private TwoWayBindings() {}

    /** Atributos de handler que reconoce el tipo, para que el emisor busque el explícito. */
    public static List<String> handlerAttributes(String type) {
        InputShape shape = SHAPES.get(type);
        return shape == null ? List.of() : shape.handlers();
    }

    /** Primer atributo de handler presente en el nodo, o null. */
    public static String explicitHandler(ComponentNode node) {
        for (String h : handlerAttributes(node.type())) {
            if (node.has(h)) return h;
        }
        return null;
    }

    /** Binding de valor del nodo si es un input bidireccional sin handler explícito. */
    public static TwoWay of(ComponentNode node, BindingConventions conventions) {
        String type = node.type();
        InputShape shape = type == null ? null : SHAPES.get(type);
        if (shape == null || explicitHandler(node) != null) return null;

        for (String key : shape.values()) {
            String content = BindingLexer.bindingContent(node.string(key));
            if (content != null && BindingLexer.isPath(content) && !content.trim().startsWith("!")) {
                String property = stripPrefixes(content.trim(), conventions);
                return new TwoWay(type, property, handlerName(property), shape.valueType());
            }
        }
        return null;
    }

    /** Todos los inputs bidireccionales del árbol, sin repetir handler. */
    public static List<TwoWay> collect(ComponentNode root, BindingConventions conventions) {
        Map<String, TwoWay> out = new LinkedHashMap<>();
        walk(root, conventions, out);
        return new ArrayList<>(out.values());
    }

    private static void walk(ComponentNode node, BindingConventions conventions, Map<String, TwoWay> out) {
        if (node.marker()) return;
        TwoWay tw = of(node, conventions);
        if (tw != null) out.putIfAbsent(tw.handlerName(), tw);
        for (ComponentNode c : node.children()) walk(c, conventions, out);
    }

    /** {@code form.email} → {@code onEmailChange}: sólo el último segmento. */
    public static String handlerName(String property) {
        String last = property.substring(property.lastIndexOf('.') + 1);
        return "on" + Names.capitalize(last) + "Change";
    }

    static String stripPrefixes(String path, BindingConventions conventions) {
        if (path.startsWith(conventions.canonical() + ".")) return path.substring(conventions.canonical().length() + 1);
        if (path.startsWith(conventions.legacy() + ".")) return path.substring(conventions.legacy().length() + 1);
        return path;
    }
}
