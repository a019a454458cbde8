package com.ciro.jsonui.emit;

import com.ciro.jsonui.mapping.ClassList;
import org.jsoup.nodes.Attribute;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder de un elemento JSX.
 * <p>
 * Orden de salida: {@code id}, {@code className}, {@code style}, el resto de atributos en
 * orden de inserción y al final los comentarios de diagnóstico.
 */
public final class JsxElement {

    private static final String INDENT = "  ";

    private final String tag;
    private final ClassList classes = new ClassList();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, String> style = new LinkedHashMap<>();
    private final List<String> comments = new ArrayList<>();
    private String text;

    public JsxElement(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public ClassList classes() {
        return classes;
    }

    public JsxElement addClass(String token) {
        classes.add(token);
        return this;
    }

    /** Atributo con valor string; el valor se escapa como atributo HTML. */
    public JsxElement literal(String name, String value) {
        if (value == null) return this;
        attributes.put(name, value.isEmpty() ? name + "=\"\"" : new Attribute(name, value).html());
        return this;
    }

    /** Atributo con expresión JS: {@code name={expr}}. */
    public JsxElement expression(String name, String js) {
        if (js == null) return this;
        attributes.put(name, name + "={" + js + "}");
        return this;
    }

    /** Atributo booleano sin valor ({@code disabled}). */
    public JsxElement flag(String name) {
        attributes.put(name, name);
        return this;
    }

    /** Spread o forma libre ya renderizada. */
    public JsxElement raw(String key, String rendered) {
        attributes.put(key, rendered);
        return this;
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public JsxElement style(String key, String js) {
        if (js != null) style.put(key, js);
        return this;
    }

    public JsxElement styleLiteral(String key, String value) {
        if (value != null) style.put(key, jsString(value));
        return this;
    }

    public boolean hasStyle(String key) {
        return style.containsKey(key);
    }

    public JsxElement comment(String inlineComment) {
        if (inlineComment != null) comments.add(inlineComment);
        return this;
    }

    /** Contenido textual ya resuelto (JSX), va en la misma línea que la etiqueta. */
    public JsxElement text(String jsxText) {
        this.text = jsxText;
        return this;
    }

    public String render() {
        return render(List.of());
    }

    public String render(List<String> children) {
        StringBuilder sb = new StringBuilder();
        sb.append('<').append(tag);
        String id = attributes.get("id");
        if (id != null) sb.append(' ').append(id);
        if (!classes.isEmpty()) sb.append(" className=\"").append(classes).append('"');
        if (!style.isEmpty()) sb.append(" style={{ ").append(styleBody()).append(" }}");
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            if (!e.getKey().equals("id")) sb.append(' ').append(e.getValue());
        }
        for (String c : comments) sb.append(' ').append(c);

        boolean hasText = text != null && !text.isEmpty();
        if (!hasText && children.isEmpty()) {
            return sb.append(" />").toString();
        }
        sb.append('>');
        if (children.isEmpty()) {
            return sb.append(text).append("</").append(tag).append('>').toString();
        }
        sb.append('\n');
        if (hasText) sb.append(INDENT).append(text).append('\n');
        for (String child : children) {
            sb.append(indent(child)).append('\n');
        }
        return sb.append("</").append(tag).append('>').toString();
    }

    private String styleBody() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : style.entrySet()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.toString();
    }

    /** Literal de string JS con comillas simples. */
    public static String jsString(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /** Indenta cada línea no vacía un nivel. */
    public static String indent(String block) {
        StringBuilder sb = new StringBuilder();
        String[] lines = block.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            if (!lines[i].isEmpty()) sb.append(INDENT).append(lines[i]);
        }
        return sb.toString();
    }
}
