package com.ciro.jsonui.ast;

import com.ciro.jsonui.schema.DataSchemaEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodo inmutable del árbol de layout.
 * <p>
 * Las claves estructurales ({@code type}, {@code style}, {@code include},
 * {@code child}/{@code children} y {@code data} cuando es un array) se sacan del mapa de
 * atributos al parsear; todo lo demás queda en {@link #attributes()} en orden de
 * declaración.
 */
public record ComponentNode(String type,
                            Map<String, Object> attributes,
                            String styleRef,
                            String include,
                            List<ComponentNode> children,
                            List<DataSchemaEntry> declarations,
                            boolean marker) {

    public static final List<String> SECTION_PARTS = List.of("header", "cell", "footer");

    public ComponentNode {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }

    public static ComponentNode of(String type, Map<String, Object> attributes, List<ComponentNode> children) {
        return new ComponentNode(type, attributes, null, null, children, List.of(), false);
    }

    /** Nodo marcador: sólo aporta entradas de esquema a su ámbito, nunca se renderiza. */
    public static ComponentNode marker(List<DataSchemaEntry> declarations) {
        return new ComponentNode(null, Map.of(), null, null, List.of(), declarations, true);
    }

    public boolean isInclude() {
        return include != null;
    }

    public boolean hasStyle() {
        return styleRef != null;
    }

    public boolean has(String key) {
        return attributes.get(key) != null;
    }

    public Object attr(String key) {
        return attributes.get(key);
    }

    public String string(String key) {
        Object v = attributes.get(key);
        return v instanceof String s ? s : null;
    }

    public Number number(String key) {
        Object v = attributes.get(key);
        return v instanceof Number n ? n : null;
    }

    /** Verdadero sólo si el atributo es el booleano {@code true}. */
    public boolean flag(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    /** Primer atributo no nulo de la lista de alias. */
    public Object firstOf(String... keys) {
        for (String k : keys) {
            Object v = attributes.get(k);
            if (v != null) return v;
        }
        return null;
    }

    /** Hijos renderizables (sin marcadores). */
    public List<ComponentNode> renderableChildren() {
        List<ComponentNode> out = new ArrayList<>(children.size());
        for (ComponentNode c : children) {
            if (!c.marker()) out.add(c);
        }
        return out;
    }

    /**
     * Partes inline de {@code sections[]} de una Collection/Table ({@code header},
     * {@code cell}, {@code footer}) cuando vienen como objeto. Una referencia por nombre
     * ({@code "cell": "ItemRow"}) no es parte inline.
     */
    @SuppressWarnings("unchecked")
    public List<ComponentNode> sectionParts() {
        if (!(attributes.get("sections") instanceof List<?> sections)) return List.of();
        List<ComponentNode> out = new ArrayList<>();
        for (Object s : sections) {
            if (!(s instanceof Map<?, ?> section)) continue;
            for (String key : SECTION_PARTS) {
                if (section.get(key) instanceof Map<?, ?> part) {
                    // una parte con data nunca es marcador: sus declaraciones son su ámbito
                    Map<String, Object> raw = new LinkedHashMap<>((Map<String, Object>) part);
                    raw.putIfAbsent("type", null);
                    out.add(LayoutReader.fromMap(raw));
                }
            }
        }
        return out;
    }

    /** Entradas propias más las de los marcadores hijos: el ámbito que abre este nodo. */
    public List<DataSchemaEntry> scopeDeclarations() {
        List<DataSchemaEntry> out = new ArrayList<>(declarations);
        for (ComponentNode c : children) {
            if (c.marker()) out.addAll(c.declarations());
        }
        return out;
    }

    public ComponentNode withType(String newType) {
        return new ComponentNode(newType, attributes, styleRef, include, children, declarations, marker);
    }

    public ComponentNode withAttributes(Map<String, Object> newAttributes) {
        return new ComponentNode(type, newAttributes, styleRef, include, children, declarations, marker);
    }

    public ComponentNode withStyleRef(String newStyleRef) {
        return new ComponentNode(type, attributes, newStyleRef, include, children, declarations, marker);
    }

    public ComponentNode withChildren(List<ComponentNode> newChildren) {
        return new ComponentNode(type, attributes, styleRef, include, newChildren, declarations, marker);
    }

    public ComponentNode withDeclarations(List<DataSchemaEntry> newDeclarations) {
        return new ComponentNode(type, attributes, styleRef, include, children, newDeclarations, marker);
    }

    /** Etiqueta corta para mensajes: {@code Button#submit}. */
    public String label() {
        String t = type != null ? type : (marker ? "data" : "View");
        Object id = attributes.get("id");
        return id == null ? t : t + "#" + id;
    }
}
