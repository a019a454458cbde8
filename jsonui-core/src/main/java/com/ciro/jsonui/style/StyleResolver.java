package com.ciro.jsonui.style;

import com.ciro.jsonui.Diagnostics;
import com.ciro.jsonui.ast.ComponentNode;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resuelve las referencias {@code style} y mezcla el estilo con el nodo.
 * <p>
 * Reglas de mezcla: mapas anidados se combinan clave a clave, listas y escalares los
 * reemplaza el nodo, el {@code type} del nodo gana al del estilo y los hijos del estilo
 * sólo se usan si el nodo no trae ninguno. Pre-orden: los subárboles que aporta un
 * estilo también se resuelven.
 */
public final class StyleResolver {

    private final StyleCatalog catalog;

    public StyleResolver(StyleCatalog catalog) {
        this.catalog = catalog;
    }

    public ComponentNode resolve(ComponentNode node, Diagnostics diagnostics) {
        if (node.marker()) return node;
        ComponentNode merged = node.hasStyle() ? applyStyle(node, diagnostics, new ArrayDeque<>()) : node;

        List<ComponentNode> children = merged.children();
        if (children.isEmpty()) return merged;
        List<ComponentNode> resolved = new ArrayList<>(children.size());
        for (ComponentNode c : children) {
            resolved.add(resolve(c, diagnostics));
        }
        return merged.withChildren(resolved);
    }

    private ComponentNode applyStyle(ComponentNode node, Diagnostics diagnostics, Deque<String> chain) {
        String name = node.styleRef();
        ComponentNode stripped = node.withStyleRef(null);

        if (chain.contains(name)) {
            diagnostics.warn(node.label(), "style cycle " + chain + " -> " + name + "; reference ignored");
            return stripped;
        }

        Optional<StyleDefinition> found;
        try {
            found = catalog.find(name);
        } catch (StyleLoadException | UncheckedIOException e) {
            diagnostics.warn(node.label(), "malformed style '" + name + "': " + e.getMessage());
            return stripped;
        }
        if (found.isEmpty()) {
            diagnostics.warn(node.label(), "style '" + name + "' not found");
            return stripped;
        }

        ComponentNode base = found.get().body();
        if (base.hasStyle()) {
            // un estilo puede heredar de otro
            chain.push(name);
            base = applyStyle(base, diagnostics, chain);
            chain.pop();
        }
        return merge(base, stripped);
    }

    /** {@code merge(base, override)}: el override gana clave a clave. */
    public static ComponentNode merge(ComponentNode base, ComponentNode override) {
        String type = override.type() != null ? override.type() : base.type();
        List<ComponentNode> children = override.children().isEmpty() ? base.children() : override.children();
        var declarations = override.declarations().isEmpty() ? base.declarations() : override.declarations();
        String include = override.include() != null ? override.include() : base.include();
        return new ComponentNode(type,
                deepMerge(base.attributes(), override.attributes()),
                null,
                include,
                children,
                declarations,
                false);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> out = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> e : override.entrySet()) {
            Object current = out.get(e.getKey());
            Object incoming = e.getValue();
            if (current instanceof Map<?, ?> cm && incoming instanceof Map<?, ?> im) {
                out.put(e.getKey(), deepMerge((Map<String, Object>) cm, (Map<String, Object>) im));
            } else {
                out.put(e.getKey(), incoming);
            }
        }
        return out;
    }
}
