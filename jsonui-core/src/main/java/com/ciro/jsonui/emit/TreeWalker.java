package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.BindingLexer;
import com.ciro.jsonui.binding.VisibilityDirective;
import com.ciro.jsonui.mapping.Orientation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recorre el árbol hijos primero: cada hijo queda emitido antes de cerrar el padre, que
 * lo embebe textualmente. Los marcadores no se emiten.
 */
public final class TreeWalker {

    private final EmitterRegistry registry;

    public TreeWalker(EmitterRegistry registry) {
        this.registry = registry;
    }

    /** Markup del nodo, o null si es un marcador. */
    public String walk(ComponentNode node, EmitContext ctx) {
        if (node.marker()) return null;

        List<String> children = new ArrayList<>();
        if (!node.isInclude()) {
            EmitContext childCtx = ctx.withParent(Orientation.of(node.attr("orientation")));
            for (ComponentNode child : node.children()) {
                String out = walk(child, childCtx);
                if (out != null) children.add(out);
            }
        }

        String element = registry.resolve(node, ctx.diagnostics()).emit(node, children, ctx);
        return wrapVisibility(node, element, ctx);
    }

    private String wrapVisibility(ComponentNode node, String element, EmitContext ctx) {
        Optional<VisibilityDirective> d = ctx.visibility().resolve(node.attr("visibility"));
        if (d.isEmpty()) d = hiddenBinding(node, ctx);
        if (d.isPresent() && d.get().kind() == VisibilityDirective.Kind.HIDE_ENTIRELY) {
            return hideEntirely(d.get().condition(), element);
        }
        if (d.isEmpty() && node.attr("visibility") instanceof String v && BindingLexer.containsBinding(v)) {
            ctx.diagnostics().warn(node.label(), "visibility binding " + v + " is not a supported shape; always rendered");
        }
        return element;
    }

    /** {@code hidden: "@{flag}"} equivale a mostrar cuando {@code !flag}. */
    private Optional<VisibilityDirective> hiddenBinding(ComponentNode node, EmitContext ctx) {
        Object hidden = node.attr("hidden");
        String content = hidden instanceof String s ? BindingLexer.bindingContent(s) : null;
        if (content == null || !BindingLexer.isPath(content)) return Optional.empty();
        String acc = ctx.bindings().accessor(content);
        String cond = acc.startsWith("!") ? acc.substring(1) : "!" + acc;
        return Optional.of(new VisibilityDirective(VisibilityDirective.Kind.HIDE_ENTIRELY, cond, true));
    }

    static String hideEntirely(String condition, String element) {
        return "{" + condition + " && (\n" + JsxElement.indent(element) + "\n)}";
    }
}
