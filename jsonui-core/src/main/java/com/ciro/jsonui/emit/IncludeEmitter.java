package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.util.Names;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Referencia a otro documento: {@code <PascalName id="..." prop={...} />}. Las props salen
 * de {@code shared_data} y {@code data} (este último gana).
 */
public class IncludeEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        String target = node.include();
        if (target == null || target.isBlank()) {
            ctx.diagnostics().warn(node.label(), "include without target");
            return "{/* jsonui: include without target */}";
        }
        String documentName = Names.baseName(target);
        if (ctx.knownDocuments() != null
                && !ctx.knownDocuments().contains(target)
                && !ctx.knownDocuments().contains(documentName)) {
            ctx.diagnostics().warn(node.label(), "unknown include '" + target + "'");
            return "{/* jsonui: unknown include '" + target.replace("*/", "* /") + "' */}";
        }

        String component = Names.pascal(documentName);
        ctx.usage().useInclude(component);

        JsxElement el = new JsxElement(component);
        ElementSupport.applyId(el, node, ctx);
        Map<String, Object> props = new LinkedHashMap<>();
        if (node.attr("shared_data") instanceof Map<?, ?> shared) shared.forEach((k, v) -> props.put(String.valueOf(k), v));
        if (node.attr("data") instanceof Map<?, ?> data) data.forEach((k, v) -> props.put(String.valueOf(k), v));
        props.forEach((k, v) -> el.expression(k, propValue(v, node, ctx)));
        ElementSupport.applyTestAttributes(el, node);
        return el.render();
    }

    private String propValue(Object value, ComponentNode node, EmitContext ctx) {
        if (value == null) return "null";
        if (value instanceof Number || value instanceof Boolean) return String.valueOf(value);
        if (value instanceof Map<?, ?> m) {
            StringBuilder sb = new StringBuilder("{ ");
            boolean first = true;
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(e.getKey()).append(": ").append(propValue(e.getValue(), node, ctx));
                first = false;
            }
            return sb.append(" }").toString();
        }
        if (value instanceof List<?> l) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < l.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(propValue(l.get(i), node, ctx));
            }
            return sb.append(']').toString();
        }
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        if (expr != null) return expr;
        return JsxElement.jsString(String.valueOf(value));
    }
}
