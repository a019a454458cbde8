package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.List;

/** {@code <input type="range">}; límites por {@code minimumValue}/{@code maximumValue} o {@code range}. */
public class SliderEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("input", node, ctx);
        el.literal("type", "range");
        el.addClass("w-full cursor-pointer");

        Object min = node.firstOf("minimumValue", "minValue");
        Object max = node.firstOf("maximumValue", "maxValue");
        if (node.attr("range") instanceof List<?> range && range.size() == 2) {
            min = range.get(0);
            max = range.get(1);
        }
        bound(el, node, ctx, "min", min, 0);
        bound(el, node, ctx, "max", max, 100);
        if (node.has("step")) bound(el, node, ctx, "step", node.attr("step"), 1);

        Object value = node.attr("value");
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        Double literal = TailwindMapper.number(value);
        if (expr != null) el.expression("value", expr);
        else if (literal != null) el.expression("defaultValue", TailwindMapper.fmt(literal));

        String handler = ElementSupport.changeHandler(el, node, ctx);
        if (handler != null) el.expression("onChange", "(e) => " + handler + "?.(Number(e.target.value))");
        ElementSupport.applyEnabled(el, node, ctx);
        return el.render();
    }

    private static void bound(JsxElement el, ComponentNode node, EmitContext ctx,
                              String name, Object value, int fallback) {
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        if (expr != null) {
            el.expression(name, expr);
            return;
        }
        Double n = TailwindMapper.number(value);
        el.expression(name, n != null ? TailwindMapper.fmt(n) : String.valueOf(fallback));
    }
}
