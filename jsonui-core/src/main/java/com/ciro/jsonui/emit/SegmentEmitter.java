package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Control segmentado: un botón por elemento de {@code items}; el seleccionado es
 * {@code selectedIndex} y el handler recibe el índice.
 */
public class SegmentEmitter implements Emitter {

    private static final String SEGMENT_BASE =
            "flex-1 px-4 py-2 text-sm font-medium rounded-md transition-colors cursor-pointer";

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("div", node, ctx);
        el.addClass("w-full flex rounded-lg p-1");
        if (!node.has("background")) el.addClass("bg-gray-100");
        ElementSupport.applyEnabled(el, node, ctx);

        Object selected = node.firstOf("selectedIndex", "selectedTabIndex");
        String selectedExpr = ctx.bindings().expression(selected, ctx.diagnostics(), node.label());
        if (selectedExpr == null) {
            Double n = TailwindMapper.number(selected);
            selectedExpr = n == null ? "0" : TailwindMapper.fmt(n);
        }
        String handler = ElementSupport.changeHandler(el, node, ctx);

        List<String> segments = new ArrayList<>();
        if (node.attr("items") instanceof List<?> items) {
            for (int i = 0; i < items.size(); i++) {
                JsxElement button = new JsxElement("button");
                button.expression("key", String.valueOf(i));
                button.literal("type", "button");
                button.raw("className", "className={`" + SEGMENT_BASE + " ${" + selectedExpr + " === " + i
                        + " ? 'bg-white shadow' : 'text-gray-500 hover:text-gray-700'}`}");
                if (handler != null) button.expression("onClick", "() => " + handler + "?.(" + i + ")");
                button.text(ctx.bindings().text(String.valueOf(items.get(i)), ctx.diagnostics(), node.label()));
                segments.add(button.render());
            }
        } else if (node.has("items")) {
            ctx.diagnostics().warn(node.label(), "segment items must be a list; ignored");
        }
        segments.addAll(children);
        return el.render(segments);
    }
}
