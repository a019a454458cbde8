package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.BindingLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code <select>}. Los items literales son {@code <option>} fijos; un binding de items
 * se mapea en tiempo de render con {@code value}/{@code id} y {@code text}/{@code label}.
 */
public class SelectBoxEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("select", node, ctx);
        ElementSupport.applyText(el, node, ctx);
        el.addClass("border rounded-md px-3 py-2 cursor-pointer");

        Object selected = node.firstOf("selectedValue", "value");
        String expr = ctx.bindings().expression(selected, ctx.diagnostics(), node.label());
        if (expr != null) el.expression("value", expr);
        else if (selected != null) el.literal("defaultValue", String.valueOf(selected));

        String handler = ElementSupport.changeHandler(el, node, ctx);
        if (handler != null) el.expression("onChange", "(e) => " + handler + "?.(e.target.value)");
        ElementSupport.applyEnabled(el, node, ctx);

        List<String> options = new ArrayList<>();
        Object hint = node.firstOf("hint", "placeholder");
        if (hint != null) {
            JsxElement placeholder = new JsxElement("option").literal("value", "").flag("disabled");
            options.add(placeholder.text(ctx.bindings().text(String.valueOf(hint), ctx.diagnostics(), node.label())).render());
        }
        Object items = node.attr("items");
        if (items instanceof List<?> list) {
            for (Object item : list) options.add(option(item, node, ctx));
        } else if (items instanceof String s && BindingLexer.isSingleBinding(s)) {
            String source = ctx.bindings().expression(s, ctx.diagnostics(), node.label());
            options.add("{" + source + "?.map((item) => (\n"
                    + JsxElement.indent("<option key={item.value || item.id} value={item.value || item.id}>"
                    + "{item.text || item.label}</option>")
                    + "\n))}");
        } else if (items != null) {
            ctx.diagnostics().warn(node.label(), "select items must be a list or a binding; ignored");
        }
        return el.render(options);
    }

    private static String option(Object item, ComponentNode node, EmitContext ctx) {
        Object value = item;
        Object text = item;
        if (item instanceof Map<?, ?> m) {
            value = m.get("value") != null ? m.get("value") : (m.get("id") != null ? m.get("id") : m.get("text"));
            text = m.get("text") != null ? m.get("text") : (m.get("label") != null ? m.get("label") : value);
        }
        JsxElement option = new JsxElement("option").literal("value", String.valueOf(value));
        return option.text(ctx.bindings().text(String.valueOf(text), ctx.diagnostics(), node.label())).render();
    }
}
