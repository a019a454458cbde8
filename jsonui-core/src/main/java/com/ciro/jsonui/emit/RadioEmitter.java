package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Grupo de radios: con {@code items}, un {@code <label>} por opción bajo el mismo
 * {@code name}; sin ellos, un radio suelto cuyo valor es el id.
 */
public class RadioEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        Object id = node.attr("id");
        String group = node.attr("group") instanceof String g ? g : (id instanceof String s ? s : "radioGroup");
        String selected = ctx.bindings().expression(node.attr("selectedValue"), ctx.diagnostics(), node.label());

        if (!(node.attr("items") instanceof List<?> items)) {
            JsxElement el = ElementSupport.base("input", node, ctx);
            el.literal("type", "radio");
            el.addClass("cursor-pointer");
            el.literal("name", group);
            String value = id instanceof String s ? s : "option";
            el.literal("value", value);
            option(el, node, selected, ElementSupport.changeHandler(el, node, ctx), value);
            String label = ElementSupport.text(node, ctx, "text", "label");
            if (label.isEmpty()) return el.render();
            JsxElement wrapper = new JsxElement("label").addClass("flex items-center gap-2 cursor-pointer");
            return wrapper.render(List.of(el.render(), new JsxElement("span").text(label).render()));
        }

        JsxElement el = ElementSupport.base("div", node, ctx);
        el.addClass("flex flex-col gap-2");
        String handler = ElementSupport.changeHandler(el, node, ctx);
        List<String> content = new ArrayList<>();
        String title = ElementSupport.text(node, ctx, "text", "label");
        if (!title.isEmpty()) content.add(new JsxElement("span").addClass("font-medium").text(title).render());
        for (Object item : items) {
            String value = String.valueOf(item);
            JsxElement input = new JsxElement("input");
            input.literal("type", "radio");
            input.literal("name", group);
            input.literal("value", value);
            option(input, node, selected, handler, value);
            JsxElement label = new JsxElement("label").addClass("flex items-center gap-2 cursor-pointer");
            content.add(label.render(List.of(input.render(),
                    new JsxElement("span").text(ctx.bindings().text(value, ctx.diagnostics(), node.label())).render())));
        }
        content.addAll(children);
        return el.render(content);
    }

    private static void option(JsxElement input, ComponentNode node, String selected, String handler, String value) {
        String literal = JsxElement.jsString(value);
        if (selected != null) input.expression("checked", selected + " === " + literal);
        else if (value.equals(node.attr("selectedValue"))) input.flag("defaultChecked");
        if (handler != null) input.expression("onChange", "() => " + handler + "?.(" + literal + ")");
        if (Boolean.FALSE.equals(node.attr("enabled"))) input.flag("disabled");
    }
}
