package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;

/**
 * Switch/Toggle ({@code role="switch"}) y casillas de verificación, ambos como
 * {@code <input type="checkbox">}.
 */
public class ToggleEmitter implements Emitter {

    private final boolean switchRole;

    public ToggleEmitter(boolean switchRole) {
        this.switchRole = switchRole;
    }

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("input", node, ctx);
        el.literal("type", "checkbox");
        if (switchRole) el.literal("role", "switch");
        el.addClass("cursor-pointer");

        Object value = node.firstOf("isOn", "checked", "value");
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        if (expr != null) el.expression("checked", expr);
        else if (Boolean.TRUE.equals(value)) el.flag("defaultChecked");

        String handler = ElementSupport.changeHandler(el, node, ctx);
        if (handler != null) el.expression("onChange", "(e) => " + handler + "?.(e.target.checked)");
        if (Boolean.FALSE.equals(node.attr("enabled"))) el.flag("disabled");

        String label = ElementSupport.text(node, ctx, "label", "text");
        if (label.isEmpty()) return el.render();
        JsxElement wrapper = new JsxElement("label");
        wrapper.addClass("inline-flex items-center gap-2");
        JsxElement caption = new JsxElement("span").text(label);
        return wrapper.render(List.of(el.render(), caption.render()));
    }
}
