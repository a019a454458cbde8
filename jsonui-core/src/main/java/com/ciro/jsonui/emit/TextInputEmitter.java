package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;
import java.util.Locale;

/**
 * TextField ({@code <input>}) y TextView ({@code <textarea>}). Un texto con binding y sin
 * handler de cambio recibe el handler por defecto del view model.
 */
public class TextInputEmitter implements Emitter {

    private final boolean multiline;

    public TextInputEmitter(boolean multiline) {
        this.multiline = multiline;
    }

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base(multiline ? "textarea" : "input", node, ctx);
        ElementSupport.applyText(el, node, ctx);
        el.addClass("border outline-none focus:ring-2 focus:ring-blue-500");
        borderStyle(el, node);

        if (!multiline) el.literal("type", inputType(node));
        ElementSupport.valueAttribute(el, node, ctx, "placeholder", node.firstOf("hint", "placeholder"));
        if (node.has("maxLength")) ElementSupport.valueAttribute(el, node, ctx, "maxLength", node.attr("maxLength"));
        if (Boolean.FALSE.equals(node.attr("editable"))) el.flag("readOnly");

        Object text = node.firstOf("text", "value");
        String expr = ctx.bindings().expression(text, ctx.diagnostics(), node.label());
        if (expr != null) el.expression("value", expr);
        else if (text != null) el.literal("defaultValue", String.valueOf(text));

        String handler = ElementSupport.changeHandler(el, node, ctx);
        if (handler != null) el.expression("onChange", "(e) => " + handler + "?.(e.target.value)");
        ElementSupport.applyEvent(el, node, ctx, "onFocus", "onFocus", null);
        ElementSupport.applyEvent(el, node, ctx, "onBlur", "onBlur", null);
        return el.render(children);
    }

    private static String inputType(ComponentNode node) {
        if (node.flag("secure")) return "password";
        Object input = node.attr("input");
        if (!(input instanceof String s)) return "text";
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "email" -> "email";
            case "password" -> "password";
            case "number", "decimal" -> "number";
            case "phone", "tel" -> "tel";
            case "url" -> "url";
            default -> "text";
        };
    }

    private static void borderStyle(JsxElement el, ComponentNode node) {
        if (!(node.attr("borderStyle") instanceof String s)) return;
        switch (s.toLowerCase(Locale.ROOT)) {
            case "roundedrect" -> el.addClass("rounded-md");
            case "line" -> el.addClass("border-b border-t-0 border-l-0 border-r-0");
            default -> { }
        }
    }
}
