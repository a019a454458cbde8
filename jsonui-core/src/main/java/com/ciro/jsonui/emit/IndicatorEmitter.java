package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.List;
import java.util.Locale;

/** Indicador de actividad: un spinner {@code animate-spin} centrado. */
public class IndicatorEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("div", node, ctx);
        el.addClass("inline-flex items-center justify-center");
        el.literal("role", "status");

        JsxElement spinner = new JsxElement("div");
        spinner.addClass(spinnerSize(node.attr("size")));
        spinner.addClass("animate-spin rounded-full border-2 border-transparent");
        Object color = node.firstOf("color", "tintColor");
        spinner.addClass(TailwindMapper.color("border-t", color).orElse("border-t-[#3B82F6]"));
        // animating con binding: el spinner sólo existe mientras es verdadero
        String animating = ctx.bindings().expression(node.attr("animating"), ctx.diagnostics(), node.label());
        if (animating != null) {
            return el.render(List.of(TreeWalker.hideEntirely(animating, spinner.render())));
        }
        if (Boolean.FALSE.equals(node.attr("animating"))) return el.render();
        return el.render(List.of(spinner.render()));
    }

    private static String spinnerSize(Object size) {
        if (!(size instanceof String s)) return "w-6 h-6";
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "small" -> "w-4 h-4";
            case "large" -> "w-8 h-8";
            default -> "w-6 h-6";
        };
    }
}
