package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Icono más texto. {@code iconPosition} decide la dirección del flex y el lado del
 * margen del icono; con {@code selected} por binding el icono alterna entre
 * {@code icon_on} e {@code icon_off}.
 */
public class IconLabelEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        String position = node.attr("iconPosition") instanceof String s ? s.toLowerCase(Locale.ROOT) : "left";
        JsxElement el = ElementSupport.base("div", node, ctx);
        String direction = switch (position) {
            case "right" -> "flex-row-reverse";
            case "top" -> "flex-col";
            case "bottom" -> "flex-col-reverse";
            default -> "flex-row";
        };
        el.addClass("flex " + direction + " items-center");
        if (ElementSupport.applyClick(el, node, ctx)) el.addClass("cursor-pointer");

        List<String> content = new ArrayList<>();
        icon(node, ctx, position).ifPresent(content::add);
        JsxElement label = new JsxElement("span");
        ElementSupport.applyText(label, node, ctx);
        String text = ElementSupport.text(node, ctx, "text");
        if (!text.isEmpty()) content.add(label.text(text).render());
        content.addAll(children);
        return el.render(content);
    }

    private static Optional<String> icon(ComponentNode node, EmitContext ctx, String position) {
        Object off = node.firstOf("icon_off", "icon");
        Object on = node.attr("icon_on");
        if (off == null && on == null) return Optional.empty();

        JsxElement img = new JsxElement("img");
        String selected = ctx.bindings().expression(node.attr("selected"), ctx.diagnostics(), node.label());
        if (selected != null && on != null && off != null) {
            img.expression("src", selected + " ? " + source(on, node, ctx) + " : " + source(off, node, ctx));
        } else {
            img.expression("src", source(off != null ? off : on, node, ctx));
        }
        img.literal("alt", "");
        if (node.attr("iconSize") instanceof List<?> size && size.size() == 2) {
            TailwindMapper.size("w", size.get(0)).ifPresent(img::addClass);
            TailwindMapper.size("h", size.get(1)).ifPresent(img::addClass);
        }
        Object margin = node.attr("iconMargin") == null ? 4 : node.attr("iconMargin");
        String side = switch (position) {
            case "right" -> "ml";
            case "top" -> "mb";
            case "bottom" -> "mt";
            default -> "mr";
        };
        TailwindMapper.spacing(side, margin).ifPresent(img::addClass);
        return Optional.of(img.render());
    }

    private static String source(Object value, ComponentNode node, EmitContext ctx) {
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        return expr != null ? expr : JsxElement.jsString(String.valueOf(value));
    }
}
