package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.List;

/**
 * {@code <button>}. Con {@code href} se envuelve en un {@code <Link>} de Next.
 */
public class ButtonEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("button", node, ctx);
        el.literal("type", "button");
        ElementSupport.applyText(el, node, ctx);
        interactionClasses(el, node);
        ElementSupport.applyClick(el, node, ctx);
        ElementSupport.applyEnabled(el, node, ctx);
        el.text(ElementSupport.partialText(node, ctx).orElseGet(() -> ElementSupport.text(node, ctx, "text", "title")));
        String button = el.render(children);

        Object href = node.attr("href");
        if (href == null) return button;
        ctx.usage().useLink();
        JsxElement link = new JsxElement("Link");
        ElementSupport.valueAttribute(link, node, ctx, "href", href);
        return link.render(List.of(button));
    }

    private static void interactionClasses(JsxElement el, ComponentNode node) {
        el.addClass("cursor-pointer transition-colors");
        Object tap = node.firstOf("tapBackground", "highlightBackground");
        if (tap != null) {
            TailwindMapper.color("hover:bg", tap).ifPresent(el::addClass);
            if (node.has("tapBackground")) TailwindMapper.color("active:bg", tap).ifPresent(el::addClass);
        } else {
            el.addClass("hover:opacity-80");
        }
        TailwindMapper.color("hover:text", node.attr("highlightColor")).ifPresent(el::addClass);
        if (node.has("disabledBackground")) {
            TailwindMapper.color("disabled:bg", node.attr("disabledBackground")).ifPresent(el::addClass);
        } else {
            el.addClass("disabled:opacity-50");
        }
        TailwindMapper.color("disabled:text", node.attr("disabledFontColor")).ifPresent(el::addClass);
        el.addClass("disabled:cursor-not-allowed");
    }
}
