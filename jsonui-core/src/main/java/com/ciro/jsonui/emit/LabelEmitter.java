package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;

/** {@code <span>}; con {@code partialAttributes} cada rango va en su propio span. */
public class LabelEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("span", node, ctx);
        ElementSupport.applyText(el, node, ctx);
        if (ElementSupport.applyClick(el, node, ctx)) el.addClass("cursor-pointer");
        el.text(ElementSupport.partialText(node, ctx).orElseGet(() -> ElementSupport.text(node, ctx, "text")));
        return el.render(children);
    }
}
