package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;

/** Contenedor genérico. También es el emisor de respaldo para tipos desconocidos. */
public class ViewEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("div", node, ctx);
        ElementSupport.applyContainer(el, node, !children.isEmpty());
        if (ElementSupport.applyClick(el, node, ctx)) el.addClass("cursor-pointer");
        return el.render(children);
    }
}
