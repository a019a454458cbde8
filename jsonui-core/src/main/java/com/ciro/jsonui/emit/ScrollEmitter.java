package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.Orientation;

import java.util.List;

public class ScrollEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("div", node, ctx);
        boolean horizontal = Orientation.of(node.attr("orientation")) == Orientation.ROW
                || node.flag("horizontalScroll");
        el.addClass(horizontal ? "overflow-x-auto flex flex-row" : "overflow-y-auto flex flex-col");
        ElementSupport.applyContainer(el, node, !children.isEmpty());
        if (Boolean.FALSE.equals(node.attr("showsVerticalScrollIndicator"))
                || Boolean.FALSE.equals(node.attr("showsHorizontalScrollIndicator"))) {
            el.addClass("scrollbar-none");
        }
        return el.render(children);
    }
}
