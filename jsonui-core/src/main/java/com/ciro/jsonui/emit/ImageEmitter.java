package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;
import java.util.Map;

/** Image, CircleImage y NetworkImage como {@code <img>}. */
public class ImageEmitter implements Emitter {

    private static final Map<String, String> CONTENT_MODES = Map.of(
            "aspectFill", "object-cover", "scaleAspectFill", "object-cover", "centerCrop", "object-cover",
            "aspectFit", "object-contain", "scaleAspectFit", "object-contain", "fitCenter", "object-contain",
            "scaleToFill", "object-fill", "fitXY", "object-fill", "center", "object-none");

    private final boolean circle;

    public ImageEmitter(boolean circle) {
        this.circle = circle;
    }

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("img", node, ctx);
        Object mode = node.firstOf("contentMode", "scaleType");
        el.addClass(mode instanceof String s ? CONTENT_MODES.getOrDefault(s, "object-cover") : "object-cover");
        if (circle || node.flag("circle")) el.addClass("rounded-full");
        if (ElementSupport.applyClick(el, node, ctx)) el.addClass("cursor-pointer");

        ElementSupport.valueAttribute(el, node, ctx, "src", node.firstOf("src", "url", "imageUrl"));
        Object alt = node.firstOf("alt", "accessibilityLabel", "contentDescription");
        if (alt == null) el.literal("alt", "");
        else ElementSupport.valueAttribute(el, node, ctx, "alt", alt);
        return el.render();
    }
}
