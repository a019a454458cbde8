package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Contenido web como {@code <iframe>}: {@code url} va en {@code src}, {@code html} en
 * {@code srcDoc}. El sandbox y los permisos siguen los flags del nodo.
 */
public class WebEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("iframe", node, ctx);
        el.addClass("border-0");
        if (Boolean.FALSE.equals(node.attr("scrollEnabled"))) el.addClass("overflow-hidden");

        Object url = node.firstOf("url", "src");
        Object html = node.firstOf("html", "htmlContent");
        if (url != null) ElementSupport.valueAttribute(el, node, ctx, "src", url);
        else if (html != null) ElementSupport.valueAttribute(el, node, ctx, "srcDoc", html);
        else ctx.diagnostics().warn(node.label(), "web view without url or html");

        ElementSupport.valueAttribute(el, node, ctx, "title", node.firstOf("title", "accessibilityLabel"));
        if (!Boolean.FALSE.equals(node.attr("sandbox"))) el.literal("sandbox", String.join(" ", sandbox(node)));
        List<String> allow = allow(node);
        if (!allow.isEmpty()) el.literal("allow", String.join("; ", allow));
        if (node.attr("loading") instanceof String loading) el.literal("loading", loading);
        ElementSupport.applyEvent(el, node, ctx, "onLoad", "onLoad", null);
        return el.render();
    }

    private static List<String> sandbox(ComponentNode node) {
        List<String> out = new ArrayList<>();
        if (!Boolean.FALSE.equals(node.attr("javaScriptEnabled"))) out.add("allow-scripts");
        out.add("allow-same-origin");
        if (node.flag("javaScriptCanOpenWindowsAutomatically")) out.add("allow-popups");
        out.add("allow-forms");
        out.add("allow-modals");
        out.add("allow-downloads");
        return out;
    }

    private static List<String> allow(ComponentNode node) {
        List<String> out = new ArrayList<>();
        if (node.flag("allowsInlineMediaPlayback")) out.add("autoplay");
        if (!Boolean.FALSE.equals(node.attr("allowsFullScreen"))) out.add("fullscreen");
        if (node.flag("allowsCamera")) out.add("camera");
        if (node.flag("allowsMicrophone")) out.add("microphone");
        if (node.flag("allowsGeolocation")) out.add("geolocation");
        return out;
    }
}
