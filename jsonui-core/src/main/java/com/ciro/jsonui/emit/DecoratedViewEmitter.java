package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Contenedores con un efecto visual propio: GradientView (fondo {@code linear-gradient}),
 * Blur ({@code backdropFilter}) y CircleView (recorte circular con relleno y trazo).
 * Por lo demás se comportan como View.
 */
public class DecoratedViewEmitter implements Emitter {

    public enum Decoration { GRADIENT, BLUR, CIRCLE }

    private final Decoration decoration;

    public DecoratedViewEmitter(Decoration decoration) {
        this.decoration = decoration;
    }

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("div", node, ctx);
        ElementSupport.applyContainer(el, node, !children.isEmpty());
        switch (decoration) {
            case GRADIENT -> gradient(el, node, ctx);
            case BLUR -> blur(el, node);
            case CIRCLE -> circle(el, node, ctx, !children.isEmpty());
        }
        if (ElementSupport.applyClick(el, node, ctx)) el.addClass("cursor-pointer");
        return el.render(children);
    }

    private static void gradient(JsxElement el, ComponentNode node, EmitContext ctx) {
        if (!(node.attr("gradient") instanceof List<?> colors) || colors.size() < 2) {
            ctx.diagnostics().warn(node.label(), "gradient needs at least two colors");
            return;
        }
        List<String> stops = new ArrayList<>();
        List<?> locations = node.attr("locations") instanceof List<?> l && l.size() == colors.size() ? l : null;
        for (int i = 0; i < colors.size(); i++) {
            Double at = locations == null ? null : TailwindMapper.number(locations.get(i));
            stops.add(at == null ? String.valueOf(colors.get(i))
                    : colors.get(i) + " " + (int) (at * 100) + "%");
        }
        el.styleLiteral("backgroundImage", "linear-gradient(" + angle(node) + ", " + String.join(", ", stops) + ")");
    }

    /** {@code startPoint}/{@code endPoint} en coordenadas unitarias ganan sobre {@code gradientDirection}. */
    private static String angle(ComponentNode node) {
        if (node.attr("startPoint") instanceof List<?> start && node.attr("endPoint") instanceof List<?> end
                && start.size() == 2 && end.size() == 2) {
            Double sx = TailwindMapper.number(start.get(0));
            Double sy = TailwindMapper.number(start.get(1));
            Double ex = TailwindMapper.number(end.get(0));
            Double ey = TailwindMapper.number(end.get(1));
            if (sx != null && sy != null && ex != null && ey != null) {
                return Math.round(Math.toDegrees(Math.atan2(ey - sy, ex - sx)) + 90) + "deg";
            }
        }
        return ElementSupport.gradientDirection(node.attr("gradientDirection"));
    }

    private static void blur(JsxElement el, ComponentNode node) {
        String effect = node.attr("effectStyle") instanceof String s
                ? s.toLowerCase(Locale.ROOT).replaceAll("\\s+", "") : "regular";
        Double intensity = TailwindMapper.number(node.attr("intensity"));
        long amount = intensity != null ? Math.round(intensity * 20) : switch (effect) {
            case "ultrathin", "systemultrathinmaterial" -> 4;
            case "thin", "systemthinmaterial" -> 8;
            case "regular", "systemmaterial" -> 12;
            case "thick", "systemthickmaterial" -> 16;
            case "chrome", "systemchromematerial" -> 20;
            default -> 10;
        };
        el.styleLiteral("backdropFilter", "blur(" + amount + "px)");
        el.styleLiteral("WebkitBackdropFilter", "blur(" + amount + "px)");
        if (!node.has("background") && !el.hasStyle("backgroundColor")) {
            el.styleLiteral("backgroundColor", tint(effect));
        }
    }

    private static String tint(String effect) {
        return switch (effect) {
            case "light", "extralight", "regular", "systemmaterial" -> "rgba(255, 255, 255, 0.7)";
            case "dark" -> "rgba(0, 0, 0, 0.5)";
            case "ultrathin", "systemultrathinmaterial" -> "rgba(255, 255, 255, 0.3)";
            case "thin", "systemthinmaterial" -> "rgba(255, 255, 255, 0.5)";
            case "thick", "systemthickmaterial" -> "rgba(255, 255, 255, 0.85)";
            case "chrome", "systemchromematerial" -> "rgba(255, 255, 255, 0.9)";
            case "prominent" -> "rgba(240, 240, 240, 0.8)";
            default -> "rgba(255, 255, 255, 0.6)";
        };
    }

    private static void circle(JsxElement el, ComponentNode node, EmitContext ctx, boolean hasChildren) {
        el.addClass("rounded-full overflow-hidden");
        if (hasChildren) el.addClass("flex items-center justify-center");
        Object fill = node.attr("fillColor");
        if (ElementSupport.isBinding(fill)) {
            el.style("backgroundColor", ctx.bindings().expression(fill, ctx.diagnostics(), node.label()));
        } else {
            TailwindMapper.color("bg", fill).ifPresent(el::addClass);
        }
        Object strokeColor = node.attr("strokeColor");
        Object strokeWidth = node.attr("strokeWidth");
        if (strokeColor != null || strokeWidth != null) {
            TailwindMapper.borderWidth(strokeWidth == null ? 1 : strokeWidth).ifPresent(el::addClass);
            TailwindMapper.color("border", strokeColor == null ? "#000000" : strokeColor).ifPresent(el::addClass);
        }
    }
}
