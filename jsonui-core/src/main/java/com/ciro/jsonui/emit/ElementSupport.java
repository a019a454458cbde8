package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.ActionResolution;
import com.ciro.jsonui.binding.BindingLexer;
import com.ciro.jsonui.binding.TwoWayBindings;
import com.ciro.jsonui.binding.VisibilityDirective;
import com.ciro.jsonui.mapping.ClassList;
import com.ciro.jsonui.mapping.Orientation;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lo que comparten todos los emisores: id y atributos de test, clases de caja y de
 * texto, entradas de style inline, click y FADE_OUT.
 */
public final class ElementSupport {

    /** Atributo → prefijo de tamaño. */
    private static final Map<String, String> SIZES = orderedMap(
            "width", "w", "height", "h", "minWidth", "min-w", "maxWidth", "max-w",
            "minHeight", "min-h", "maxHeight", "max-h");

    /** Atributo de borde individual → prefijo de espaciado. */
    private static final Map<String, String> EDGES = orderedMap(
            "paddingTop", "pt", "topPadding", "pt",
            "paddingRight", "pr", "rightPadding", "pr",
            "paddingBottom", "pb", "bottomPadding", "pb",
            "paddingLeft", "pl", "leftPadding", "pl",
            "paddingStart", "ps", "startPadding", "ps",
            "paddingEnd", "pe", "endPadding", "pe",
            "insetHorizontal", "px", "insetVertical", "py",
            "marginTop", "mt", "topMargin", "mt",
            "marginRight", "mr", "rightMargin", "mr",
            "marginBottom", "mb", "bottomMargin", "mb",
            "marginLeft", "ml", "leftMargin", "ml",
            "marginStart", "ms", "startMargin", "ms",
            "marginEnd", "me", "endMargin", "me");

    private static final Set<String> OTHER_STYLE_KEYS = Set.of(
            "weight", "flexGrow", "padding", "paddings", "insets", "margin", "margins", "background",
            "cornerRadius", "borderWidth", "borderColor", "borderStyle", "shadow", "opacity", "alpha",
            "zIndex", "elevation", "clipToBounds", "overflow", "direction", "hidden", "enabled",
            "userInteractionEnabled", "alignTop", "alignBottom", "alignLeft", "alignRight",
            "centerHorizontal", "centerVertical", "centerInParent", "offsetX", "offsetY", "tintColor",
            "gradient", "gradientDirection", "fontSize", "fontColor", "font", "fontWeight", "textAlign",
            "textAlignment", "lines", "underline", "strikethrough", "orientation", "gravity", "spacing");

    private ElementSupport() {}

    /** El atributo ya se traduce a clases o a style inline. */
    public static boolean isStyleAttribute(String key) {
        return SIZES.containsKey(key) || EDGES.containsKey(key) || OTHER_STYLE_KEYS.contains(key);
    }

    /**
     * Elemento con todo lo común ya aplicado. El emisor agrega lo propio del widget.
     */
    public static JsxElement base(String tag, ComponentNode node, EmitContext ctx) {
        JsxElement el = new JsxElement(tag);
        reportNonFinite(node, ctx);
        applyId(el, node, ctx);
        el.classes().addAll(boxClasses(node, el, ctx).tokens());
        applyInlineStyle(el, node, ctx);
        applyTestAttributes(el, node);
        applyFade(el, node, ctx);
        return el;
    }

    static void applyId(JsxElement el, ComponentNode node, EmitContext ctx) {
        Object id = node.firstOf("id", "propertyName");
        if (id == null) return;
        String expr = ctx.bindings().expression(id, ctx.diagnostics(), node.label());
        if (expr != null) el.expression("id", expr);
        else el.literal("id", String.valueOf(id));
    }

    /** NaN e infinitos se ignoran como cualquier valor que no mapea, con diagnóstico. */
    static void reportNonFinite(ComponentNode node, EmitContext ctx) {
        for (Map.Entry<String, Object> e : node.attributes().entrySet()) {
            boolean bad = TailwindMapper.nonFinite(e.getValue());
            if (!bad && e.getValue() instanceof List<?> list) {
                bad = list.stream().anyMatch(TailwindMapper::nonFinite);
            }
            if (bad) {
                ctx.diagnostics().warn(node.label(), "non-finite number in '" + e.getKey() + "'; ignored");
            }
        }
    }

    static void applyTestAttributes(JsxElement el, ComponentNode node) {
        if (node.has("testId")) el.literal("data-testid", String.valueOf(node.attr("testId")));
        if (node.has("tag")) el.literal("data-tag", String.valueOf(node.attr("tag")));
    }

    /** Clases de caja: tamaño, espaciado, fondo, bordes, efectos y estado. */
    static ClassList boxClasses(ComponentNode node, JsxElement el, EmitContext ctx) {
        ClassList cl = new ClassList();
        Map<String, Object> a = node.attributes();

        SIZES.forEach((attr, prefix) -> {
            Object v = a.get(attr);
            if (v == null) return;
            if (isBinding(v)) el.style(attr, ctx.bindings().expression(v, ctx.diagnostics(), node.label()));
            else TailwindMapper.size(prefix, v).ifPresent(cl::add);
        });
        TailwindMapper.flexGrow(node.firstOf("weight", "flexGrow")).ifPresent(cl::add);

        box(cl, node, "p", node.firstOf("padding", "paddings", "insets"), ctx);
        box(cl, node, "m", node.firstOf("margin", "margins"), ctx);
        EDGES.forEach((attr, prefix) -> TailwindMapper.spacing(prefix, a.get(attr)).ifPresent(cl::add));

        colorOrStyle(cl, el, node, ctx, "background", "bg", "backgroundColor");
        TailwindMapper.cornerRadius(a.get("cornerRadius")).ifPresent(cl::add);
        TailwindMapper.borderWidth(a.get("borderWidth")).ifPresent(cl::add);
        colorOrStyle(cl, el, node, ctx, "borderColor", "border", "borderColor");
        TailwindMapper.borderStyle(a.get("borderStyle")).ifPresent(cl::add);

        TailwindMapper.shadow(a.get("shadow")).ifPresent(cl::add);
        Object opacity = node.firstOf("opacity", "alpha");
        if (isBinding(opacity)) el.style("opacity", ctx.bindings().expression(opacity, ctx.diagnostics(), node.label()));
        else TailwindMapper.opacity(opacity).ifPresent(cl::add);
        TailwindMapper.zIndex(node.firstOf("zIndex", "elevation")).ifPresent(cl::add);
        if (node.flag("clipToBounds")) cl.add("overflow-hidden");
        TailwindMapper.overflow(a.get("overflow")).ifPresent(cl::add);
        TailwindMapper.direction(a.get("direction")).ifPresent(cl::add);

        TailwindMapper.visibility(a.get("visibility")).ifPresent(cl::add);
        if (node.flag("hidden")) cl.add("hidden");
        if (Boolean.FALSE.equals(a.get("enabled"))) cl.add(TailwindMapper.disabled());
        if (Boolean.FALSE.equals(a.get("userInteractionEnabled"))) cl.add("pointer-events-none");

        cl.addAll(TailwindMapper.selfAlignment(a, ctx.parentOrientation()));
        return cl;
    }

    /** Clases de tipografía. Los colores con binding van al style inline. */
    public static void applyText(JsxElement el, ComponentNode node, EmitContext ctx) {
        Map<String, Object> a = node.attributes();
        TailwindMapper.fontSize(a.get("fontSize")).ifPresent(el::addClass);
        ClassList cl = el.classes();
        colorOrStyle(cl, el, node, ctx, "fontColor", "text", "color");
        TailwindMapper.font(a.get("font")).ifPresent(el::addClass);
        TailwindMapper.fontWeight(a.get("fontWeight")).ifPresent(el::addClass);
        TailwindMapper.textAlign(node.firstOf("textAlign", "textAlignment")).ifPresent(el::addClass);
        TailwindMapper.lineClamp(a.get("lines")).ifPresent(el::addClass);
        if (node.flag("underline")) el.addClass("underline");
        if (node.flag("strikethrough")) el.addClass("line-through");
    }

    /**
     * Clases de contenedor: orientación (columna si hay hijos y no se declara),
     * gravity según esa orientación y {@code spacing} como gap.
     */
    public static void applyContainer(JsxElement el, ComponentNode node, boolean hasChildren) {
        Object orientation = node.attr("orientation");
        if (orientation != null) el.addClass(TailwindMapper.orientation(orientation));
        else if (hasChildren) el.addClass("flex flex-col");
        el.classes().addAll(TailwindMapper.gravity(node.attr("gravity"), Orientation.of(orientation)));
        TailwindMapper.spacing("gap", node.attr("spacing")).ifPresent(el::addClass);
    }

    /**
     * Click genérico ({@code onClick}, {@code onclick} o descriptor de link).
     *
     * @return true si se agregó un handler
     */
    public static boolean applyClick(JsxElement el, ComponentNode node, EmitContext ctx) {
        for (String attr : List.of("onClick", "onclick")) {
            Object v = node.attr(attr);
            if (v == null) continue;
            ActionResolution r = ctx.bindings().action(attr, v, ctx.diagnostics(), node.label());
            if (r.isHandler()) {
                el.expression("onClick", r.expression());
                return true;
            }
            el.comment(r.inlineComment());
        }
        return false;
    }

    /** Handler de un evento con binding, renombrado al evento JSX. */
    public static void applyEvent(JsxElement el, ComponentNode node, EmitContext ctx,
                                  String attribute, String jsxEvent, String argument) {
        Object v = node.attr(attribute);
        if (v == null) return;
        ActionResolution r = ctx.bindings().action(attribute, v, ctx.diagnostics(), node.label());
        if (!r.isHandler()) {
            el.comment(r.inlineComment());
        } else if (argument == null) {
            el.expression(jsxEvent, r.expression());
        } else {
            el.expression(jsxEvent, "(e) => " + r.expression() + "?.(" + argument + ")");
        }
    }

    /**
     * Accessor del handler de cambio de un input: el explícito del nodo o, si el valor
     * tiene binding y no hay handler, el por defecto del hook. Null si no hay ninguno.
     */
    public static String changeHandler(JsxElement el, ComponentNode node, EmitContext ctx) {
        String attr = TwoWayBindings.explicitHandler(node);
        if (attr != null) {
            ActionResolution r = ctx.bindings().action(attr, node.attr(attr), ctx.diagnostics(), node.label());
            if (r.isHandler()) return r.expression();
            el.comment(r.inlineComment());
            return null;
        }
        TwoWayBindings.TwoWay tw = TwoWayBindings.of(node, ctx.bindings().conventions());
        return tw == null ? null : ctx.bindings().accessor(tw.handlerName());
    }

    /** {@code enabled: false} ⇒ {@code disabled}; {@code enabled: @{x}} ⇒ {@code disabled={!x}}. */
    public static void applyEnabled(JsxElement el, ComponentNode node, EmitContext ctx) {
        Object enabled = node.attr("enabled");
        if (Boolean.FALSE.equals(enabled)) {
            el.flag("disabled");
            return;
        }
        String expr = ctx.bindings().expression(enabled, ctx.diagnostics(), node.label());
        if (expr != null) el.expression("disabled", "!" + expr);
    }

    /**
     * Texto con {@code partialAttributes}: cada rango {@code [inicio, fin)} va en un
     * {@code <span>} con sus propias clases, todo en una línea para no perder espacios.
     * Devuelve vacío si el nodo no tiene rangos aplicables.
     */
    public static Optional<String> partialText(ComponentNode node, EmitContext ctx) {
        if (!(node.attr("partialAttributes") instanceof List<?> partials) || partials.isEmpty()) {
            return Optional.empty();
        }
        Object raw = node.attr("text");
        if (!(raw instanceof String text) || BindingLexer.containsBinding(text)) {
            ctx.diagnostics().warn(node.label(), "partialAttributes need a literal text; ignored");
            return Optional.empty();
        }
        List<Map<?, ?>> ranges = new ArrayList<>();
        for (Object p : partials) {
            if (p instanceof Map<?, ?> m && m.get("range") instanceof List<?> r && r.size() == 2
                    && r.get(0) instanceof Number && r.get(1) instanceof Number) {
                ranges.add(m);
            }
        }
        ranges.sort(Comparator.comparingInt(m -> rangeBound(m, 0)));

        StringBuilder sb = new StringBuilder();
        int pos = 0;
        for (Map<?, ?> partial : ranges) {
            int start = Math.max(pos, Math.min(text.length(), rangeBound(partial, 0)));
            int end = Math.min(text.length(), rangeBound(partial, 1));
            if (end <= start) {
                ctx.diagnostics().warn(node.label(), "partialAttributes range " + partial.get("range")
                        + " is empty or overlaps; ignored");
                continue;
            }
            sb.append(ctx.bindings().text(text.substring(pos, start), ctx.diagnostics(), node.label()));
            sb.append(partialSpan(partial, text.substring(start, end), node, ctx));
            pos = end;
        }
        sb.append(ctx.bindings().text(text.substring(pos), ctx.diagnostics(), node.label()));
        return Optional.of(sb.toString());
    }

    private static String partialSpan(Map<?, ?> partial, String piece, ComponentNode node, EmitContext ctx) {
        JsxElement span = new JsxElement("span");
        TailwindMapper.color("text", partial.get("fontColor")).ifPresent(span::addClass);
        TailwindMapper.fontSize(partial.get("fontSize")).ifPresent(span::addClass);
        TailwindMapper.fontWeight(partial.get("fontWeight")).ifPresent(span::addClass);
        TailwindMapper.color("bg", partial.get("background")).ifPresent(span::addClass);
        if (Boolean.TRUE.equals(partial.get("underline"))) span.addClass("underline");
        if (Boolean.TRUE.equals(partial.get("strikethrough"))) span.addClass("line-through");
        for (String attr : List.of("onClick", "onclick")) {
            Object v = partial.get(attr);
            if (v == null) continue;
            ActionResolution r = ctx.bindings().action(attr, v, ctx.diagnostics(), node.label());
            if (r.isHandler()) {
                span.addClass("cursor-pointer");
                span.expression("onClick", r.expression());
            } else {
                span.comment(r.inlineComment());
            }
            break;
        }
        return span.text(ctx.bindings().text(piece, ctx.diagnostics(), node.label())).render();
    }

    private static int rangeBound(Map<?, ?> partial, int index) {
        return Math.max(0, ((Number) ((List<?>) partial.get("range")).get(index)).intValue());
    }

    /** Entradas de style que no tienen clase: transform, accentColor, gradiente. */
    static void applyInlineStyle(JsxElement el, ComponentNode node, EmitContext ctx) {
        Double x = TailwindMapper.number(node.attr("offsetX"));
        Double y = TailwindMapper.number(node.attr("offsetY"));
        if (x != null || y != null) {
            el.styleLiteral("transform", "translate(" + TailwindMapper.fmt(x == null ? 0 : x) + "px, "
                    + TailwindMapper.fmt(y == null ? 0 : y) + "px)");
        }

        Object tint = node.attr("tintColor");
        if (tint != null) {
            String expr = ctx.bindings().expression(tint, ctx.diagnostics(), node.label());
            if (expr != null) el.style("accentColor", expr);
            else el.styleLiteral("accentColor", String.valueOf(tint));
        }

        if (node.attr("gradient") instanceof List<?> colors && colors.size() >= 2) {
            el.styleLiteral("backgroundImage", "linear-gradient(" + gradientDirection(node.attr("gradientDirection"))
                    + ", " + String.join(", ", colors.stream().map(String::valueOf).toList()) + ")");
        }
    }

    static void applyFade(JsxElement el, ComponentNode node, EmitContext ctx) {
        Optional<VisibilityDirective> d = ctx.visibility().resolve(node.attr("visibility"));
        if (d.isPresent() && d.get().kind() == VisibilityDirective.Kind.FADE_OUT) {
            el.style("opacity", d.get().opacityExpression());
        }
    }

    /** Texto JSX de un atributo (o vacío si no hay). */
    public static String text(ComponentNode node, EmitContext ctx, String... keys) {
        Object v = node.firstOf(keys);
        if (v == null) return "";
        return ctx.bindings().text(String.valueOf(v), ctx.diagnostics(), node.label());
    }

    /** Valor de atributo: expresión si tiene binding, literal si no. */
    public static void valueAttribute(JsxElement el, ComponentNode node, EmitContext ctx,
                                      String jsxName, Object value) {
        if (value == null) return;
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        if (expr != null) el.expression(jsxName, expr);
        else if (value instanceof Number || value instanceof Boolean) el.expression(jsxName, String.valueOf(value));
        else el.literal(jsxName, String.valueOf(value));
    }

    private static void box(ClassList cl, ComponentNode node, String base, Object value, EmitContext ctx) {
        if (value == null) return;
        Optional<List<String>> tokens = TailwindMapper.box(base, value);
        if (tokens.isPresent()) {
            cl.addAll(tokens.get());
        } else {
            ctx.diagnostics().warn(node.label(), (base.equals("p") ? "padding" : "margin")
                    + " array must have 1, 2 or 4 values, got " + ((List<?>) value).size() + "; ignored");
        }
    }

    private static void colorOrStyle(ClassList cl, JsxElement el, ComponentNode node, EmitContext ctx,
                                     String attr, String prefix, String styleKey) {
        Object v = node.attr(attr);
        if (v == null) return;
        if (isBinding(v)) el.style(styleKey, ctx.bindings().expression(v, ctx.diagnostics(), node.label()));
        else TailwindMapper.color(prefix, v).ifPresent(cl::add);
    }

    static String gradientDirection(Object direction) {
        if (!(direction instanceof String s)) return "to bottom";
        return switch (s) {
            case "horizontal", "leftToRight" -> "to right";
            case "rightToLeft" -> "to left";
            case "bottomToTop" -> "to top";
            case "diagonal", "topLeftToBottomRight" -> "to bottom right";
            case "oblique" -> "45deg";
            default -> "to bottom";
        };
    }

    static boolean isBinding(Object v) {
        return v instanceof String s && BindingLexer.containsBinding(s);
    }

    private static Map<String, String> orderedMap(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return Collections.unmodifiableMap(m);
    }
}
