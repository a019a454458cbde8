package com.ciro.jsonui.mapping;

import com.ciro.jsonui.binding.BindingLexer;
import com.helger.css.utils.CSSColorHelper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Funciones puras valor → clases Tailwind, una por dimensión de estilo.
 * <p>
 * Ninguna función recibe bindings: los valores {@code @{...}} los desvía el emisor al
 * style inline antes de llegar aquí (si llegan, devuelven vacío).
 */
public final class TailwindMapper {

    static final SnapScale SPACING = SnapScale.of(
            0, "0", 1, "px", 2, "0.5", 4, "1", 6, "1.5", 8, "2", 10, "2.5", 12, "3", 14, "3.5",
            16, "4", 20, "5", 24, "6", 28, "7", 32, "8", 36, "9", 40, "10", 44, "11", 48, "12",
            56, "14", 64, "16");

    static final SnapScale FONT_SIZE = SnapScale.of(
            12, "xs", 14, "sm", 16, "base", 18, "lg", 20, "xl", 24, "2xl", 30, "3xl", 36, "4xl",
            48, "5xl", 60, "6xl");

    static final SnapScale RADIUS = SnapScale.of(
            0, "none", 2, "sm", 4, "", 6, "md", 8, "lg", 12, "xl", 16, "2xl", 24, "3xl");

    static final SnapScale OPACITY = SnapScale.of(
            0.0, "0", 0.1, "10", 0.2, "20", 0.25, "25", 0.3, "30", 0.4, "40", 0.5, "50", 0.6, "60",
            0.7, "70", 0.75, "75", 0.8, "80", 0.9, "90", 1.0, "100");

    static final SnapScale Z_INDEX = SnapScale.of(0, "0", 10, "10", 20, "20", 30, "30", 40, "40", 50, "50");

    static final SnapScale BORDER_WIDTH = SnapScale.of(0, "0", 1, "", 2, "2", 4, "4", 8, "8");

    private static final Map<String, String> SHADOWS = Map.of(
            "sm", "shadow-sm", "md", "shadow-md", "lg", "shadow-lg", "xl", "shadow-xl",
            "2xl", "shadow-2xl", "none", "shadow-none", "inner", "shadow-inner", "default", "shadow");

    private static final Map<String, String> FONT_WEIGHTS = Map.ofEntries(
            Map.entry("thin", "font-thin"), Map.entry("ultralight", "font-extralight"),
            Map.entry("extralight", "font-extralight"), Map.entry("light", "font-light"),
            Map.entry("normal", "font-normal"), Map.entry("regular", "font-normal"),
            Map.entry("medium", "font-medium"), Map.entry("semibold", "font-semibold"),
            Map.entry("bold", "font-bold"), Map.entry("heavy", "font-extrabold"),
            Map.entry("extrabold", "font-extrabold"), Map.entry("black", "font-black"));

    private TailwindMapper() {}

    // ------------------------------------------------------------------ tamaños

    /**
     * {@code prefix} es {@code w}, {@code h}, {@code min-w}, {@code max-w}, {@code min-h} o
     * {@code max-h}.
     */
    public static Optional<String> size(String prefix, Object value) {
        if (value == null || isBinding(value) || nonFinite(value)) return Optional.empty();
        if (value instanceof Number n) return Optional.of(prefix + "-[" + fmt(n) + "px]");
        String s = String.valueOf(value).trim();
        boolean bounded = prefix.startsWith("min-") || prefix.startsWith("max-");
        switch (s) {
            case "matchParent", "match_parent", "fill":
                return Optional.of(prefix + "-full");
            case "wrapContent", "wrap_content":
                return Optional.of(prefix + (bounded ? "-fit" : "-auto"));
            case "":
                return Optional.empty();
            default:
                Double parsed = parse(s);
                if (parsed != null) return Optional.of(prefix + "-[" + fmt(parsed) + "px]");
                return Optional.of(prefix + "-[" + s.replace(' ', '_') + "]");
        }
    }

    // ------------------------------------------------------------------ espaciado

    /**
     * Un valor de espaciado con prefijo ({@code p}, {@code px}, {@code mt}, {@code gap}...).
     * Dentro de [0,64] se ajusta a la escala; fuera, valor arbitrario.
     */
    public static Optional<String> spacing(String prefix, Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        if (!SPACING.covers(v)) return Optional.of(prefix + "-[" + fmt(v) + "px]");
        return Optional.of(prefix + "-" + SPACING.nearest(v));
    }

    /**
     * Arrays de caja: 1 → uniforme, 2 → (bloque, línea), 4 → arriba, derecha, abajo,
     * izquierda. Otra longitud no produce clases: devuelve vacío para que el llamador
     * deje el diagnóstico.
     *
     * @param base {@code p} o {@code m}
     */
    public static Optional<List<String>> box(String base, Object value) {
        List<String> out = new ArrayList<>();
        if (!(value instanceof List<?> list)) {
            spacing(base, value).ifPresent(out::add);
            return Optional.of(out);
        }
        switch (list.size()) {
            case 1 -> spacing(base, list.get(0)).ifPresent(out::add);
            case 2 -> {
                spacing(base + "y", list.get(0)).ifPresent(out::add);
                spacing(base + "x", list.get(1)).ifPresent(out::add);
            }
            case 4 -> {
                spacing(base + "t", list.get(0)).ifPresent(out::add);
                spacing(base + "r", list.get(1)).ifPresent(out::add);
                spacing(base + "b", list.get(2)).ifPresent(out::add);
                spacing(base + "l", list.get(3)).ifPresent(out::add);
            }
            default -> {
                return Optional.empty();
            }
        }
        return Optional.of(out);
    }

    // ------------------------------------------------------------------ color

    /**
     * Hex o {@code rgb()/hsl()} literal ⇒ {@code <prefix>-[literal]}; cualquier otro token
     * se delega a la paleta con nombre de Tailwind.
     */
    public static Optional<String> color(String prefix, Object value) {
        if (!(value instanceof String raw) || raw.isBlank() || isBinding(raw)) return Optional.empty();
        String v = raw.trim();
        if (isColorLiteral(v)) {
            return Optional.of(prefix + "-[" + v.replace(" ", "_") + "]");
        }
        return Optional.of(prefix + "-" + v);
    }

    public static boolean isColorLiteral(String v) {
        if (v.startsWith("#")) return true;
        String lower = v.toLowerCase(Locale.ROOT);
        return CSSColorHelper.isRGBColorValue(lower)
                || CSSColorHelper.isRGBAColorValue(lower)
                || CSSColorHelper.isHSLColorValue(lower)
                || CSSColorHelper.isHSLAColorValue(lower);
    }

    // ------------------------------------------------------------------ bordes

    public static Optional<String> cornerRadius(Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        return Optional.of(RADIUS.exact(v)
                .map(s -> s.isEmpty() ? "rounded" : "rounded-" + s)
                .orElse("rounded-[" + fmt(v) + "px]"));
    }

    public static Optional<String> borderWidth(Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        return Optional.of(BORDER_WIDTH.exact(v)
                .map(s -> s.isEmpty() ? "border" : "border-" + s)
                .orElse("border-[" + fmt(v) + "px]"));
    }

    public static Optional<String> borderStyle(Object value) {
        if (!(value instanceof String s)) return Optional.empty();
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "solid" -> Optional.of("border-solid");
            case "dashed" -> Optional.of("border-dashed");
            case "dotted" -> Optional.of("border-dotted");
            case "none" -> Optional.of("border-none");
            default -> Optional.empty();
        };
    }

    // ------------------------------------------------------------------ tipografía

    public static Optional<String> fontSize(Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        return Optional.of(FONT_SIZE.exact(v)
                .map(s -> "text-" + s)
                .orElse("text-[" + fmt(v) + "px]"));
    }

    public static Optional<String> fontWeight(Object value) {
        if (value instanceof Number n) {
            int w = Math.max(100, Math.min(900, (int) Math.round(n.doubleValue() / 100.0) * 100));
            return Optional.of(switch (w) {
                case 100 -> "font-thin";
                case 200 -> "font-extralight";
                case 300 -> "font-light";
                case 400 -> "font-normal";
                case 500 -> "font-medium";
                case 600 -> "font-semibold";
                case 700 -> "font-bold";
                case 800 -> "font-extrabold";
                default -> "font-black";
            });
        }
        if (!(value instanceof String s) || isBinding(s)) return Optional.empty();
        Double parsed = parse(s);
        if (parsed != null) return fontWeight(parsed);
        return Optional.ofNullable(FONT_WEIGHTS.get(s.trim().toLowerCase(Locale.ROOT)));
    }

    /** {@code font}: {@code "bold"} es un peso; cualquier otro nombre es una familia. */
    public static Optional<String> font(Object value) {
        if (!(value instanceof String s) || s.isBlank() || isBinding(s)) return Optional.empty();
        Optional<String> weight = fontWeight(s);
        if (weight.isPresent()) return weight;
        return Optional.of("font-['" + s.trim().replace(' ', '_') + "']");
    }

    public static Optional<String> textAlign(Object value) {
        if (!(value instanceof String s)) return Optional.empty();
        return switch (s.trim()) {
            case "left", "start" -> Optional.of("text-left");
            case "center", "centerHorizontal" -> Optional.of("text-center");
            case "right", "end" -> Optional.of("text-right");
            case "justify", "justified" -> Optional.of("text-justify");
            default -> Optional.empty();
        };
    }

    public static Optional<String> lineClamp(Object value) {
        Double v = number(value);
        if (v == null || v <= 0) return Optional.empty();
        if (v == 1) return Optional.of("truncate");
        return Optional.of("line-clamp-" + fmt(v));
    }

    // ------------------------------------------------------------------ efectos

    public static Optional<String> opacity(Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        if (!OPACITY.covers(v)) return Optional.of("opacity-[" + fmt(v) + "]");
        return Optional.of("opacity-" + OPACITY.nearest(v));
    }

    /**
     * Sombra: nombre de tamaño, {@code true}, o mapa
     * {@code {offsetX, offsetY, radius, color}} como propiedad arbitraria.
     */
    public static Optional<String> shadow(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) return Optional.empty();
        if (Boolean.TRUE.equals(value)) return Optional.of("shadow");
        if (value instanceof Map<?, ?> m) {
            Double x = number(first(m, "offsetX", "x"));
            Double y = number(first(m, "offsetY", "y"));
            Double r = number(first(m, "radius", "blur"));
            Object c = first(m, "color");
            StringBuilder sb = new StringBuilder("[box-shadow:");
            sb.append(fmt(x == null ? 0 : x)).append("px_")
              .append(fmt(y == null ? 0 : y)).append("px_")
              .append(fmt(r == null ? 0 : r)).append("px");
            if (c instanceof String cs && !cs.isBlank()) sb.append('_').append(cs.trim().replace(' ', '_'));
            return Optional.of(sb.append(']').toString());
        }
        if (value instanceof String s) {
            String key = s.trim();
            if (key.isEmpty() || key.equals("true")) return Optional.of("shadow");
            return Optional.ofNullable(SHADOWS.get(key));
        }
        return Optional.empty();
    }

    public static Optional<String> zIndex(Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        return Optional.of(Z_INDEX.exact(v)
                .map(s -> "z-" + s)
                .orElse("z-[" + fmt(v) + "]"));
    }

    public static Optional<String> flexGrow(Object value) {
        Double v = number(value);
        if (v == null) return Optional.empty();
        if (v == 0) return Optional.of("flex-none");
        if (v == 1) return Optional.of("flex-1");
        return Optional.of("flex-[" + fmt(v) + "]");
    }

    // ------------------------------------------------------------------ layout

    public static String orientation(Object value) {
        return Orientation.of(value) == Orientation.ROW ? "flex flex-row" : "flex flex-col";
    }

    /**
     * Gravity según la orientación del contenedor. En columna lo horizontal va al eje
     * cruzado ({@code items-*}) y lo vertical al principal ({@code justify-*}); en fila al
     * revés. Acepta {@code "top|left"} o una lista.
     */
    public static List<String> gravity(Object value, Orientation orientation) {
        Set<String> out = new LinkedHashSet<>();
        for (String g : gravityTokens(value)) {
            switch (g) {
                case "left", "start" -> out.add(horizontal(orientation, "start"));
                case "right", "end" -> out.add(horizontal(orientation, "end"));
                case "centerHorizontal" -> out.add(horizontal(orientation, "center"));
                case "top" -> out.add(vertical(orientation, "start"));
                case "bottom" -> out.add(vertical(orientation, "end"));
                case "centerVertical" -> out.add(vertical(orientation, "center"));
                case "center" -> {
                    out.add(horizontal(orientation, "center"));
                    out.add(vertical(orientation, "center"));
                }
                default -> { }
            }
        }
        return new ArrayList<>(out);
    }

    /** Alineación propia de un hijo ({@code alignTop}, {@code centerInParent}...). */
    public static List<String> selfAlignment(Map<String, Object> attrs, Orientation parent) {
        List<String> out = new ArrayList<>();
        // sólo el eje cruzado del padre se puede alinear por hijo
        boolean crossIsHorizontal = parent == Orientation.COLUMN;
        if (crossIsHorizontal) {
            if (Boolean.TRUE.equals(attrs.get("alignLeft"))) out.add("self-start");
            if (Boolean.TRUE.equals(attrs.get("alignRight"))) out.add("self-end");
            if (Boolean.TRUE.equals(attrs.get("centerHorizontal"))) out.add("self-center");
        } else {
            if (Boolean.TRUE.equals(attrs.get("alignTop"))) out.add("self-start");
            if (Boolean.TRUE.equals(attrs.get("alignBottom"))) out.add("self-end");
            if (Boolean.TRUE.equals(attrs.get("centerVertical"))) out.add("self-center");
        }
        if (Boolean.TRUE.equals(attrs.get("centerInParent"))) out.add("self-center");
        return out;
    }

    public static Optional<String> overflow(Object value) {
        if (!(value instanceof String s)) return Optional.empty();
        return switch (s) {
            case "hidden", "clip" -> Optional.of("overflow-hidden");
            case "scroll", "auto" -> Optional.of("overflow-auto");
            case "visible" -> Optional.of("overflow-visible");
            default -> Optional.empty();
        };
    }

    public static Optional<String> direction(Object value) {
        if (!(value instanceof String s)) return Optional.empty();
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "rtl", "righttoleft" -> Optional.of("[direction:rtl]");
            case "ltr", "lefttoright" -> Optional.of("[direction:ltr]");
            default -> Optional.empty();
        };
    }

    /** Visibilidad estática (sin binding). */
    public static Optional<String> visibility(Object value) {
        if (Boolean.FALSE.equals(value)) return Optional.of("hidden");
        if (!(value instanceof String s) || isBinding(s)) return Optional.empty();
        return switch (s.trim()) {
            case "gone", "false" -> Optional.of("hidden");
            case "invisible" -> Optional.of("invisible");
            default -> Optional.empty();
        };
    }

    /** {@code enabled: false}. */
    public static String disabled() {
        return "opacity-50 pointer-events-none";
    }

    // ------------------------------------------------------------------ utilidades

    private static String horizontal(Orientation o, String where) {
        return (o == Orientation.COLUMN ? "items-" : "justify-") + where;
    }

    private static String vertical(Orientation o, String where) {
        return (o == Orientation.COLUMN ? "justify-" : "items-") + where;
    }

    private static List<String> gravityTokens(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object o : list) out.addAll(gravityTokens(o));
        } else if (value instanceof String s) {
            for (String part : s.split("\\|")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return out;
    }

    private static Object first(Map<?, ?> m, String... keys) {
        for (String k : keys) {
            if (m.get(k) != null) return m.get(k);
        }
        return null;
    }

    static boolean isBinding(Object value) {
        return value instanceof String s && BindingLexer.containsBinding(s);
    }

    /** Número desde Number o string numérico; null si no lo es. */
    public static Double number(Object value) {
        if (value instanceof Number n) return finite(n.doubleValue());
        if (value instanceof String s && !isBinding(s)) return parse(s);
        return null;
    }

    /**
     * NaN o infinito, sea número JSON ({@code 1e400} llega como infinito) o string
     * ({@code "NaN"}, {@code "Infinity"}). Esos valores no producen clases.
     */
    public static boolean nonFinite(Object value) {
        if (value instanceof Number n) return !Double.isFinite(n.doubleValue());
        if (value instanceof String s && !isBinding(s)) {
            Double d = parseRaw(s);
            return d != null && !Double.isFinite(d);
        }
        return false;
    }

    private static Double parse(String s) {
        Double d = parseRaw(s);
        return d == null ? null : finite(d);
    }

    private static Double parseRaw(String s) {
        String t = s.trim();
        if (t.endsWith("px")) t = t.substring(0, t.length() - 2).trim();
        if (t.isEmpty()) return null;
        try {
            return Double.valueOf(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double finite(double d) {
        return Double.isFinite(d) ? d : null;
    }

    /** 100.0 → "100", 0.55 → "0.55". */
    public static String fmt(Number n) {
        double d = n.doubleValue();
        if (!Double.isFinite(d)) return String.valueOf(d);
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
