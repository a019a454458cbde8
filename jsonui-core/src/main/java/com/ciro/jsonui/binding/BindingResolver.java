package com.ciro.jsonui.binding;

import com.ciro.jsonui.Diagnostics;
import org.jsoup.nodes.Entities;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Traduce valores con {@code @{...}} a expresiones JSX.
 * <ul>
 *   <li>{@link #classify} decide la variante de {@link BindingExpression};</li>
 *   <li>{@link #text} produce el contenido hijo de un elemento;</li>
 *   <li>{@link #expression} produce el valor de un atributo;</li>
 *   <li>{@link #action} resuelve atributos de evento.</li>
 * </ul>
 */
public final class BindingResolver {

    private static final Pattern SELECTOR = Pattern.compile("[A-Za-z_$][\\w$]*:?");
    private static final Pattern VERBATIM = Pattern.compile("[{}<>]");

    private final BindingConventions conventions;

    public BindingResolver(BindingConventions conventions) {
        this.conventions = conventions;
    }

    public BindingResolver() {
        this(BindingConventions.STANDARD);
    }

    public BindingConventions conventions() {
        return conventions;
    }

    public BindingExpression classify(Object value, boolean actionAttribute) {
        if (!(value instanceof String raw)) {
            return new BindingExpression.Literal(value == null ? "" : String.valueOf(value));
        }
        String content = BindingLexer.bindingContent(raw);
        if (content == null) return new BindingExpression.Literal(raw);
        if (!BindingLexer.isPath(content)) {
            return new BindingExpression.InvalidBinding(content, "not a property path: " + content);
        }
        return actionAttribute
                ? new BindingExpression.ActionBinding(content)
                : new BindingExpression.DataBinding(content);
    }

    /** Accessor del path (idempotente). */
    public String accessor(String path) {
        return conventions.accessor(path);
    }

    /**
     * Valor de atributo como expresión JS, o null si es un literal. Un binding inválido
     * devuelve {@code undefined} y deja un diagnóstico.
     */
    public String expression(Object value, Diagnostics diagnostics, String location) {
        BindingExpression b = classify(value, false);
        if (b instanceof BindingExpression.DataBinding d) return accessor(d.path());
        if (b instanceof BindingExpression.InvalidBinding inv) {
            diagnostics.warn(location, "invalid binding @{" + inv.content() + "}");
            return "undefined";
        }
        if (value instanceof String s && BindingLexer.containsBinding(s)) {
            return templateLiteral(s, diagnostics, location);
        }
        return null;
    }

    /** Texto mixto como template literal JS: {@code `Hola ${viewModel.data.name}`}. */
    private String templateLiteral(String raw, Diagnostics diagnostics, String location) {
        StringBuilder sb = new StringBuilder("`");
        for (BindingLexer.Segment seg : BindingLexer.lex(raw)) {
            if (seg.binding()) {
                sb.append("${").append(segmentAccessor(seg.text(), diagnostics, location)).append('}');
            } else {
                sb.append(escapeTemplate(seg.text()));
            }
        }
        return sb.append('`').toString();
    }

    /**
     * Contenido hijo JSX de un texto. Líneas múltiples van en un fragmento separadas por
     * {@code <br />}, cada línea escapada por separado.
     */
    public String text(String raw, Diagnostics diagnostics, String location) {
        if (raw == null || raw.isEmpty()) return "";
        String normalized = raw.replace("\r\n", "\n");
        if (!normalized.contains("\n")) {
            return line(normalized, diagnostics, location);
        }
        String[] lines = normalized.split("\n", -1);
        StringBuilder sb = new StringBuilder("<>");
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append("<br />");
            sb.append(line(lines[i], diagnostics, location));
        }
        return sb.append("</>").toString();
    }

    private String line(String raw, Diagnostics diagnostics, String location) {
        StringBuilder sb = new StringBuilder();
        for (BindingLexer.Segment seg : BindingLexer.lex(raw)) {
            if (seg.binding()) {
                if (BindingLexer.isPath(seg.text())) {
                    sb.append('{').append(accessor(seg.text())).append('}');
                } else {
                    diagnostics.warn(location, "invalid binding @{" + seg.text() + "}");
                    sb.append("{/* jsonui: invalid binding @{")
                      .append(seg.text().replace("*/", "* /"))
                      .append("} */}");
                }
            } else {
                sb.append(literal(seg.text()));
            }
        }
        return sb.toString();
    }

    /** Un literal con llaves o ángulos va textual dentro de un template string. */
    static String literal(String text) {
        if (VERBATIM.matcher(text).find()) {
            return "{`" + escapeTemplate(text) + "`}";
        }
        return Entities.escape(text);
    }

    static String escapeTemplate(String text) {
        return text.replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${");
    }

    private String segmentAccessor(String content, Diagnostics diagnostics, String location) {
        if (BindingLexer.isPath(content)) return accessor(content);
        diagnostics.warn(location, "invalid binding @{" + content + "}");
        return "undefined";
    }

    /**
     * Atributo de evento. {@code onClick} exige {@code @{...}}; {@code onclick} exige un
     * selector sin binding y despacha a un método del view model; un mapa
     * {@code {"action": "link", "url": ...}} abre la URL.
     */
    public ActionResolution action(String attribute, Object value, Diagnostics diagnostics, String location) {
        if (value instanceof Map<?, ?> descriptor) {
            return descriptorAction(attribute, descriptor, diagnostics, location);
        }
        if (!(value instanceof String raw) || raw.isBlank()) {
            diagnostics.warn(location, attribute + " has no handler");
            return ActionResolution.comment(attribute + " has no handler");
        }

        boolean selectorForm = attribute.equals(attribute.toLowerCase(Locale.ROOT));
        String content = BindingLexer.bindingContent(raw);

        if (selectorForm) {
            if (content != null || raw.contains("@{")) {
                diagnostics.warn(location, attribute + " expects a selector name, got binding " + raw);
                return ActionResolution.comment(attribute + " expects a selector name (use "
                        + camelEvent(attribute) + " for @{} bindings): " + raw);
            }
            String name = raw.trim();
            if (!SELECTOR.matcher(name).matches()) {
                diagnostics.warn(location, attribute + " selector is not an identifier: " + raw);
                return ActionResolution.comment(attribute + " selector is not an identifier: " + raw);
            }
            if (name.endsWith(":")) name = name.substring(0, name.length() - 1);
            return ActionResolution.handler(conventions.selector(name));
        }

        if (content == null) {
            diagnostics.warn(location, attribute + " expects @{...} binding, got '" + raw + "'");
            return ActionResolution.comment(attribute + " expects @{...} binding, got '" + raw + "'");
        }
        BindingExpression b = classify(raw, true);
        if (b instanceof BindingExpression.ActionBinding a) {
            return ActionResolution.handler(accessor(a.path()));
        }
        diagnostics.warn(location, attribute + " binding is not a property path: " + raw);
        return ActionResolution.comment(attribute + " binding is not a property path: " + raw);
    }

    private ActionResolution descriptorAction(String attribute, Map<?, ?> descriptor,
                                              Diagnostics diagnostics, String location) {
        Object kind = descriptor.get("action");
        Object url = descriptor.get("url");
        if ("link".equals(kind) && url instanceof String u && !u.isBlank()) {
            String target = BindingLexer.isSingleBinding(u)
                    ? segmentAccessor(BindingLexer.bindingContent(u), diagnostics, location)
                    : "'" + u.replace("\\", "\\\\").replace("'", "\\'") + "'";
            return ActionResolution.handler("() => window.open(" + target + ", '_blank')");
        }
        diagnostics.warn(location, attribute + " has an unsupported action descriptor " + descriptor);
        return ActionResolution.comment(attribute + " has an unsupported action descriptor");
    }

    /** {@code onclick} → {@code onClick}. */
    public static String camelEvent(String attribute) {
        if (attribute.length() <= 2 || !attribute.startsWith("on")) return attribute;
        return "on" + Character.toUpperCase(attribute.charAt(2)) + attribute.substring(3);
    }

    /** Paths de todos los bindings del string (para validación y generadores). */
    public static List<String> bindingContents(String raw) {
        return BindingLexer.lex(raw).stream()
                .filter(BindingLexer.Segment::binding)
                .map(BindingLexer.Segment::text)
                .toList();
    }
}
