package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.BindingLexer;
import com.ciro.jsonui.mapping.TailwindMapper;
import com.ciro.jsonui.util.Names;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collection/Table. Header, celda y footer son otros documentos, referenciados por nombre
 * o por {@code className}. Con {@code sections} la celda de la sección {@code i} itera
 * {@code items.sections[i].cells.data}; sin secciones ({@code cellClasses}) itera
 * {@code items}. Cada celda recibe su elemento como {@code viewModel.data}.
 */
public class CollectionEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("div", node, ctx);
        layout(el, node);
        if (ElementSupport.applyClick(el, node, ctx)) el.addClass("cursor-pointer");

        String items = items(node, ctx);
        List<String> content = new ArrayList<>();
        boolean anyCell;
        if (node.attr("sections") instanceof List<?> sections && !sections.isEmpty()) {
            anyCell = false;
            for (int i = 0; i < sections.size(); i++) {
                if (sections.get(i) instanceof Map<?, ?> section) {
                    anyCell |= section(section, i, items, node, ctx, content);
                }
            }
        } else {
            anyCell = legacy(items, node, ctx, content);
        }
        if (!anyCell) ctx.diagnostics().warn(node.label(), "collection without cell layout");
        content.addAll(children);
        return el.render(content);
    }

    private static void layout(JsxElement el, ComponentNode node) {
        Object direction = node.firstOf("layout", "scrollDirection");
        Double columns = TailwindMapper.number(node.firstOf("columnCount", "columns"));
        if (direction instanceof String s && s.toLowerCase(Locale.ROOT).equals("horizontal")) {
            el.addClass("overflow-x-auto flex flex-row");
            if (!Boolean.FALSE.equals(node.attr("scrollEnabled"))) el.addClass("flex-nowrap");
        } else if (columns != null && columns >= 2) {
            int n = columns.intValue();
            el.addClass("grid");
            el.addClass(n <= 12 ? "grid-cols-" + n : "grid-cols-[repeat(" + n + ",minmax(0,1fr))]");
        } else {
            el.addClass("flex flex-col");
        }
        TailwindMapper.spacing("gap", node.firstOf("itemSpacing", "spacing")).ifPresent(el::addClass);
        // contentInset: [top, left, bottom, right]
        if (node.attr("contentInset") instanceof List<?> inset && inset.size() == 4) {
            String[] prefixes = {"pt", "pl", "pb", "pr"};
            for (int i = 0; i < 4; i++) {
                TailwindMapper.spacing(prefixes[i], inset.get(i)).ifPresent(el::addClass);
            }
        }
    }

    private static String items(ComponentNode node, EmitContext ctx) {
        Object items = node.attr("items");
        if (items == null) return null;
        if (items instanceof String s && BindingLexer.isSingleBinding(s)) {
            return ctx.bindings().expression(s, ctx.diagnostics(), node.label());
        }
        ctx.diagnostics().warn(node.label(), "collection items must be a binding; ignored");
        return null;
    }

    private static boolean section(Map<?, ?> section, int index, String items, ComponentNode node,
                                   EmitContext ctx, List<String> content) {
        String header = reference(section.get("header"), "header", node, ctx, content);
        if (header != null) content.add("<" + header + " />");

        String cell = reference(section.get("cell"), "cell", node, ctx, content);
        if (cell != null) {
            String source = items == null ? null : items + "?.sections?.[" + index + "]?.cells?.data";
            content.add(cells(cell, source, "cellData", "cellIndex", node, ctx));
        }

        String footer = reference(section.get("footer"), "footer", node, ctx, content);
        if (footer != null) content.add("<" + footer + " />");
        return cell != null;
    }

    private static boolean legacy(String items, ComponentNode node, EmitContext ctx, List<String> content) {
        String header = reference(first(node.attr("headerClasses")), "header", node, ctx, content);
        if (header != null) content.add("<" + header + " />");

        String cell = reference(first(node.attr("cellClasses")), "cell", node, ctx, content);
        if (cell != null) content.add(cells(cell, items, "item", "index", node, ctx));

        String footer = reference(first(node.attr("footerClasses")), "footer", node, ctx, content);
        if (footer != null) content.add("<" + footer + " />");
        return cell != null;
    }

    private static String cells(String component, String source, String item, String index,
                                ComponentNode node, EmitContext ctx) {
        if (source == null) {
            ctx.diagnostics().warn(node.label(), "cell '" + component + "' has no items binding; rendered once");
            return "<" + component + " viewModel={{ data: {} }} />";
        }
        return "{" + source + "?.map((" + item + ", " + index + ") => (\n"
                + JsxElement.indent("<" + component + " key={" + index + "} viewModel={{ data: " + item + " }} />")
                + "\n))}";
    }

    /** {@code cellClasses} es una lista; sólo la primera clase tiene celda propia. */
    private static Object first(Object classes) {
        if (classes instanceof List<?> l) return l.isEmpty() ? null : l.get(0);
        return classes;
    }

    /**
     * Componente de una parte de sección, ya registrado como import. Null si no hay parte;
     * una referencia que no resuelve deja un comentario en el contenido.
     */
    private static String reference(Object part, String role, ComponentNode node, EmitContext ctx,
                                    List<String> content) {
        if (part == null) return null;
        Object name = part instanceof Map<?, ?> m ? m.get("className") : part;
        if (!(name instanceof String target) || target.isBlank()) {
            ctx.diagnostics().warn(node.label(), "inline " + role + " is not rendered; reference a layout by className");
            return null;
        }
        String documentName = Names.baseName(target);
        if (ctx.knownDocuments() != null
                && !ctx.knownDocuments().contains(target)
                && !ctx.knownDocuments().contains(documentName)
                && !ctx.knownDocuments().contains(Names.snake(documentName))) {
            ctx.diagnostics().warn(node.label(), "unknown " + role + " layout '" + target + "'");
            content.add("{/* jsonui: unknown " + role + " '" + target.replace("*/", "* /") + "' */}");
            return null;
        }
        String component = Names.pascal(documentName);
        ctx.usage().useInclude(component);
        return component;
    }
}
