package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Componente propio del proyecto ({@code extensionComponents} en la configuración): se
 * emite como {@code <Tipo ... />} y los atributos no estructurales pasan como props.
 */
public class ExtensionEmitter implements Emitter {

    private static final Set<String> CONSUMED = Set.of(
            "id", "propertyName", "testId", "tag", "visibility", "onClick", "onclick");

    private final String component;

    public ExtensionEmitter(String component) {
        this.component = component;
    }

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        ctx.usage().useExtension(component);
        JsxElement el = ElementSupport.base(component, node, ctx);
        ElementSupport.applyClick(el, node, ctx);
        for (Map.Entry<String, Object> e : node.attributes().entrySet()) {
            String key = e.getKey();
            if (CONSUMED.contains(key) || ElementSupport.isStyleAttribute(key) || !isPropName(key)) continue;
            Object v = e.getValue();
            if (v instanceof Map<?, ?> || v instanceof List<?>) continue;
            if (key.startsWith("on") && key.length() > 2 && Character.isUpperCase(key.charAt(2))) {
                ElementSupport.applyEvent(el, node, ctx, key, key, null);
            } else if (!el.hasAttribute(key)) {
                ElementSupport.valueAttribute(el, node, ctx, key, v);
            }
        }
        return el.render(children);
    }

    private static boolean isPropName(String key) {
        return key.matches("[A-Za-z_$][\\w$]*");
    }
}
