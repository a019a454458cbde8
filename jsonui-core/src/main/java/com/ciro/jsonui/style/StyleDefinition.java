package com.ciro.jsonui.style;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.ast.LayoutReader;

import java.util.Map;

/**
 * Estilo con nombre. El cuerpo se parsea igual que un nodo de layout, así un estilo puede
 * traer {@code type}, hijos e incluso su propia referencia {@code style}.
 */
public record StyleDefinition(String name, ComponentNode body) {

    public static StyleDefinition of(String name, Map<String, Object> raw) {
        return new StyleDefinition(name, LayoutReader.fromMap(raw));
    }
}
