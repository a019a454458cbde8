package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;

import java.util.List;

/**
 * Emite el markup de un nodo. Recibe los hijos ya emitidos: el walker va hijos primero.
 */
@FunctionalInterface
public interface Emitter {

    String emit(ComponentNode node, List<String> children, EmitContext ctx);
}
