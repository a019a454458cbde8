package com.ciro.jsonui.emit;

import com.ciro.jsonui.Diagnostics;
import com.ciro.jsonui.binding.BindingResolver;
import com.ciro.jsonui.binding.VisibilityResolver;
import com.ciro.jsonui.mapping.Orientation;

import java.util.Set;

/**
 * Estado de emisión de un documento. Lo compartido (resolvers, diagnósticos, uso de
 * imports) es el mismo objeto en todo el árbol; sólo cambia la orientación del padre.
 *
 * @param knownDocuments documentos que un include puede referenciar, o null si no se sabe
 */
public record EmitContext(BindingResolver bindings,
                          VisibilityResolver visibility,
                          Diagnostics diagnostics,
                          ModuleUsage usage,
                          Set<String> knownDocuments,
                          Orientation parentOrientation) {

    public static EmitContext root(BindingResolver bindings, VisibilityResolver visibility,
                                   Diagnostics diagnostics, Set<String> knownDocuments) {
        return new EmitContext(bindings, visibility, diagnostics, new ModuleUsage(),
                knownDocuments, Orientation.COLUMN);
    }

    public EmitContext withParent(Orientation orientation) {
        if (orientation == parentOrientation) return this;
        return new EmitContext(bindings, visibility, diagnostics, usage, knownDocuments, orientation);
    }
}
