package com.ciro.jsonui.compiler;

import com.ciro.jsonui.binding.BindingConventions;
import com.ciro.jsonui.emit.EmitterRegistry;
import com.ciro.jsonui.gen.OutputFlavor;
import com.ciro.jsonui.style.StyleCatalog;

import java.util.Objects;
import java.util.Set;

/**
 * Colaboradores de sólo lectura compartidos por todas las compilaciones de un batch.
 * Se pasa explícitamente; no hay singletons.
 *
 * @param knownDocuments nombres de documento válidos para {@code include}, o null para no
 *                       verificarlos
 */
public record CompilerContext(StyleCatalog styles,
                              EmitterRegistry emitters,
                              BindingConventions conventions,
                              OutputFlavor flavor,
                              Set<String> knownDocuments) {

    public CompilerContext {
        Objects.requireNonNull(styles, "styles");
        Objects.requireNonNull(emitters, "emitters");
        Objects.requireNonNull(conventions, "conventions");
        Objects.requireNonNull(flavor, "flavor");
        knownDocuments = knownDocuments == null ? null : Set.copyOf(knownDocuments);
    }

    public static CompilerContext defaults() {
        return new CompilerContext(StyleCatalog.empty(), EmitterRegistry.standard(),
                BindingConventions.STANDARD, OutputFlavor.PLAIN, null);
    }

    public CompilerContext withStyles(StyleCatalog catalog) {
        return new CompilerContext(catalog, emitters, conventions, flavor, knownDocuments);
    }

    public CompilerContext withFlavor(OutputFlavor newFlavor) {
        return new CompilerContext(styles, emitters, conventions, newFlavor, knownDocuments);
    }

    public CompilerContext withEmitters(EmitterRegistry registry) {
        return new CompilerContext(styles, registry, conventions, flavor, knownDocuments);
    }

    public CompilerContext withKnownDocuments(Set<String> documents) {
        return new CompilerContext(styles, emitters, conventions, flavor, documents);
    }
}
