package com.ciro.jsonui.emit;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Lo que el markup de un documento necesita importar. Lo llenan los emisores y lo lee el
 * generador del módulo de componente.
 */
public final class ModuleUsage {

    private boolean link;
    private final Set<String> includes = new LinkedHashSet<>();
    private final Set<String> extensions = new LinkedHashSet<>();

    public void useLink() {
        link = true;
    }

    public void useInclude(String component) {
        includes.add(component);
    }

    public void useExtension(String component) {
        extensions.add(component);
    }

    public boolean usesLink() {
        return link;
    }

    public Set<String> includes() {
        return Collections.unmodifiableSet(includes);
    }

    public Set<String> extensions() {
        return Collections.unmodifiableSet(extensions);
    }
}
