package com.ciro.jsonui.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lista de clases que conserva el orden de inserción y descarta duplicados y vacíos.
 * Cada string agregado se parte por espacios.
 */
public final class ClassList {

    private final Set<String> tokens = new LinkedHashSet<>();

    public ClassList add(String token) {
        if (token == null) return this;
        for (String t : token.trim().split("\\s+")) {
            if (!t.isEmpty()) tokens.add(t);
        }
        return this;
    }

    public ClassList addAll(Collection<String> more) {
        if (more != null) more.forEach(this::add);
        return this;
    }

    public boolean contains(String token) {
        return tokens.contains(token);
    }

    /** Quita todas las clases que empiezan con el prefijo. */
    public ClassList removeIf(String prefix) {
        tokens.removeIf(t -> t.startsWith(prefix));
        return this;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public List<String> tokens() {
        return new ArrayList<>(tokens);
    }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
