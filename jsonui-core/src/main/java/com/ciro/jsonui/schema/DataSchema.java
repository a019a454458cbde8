package com.ciro.jsonui.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Conjunto de nombres visibles en un ámbito. Los ámbitos se encadenan: un hijo ve lo
 * suyo más lo de sus ancestros, nunca lo de sus hermanos.
 */
public final class DataSchema {

    private static final DataSchema EMPTY = new DataSchema(null, Map.of());

    private final DataSchema parent;
    private final Map<String, DataSchemaEntry> entries;

    private DataSchema(DataSchema parent, Map<String, DataSchemaEntry> entries) {
        this.parent = parent;
        this.entries = entries;
    }

    public static DataSchema empty() {
        return EMPTY;
    }

    /** Abre un ámbito hijo con las entradas indicadas (vacío ⇒ devuelve este mismo). */
    public DataSchema child(Collection<DataSchemaEntry> declared) {
        if (declared == null || declared.isEmpty()) return this;
        Map<String, DataSchemaEntry> local = new LinkedHashMap<>();
        for (DataSchemaEntry e : declared) {
            if (!e.isViewModelDeclaration()) local.put(e.name(), e);
        }
        if (local.isEmpty()) return this;
        return new DataSchema(this, Collections.unmodifiableMap(local));
    }

    public Optional<DataSchemaEntry> lookup(String name) {
        for (DataSchema s = this; s != null; s = s.parent) {
            DataSchemaEntry e = s.entries.get(name);
            if (e != null) return Optional.of(e);
        }
        return Optional.empty();
    }

    public boolean declares(String name) {
        return lookup(name).isPresent();
    }
}
