package com.ciro.jsonui.schema;

import java.util.Map;
import java.util.Objects;

/**
 * Una propiedad declarada en un nodo marcador ({@code {"data": [...]}}).
 *
 * @param name         nombre bindeable
 * @param kind         tipo normalizado
 * @param declaredClass clase tal como aparece en el JSON (puede ser null)
 * @param defaultValue valor por defecto literal, o null si la propiedad es opcional
 * @param tsTypeOverride tipo TypeScript explícito ({@code "tsType"}), o null
 */
public record DataSchemaEntry(String name,
                              DataKind kind,
                              String declaredClass,
                              Object defaultValue,
                              String tsTypeOverride) {

    public DataSchemaEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static DataSchemaEntry of(String name, DataKind kind) {
        return new DataSchemaEntry(name, kind, kind.schemaName(), null, null);
    }

    /**
     * Construye la entrada desde el mapa crudo. Devuelve null si no trae {@code name}.
     */
    public static DataSchemaEntry fromMap(Map<?, ?> raw) {
        if (raw == null || !(raw.get("name") instanceof String name) || name.isBlank()) {
            return null;
        }
        Object cls = raw.get("class");
        if (cls == null) cls = raw.get("type");
        String declared = cls == null ? null : String.valueOf(cls);
        Object tsType = raw.get("tsType");

        return new DataSchemaEntry(
                name.trim(),
                DataKind.fromDeclaredClass(declared),
                declared,
                raw.get("defaultValue"),
                tsType instanceof String s && !s.isBlank() ? s : null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /** Las declaraciones de la clase ViewModel describen el contenedor, no datos. */
    public boolean isViewModelDeclaration() {
        return declaredClass != null && declaredClass.endsWith("ViewModel");
    }

    public String tsType() {
        if (tsTypeOverride != null) return tsTypeOverride;
        if (kind == DataKind.MODEL_REFERENCE && declaredClass != null) return declaredClass;
        return kind.tsType();
    }
}
