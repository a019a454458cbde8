package com.ciro.jsonui.schema;

import java.util.Locale;

/**
 * Tipo declarado de una entrada del esquema de datos.
 * <p>
 * El nombre de esquema ({@link #schemaName()}) es el que se sugiere en los warnings
 * del validador; {@link #tsType()} es el tipo que se emite en el módulo de datos.
 */
public enum DataKind {
    STRING("String", "string"),
    NUMBER("Number", "number"),
    BOOLEAN("Boolean", "boolean"),
    ARRAY("Array", "any[]"),
    FUNCTION("Function", "() => void"),
    MODEL_REFERENCE("ModelReference", "unknown");

    private final String schemaName;
    private final String tsType;

    DataKind(String schemaName, String tsType) {
        this.schemaName = schemaName;
        this.tsType = tsType;
    }

    public String schemaName() { return schemaName; }

    public String tsType() { return tsType; }

    /**
     * Traduce la clase declarada en el JSON ({@code "class": "Int"}, {@code "Bool"},
     * {@code "(() -> Void)?"}, {@code "[String]"}...) a un tipo del esquema.
     * Cualquier nombre desconocido se toma como referencia a un modelo.
     */
    public static DataKind fromDeclaredClass(String declared) {
        if (declared == null || declared.isBlank()) return STRING;
        String c = declared.trim();

        if (c.contains("->") || c.contains("=>")) return FUNCTION;
        if (c.startsWith("[") || c.startsWith("Array") || c.startsWith("List") || c.endsWith("[]")) return ARRAY;

        return switch (c.toLowerCase(Locale.ROOT)) {
            case "string", "text", "color", "image", "url" -> STRING;
            case "int", "integer", "long", "double", "float", "cgfloat", "number", "decimal" -> NUMBER;
            case "bool", "boolean" -> BOOLEAN;
            case "function", "action", "callback", "closure" -> FUNCTION;
            case "array", "list" -> ARRAY;
            default -> MODEL_REFERENCE;
        };
    }
}
