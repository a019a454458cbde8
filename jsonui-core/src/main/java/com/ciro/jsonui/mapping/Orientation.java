package com.ciro.jsonui.mapping;

/** Eje principal de un contenedor. Sin {@code orientation} se toma columna. */
public enum Orientation {
    ROW, COLUMN;

    public static Orientation of(Object value) {
        if (value instanceof String s && s.equalsIgnoreCase("horizontal")) return ROW;
        return COLUMN;
    }
}
