package com.ciro.jsonui;

/**
 * Aviso no fatal de la compilación: algo se reemplazó por un valor por defecto y el
 * documento siguió compilando.
 */
public record Diagnostic(Level level, String location, String message) {

    public enum Level { INFO, WARN }

    @Override
    public String toString() {
        return "[" + level + "] " + (location == null || location.isEmpty() ? "" : location + ": ") + message;
    }
}
