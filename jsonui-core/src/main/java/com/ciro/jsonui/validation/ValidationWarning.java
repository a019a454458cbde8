package com.ciro.jsonui.validation;

/**
 * Hallazgo del validador. Nunca bloquea la compilación.
 *
 * @param location {@code Tipo.atributo} donde aparece el binding
 */
public record ValidationWarning(String location, String message, Severity severity) {

    @Override
    public String toString() {
        return severity + " " + message;
    }
}
