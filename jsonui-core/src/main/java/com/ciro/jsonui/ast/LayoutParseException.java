package com.ciro.jsonui.ast;

/**
 * El documento no se pudo parsear. Es el único error fatal de la compilación y sólo
 * aborta el documento afectado.
 */
public class LayoutParseException extends RuntimeException {

    private final String document;

    public LayoutParseException(String document, String message, Throwable cause) {
        super("[" + document + "] " + message, cause);
        this.document = document;
    }

    public LayoutParseException(String document, String message) {
        this(document, message, null);
    }

    public String getDocument() {
        return document;
    }
}
