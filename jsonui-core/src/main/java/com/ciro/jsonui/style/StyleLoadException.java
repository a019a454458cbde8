package com.ciro.jsonui.style;

/** El archivo de estilo existe pero no es un objeto JSON válido. */
public class StyleLoadException extends RuntimeException {

    private final String styleName;

    public StyleLoadException(String styleName, String message, Throwable cause) {
        super("style '" + styleName + "': " + message, cause);
        this.styleName = styleName;
    }

    public String getStyleName() {
        return styleName;
    }
}
