package com.ciro.jsonui.binding;

/**
 * Resultado de resolver un atributo de evento: una expresión JS para el handler, o un
 * comentario en línea cuando la forma no corresponde al atributo.
 */
public record ActionResolution(String expression, String inlineComment) {

    public static ActionResolution handler(String expression) {
        return new ActionResolution(expression, null);
    }

    public static ActionResolution comment(String message) {
        return new ActionResolution(null, "/* jsonui: " + message.replace("*/", "* /") + " */");
    }

    public boolean isHandler() {
        return expression != null;
    }
}
