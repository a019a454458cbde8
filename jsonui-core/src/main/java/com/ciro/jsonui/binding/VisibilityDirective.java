package com.ciro.jsonui.binding;

/**
 * Render condicional.
 *
 * @param kind      desmontar el nodo o sólo ocultarlo con opacidad
 * @param condition expresión JS ya resuelta (puede venir negada)
 * @param inverted  la rama verdadera del ternario era la que oculta
 */
public record VisibilityDirective(Kind kind, String condition, boolean inverted) {

    public enum Kind { HIDE_ENTIRELY, FADE_OUT }

    /** Valor de la entrada {@code opacity} del style inline para FADE_OUT. */
    public String opacityExpression() {
        return inverted ? condition + " ? 0 : 1" : condition + " ? 1 : 0";
    }
}
