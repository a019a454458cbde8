package com.ciro.jsonui.binding;

/**
 * Clasificación de un valor de atributo. Exactamente una de las cuatro variantes.
 */
public sealed interface BindingExpression {

    /** Texto sin bindings. */
    record Literal(String text) implements BindingExpression {}

    /** {@code @{path}}: referencia a datos. El path puede empezar con {@code !}. */
    record DataBinding(String path) implements BindingExpression {}

    /** {@code @{path}} en un atributo de evento. */
    record ActionBinding(String path) implements BindingExpression {}

    /** {@code @{...}} cuyo contenido no es un path. */
    record InvalidBinding(String content, String reason) implements BindingExpression {}

    default boolean isBinding() {
        return !(this instanceof Literal);
    }
}
