package com.ciro.jsonui.validation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Formas de lógica de negocio que no deben aparecer dentro de un binding, en orden de
 * prioridad: se reporta sólo la primera que aparece.
 */
public enum LogicConstruct {
    TERNARY("ternary operator", "(?<!\\?)\\?(?![?.])[^:]*:"),
    LOGICAL("logical operator (&& / ||)", "&&|\\|\\|"),
    ARITHMETIC("arithmetic operator", "[\\w$)\\]]\\s*[-+*/%]\\s*[\\w$(!]"),
    NIL_COALESCING("nil-coalescing operator (??)", "\\?\\?"),
    FUNCTION_CALL("function call with arguments", "[A-Za-z_$][\\w$]*\\s*\\(\\s*[^)\\s]"),
    COMPARISON("comparison operator", "===?|!==?|<=|>=|<|>");

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:\\\\.|[^'\\\\])*'|\"(?:\\\\.|[^\"\\\\])*\"");

    private final String description;
    private final Pattern pattern;

    LogicConstruct(String description, String regex) {
        this.description = description;
        this.pattern = Pattern.compile(regex);
    }

    public String description() {
        return description;
    }

    /** Primera construcción presente en el contenido del binding. */
    public static Optional<LogicConstruct> detect(String content) {
        if (content == null || content.isBlank()) return Optional.empty();
        String code = withoutStrings(content);
        for (LogicConstruct c : values()) {
            if (c.pattern.matcher(code).find()) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Reemplaza los literales de string: su contenido no cuenta ('a-b', "x > y"). */
    static String withoutStrings(String content) {
        return STRING_LITERAL.matcher(content).replaceAll("_s");
    }
}
