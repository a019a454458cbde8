package com.ciro.jsonui.cli;

/** Configuración ilegible o inválida. Aborta el comando completo. */
public class ConfigException extends RuntimeException {

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigException(String message) {
        super(message);
    }
}
