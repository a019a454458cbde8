package com.ciro.jsonui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Colector de diagnósticos de un documento. Una instancia por compilación; no es
 * thread-safe ni necesita serlo.
 */
public final class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final String document;
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics(String document) {
        this.document = document;
    }

    public static Diagnostics forDocument(String document) {
        return new Diagnostics(document);
    }

    public void warn(String location, String message) {
        entries.add(new Diagnostic(Diagnostic.Level.WARN, location, message));
        log.warn("[{}] {}: {}", document, location, message);
    }

    public void info(String location, String message) {
        entries.add(new Diagnostic(Diagnostic.Level.INFO, location, message));
        log.debug("[{}] {}: {}", document, location, message);
    }

    public String document() {
        return document;
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
