package com.ciro.jsonui.cli;

import java.util.List;

/**
 * Resumen de un comando sobre todos los documentos.
 *
 * @param failed documentos que no se pudieron parsear o escribir
 */
public record BatchReport(int documents, List<String> failed, int warnings, int diagnostics) {

    public BatchReport {
        failed = List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
