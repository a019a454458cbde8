package com.ciro.jsonui.compiler;

import com.ciro.jsonui.Diagnostic;
import com.ciro.jsonui.validation.ValidationWarning;

import java.util.List;

/**
 * Salida de un documento.
 *
 * @param markup          expresión JSX del árbol
 * @param componentModule archivo de componente completo
 * @param dataModule      módulo de tipos {@code <Name>Data}
 * @param hookModule      hook {@code use<Name>ViewModel}
 */
public record CompilationResult(String document,
                                String componentName,
                                String markup,
                                String componentModule,
                                String dataModule,
                                String hookModule,
                                List<ValidationWarning> warnings,
                                List<Diagnostic> diagnostics) {

    public CompilationResult {
        warnings = List.copyOf(warnings);
        diagnostics = List.copyOf(diagnostics);
    }
}
