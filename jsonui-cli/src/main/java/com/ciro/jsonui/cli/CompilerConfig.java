package com.ciro.jsonui.cli;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Contenido de {@code jsonui.config.json}. Las claves ausentes toman el valor por defecto;
 * las rutas relativas se resuelven contra la carpeta del archivo de configuración.
 */
public record CompilerConfig(
        @NotBlank(message = "layoutsDirectory es obligatorio") String layoutsDirectory,
        @NotBlank(message = "stylesDirectory es obligatorio") String stylesDirectory,
        @NotBlank(message = "componentsDirectory es obligatorio") String componentsDirectory,
        @NotBlank(message = "dataDirectory es obligatorio") String dataDirectory,
        @NotBlank(message = "hooksDirectory es obligatorio") String hooksDirectory,
        Boolean typescript,
        @NotNull @Min(value = 1, message = "parallelism debe ser al menos 1")
        @Max(value = 64, message = "parallelism no puede pasar de 64") Integer parallelism,
        List<@NotBlank(message = "extensionComponents no admite nombres vacíos") String> extensionComponents) {

    public static final String DEFAULT_LAYOUTS = "src/Layouts";
    public static final String DEFAULT_STYLES = "src/Styles";
    public static final String DEFAULT_COMPONENTS = "src/generated/components";
    public static final String DEFAULT_DATA = "src/generated/data";
    public static final String DEFAULT_HOOKS = "src/generated/hooks";

    public CompilerConfig {
        layoutsDirectory = layoutsDirectory == null ? DEFAULT_LAYOUTS : layoutsDirectory;
        stylesDirectory = stylesDirectory == null ? DEFAULT_STYLES : stylesDirectory;
        componentsDirectory = componentsDirectory == null ? DEFAULT_COMPONENTS : componentsDirectory;
        dataDirectory = dataDirectory == null ? DEFAULT_DATA : dataDirectory;
        hooksDirectory = hooksDirectory == null ? DEFAULT_HOOKS : hooksDirectory;
        typescript = typescript != null && typescript;
        parallelism = parallelism == null ? Math.min(64, Runtime.getRuntime().availableProcessors()) : parallelism;
        extensionComponents = extensionComponents == null ? List.of() : List.copyOf(extensionComponents);
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(null, null, null, null, null, null, null, null);
    }

    public CompilerConfig withStylesDirectory(String directory) {
        return new CompilerConfig(layoutsDirectory, directory, componentsDirectory, dataDirectory,
                hooksDirectory, typescript, parallelism, extensionComponents);
    }
}
