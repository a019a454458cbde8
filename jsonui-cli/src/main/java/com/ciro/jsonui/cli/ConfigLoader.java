package com.ciro.jsonui.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lee y valida {@code jsonui.config.json}. Sin archivo se usan los valores por defecto.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_FILE = "jsonui.config.json";

    private final ObjectMapper mapper;
    private final Validator validator;

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
        // sin Expression Language: el interpolador de parámetros alcanza para mensajes fijos
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = factory.getValidator();
    }

    public ConfigLoader() {
        this(ObjectMapperFactory.create());
    }

    /**
     * @throws ConfigException si el archivo no se puede leer o no pasa la validación
     */
    public CompilerConfig load(Path configFile) {
        CompilerConfig config;
        if (Files.isRegularFile(configFile)) {
            try {
                config = mapper.readValue(configFile.toFile(), CompilerConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Cannot read " + configFile + ": " + e.getMessage(), e);
            }
            if (config == null) config = CompilerConfig.defaults();
            log.debug("Loaded configuration from {}", configFile);
        } else {
            log.info("No {} found, using defaults", configFile.getFileName());
            config = CompilerConfig.defaults();
        }
        validate(config);
        return config;
    }

    void validate(CompilerConfig config) {
        Set<ConstraintViolation<CompilerConfig>> violations = validator.validate(config);
        if (violations.isEmpty()) return;
        String detail = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        throw new ConfigException("Invalid configuration: " + detail);
    }

    /**
     * Carpeta de estilos efectiva: la configurada si existe; si no, {@code styles},
     * {@code <layouts>/Styles} o {@code <layouts>/styles}, en ese orden. Si ninguna existe
     * devuelve la configurada (el catálogo queda vacío).
     */
    public static Path stylesDirectory(CompilerConfig config, Path projectRoot) {
        Path configured = projectRoot.resolve(config.stylesDirectory());
        if (Files.isDirectory(configured)) return configured;
        Path layouts = projectRoot.resolve(config.layoutsDirectory());
        for (Path candidate : List.of(projectRoot.resolve("styles"), layouts.resolve("Styles"), layouts.resolve("styles"))) {
            if (Files.isDirectory(candidate)) {
                log.debug("Styles directory {} not found, using {}", configured, candidate);
                return candidate;
            }
        }
        return configured;
    }
}
