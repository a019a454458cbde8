package com.ciro.jsonui.style;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Catálogo respaldado por un directorio: {@code <dir>/<name>.json}.
 * Carga perezosa; cada estilo se lee una sola vez y queda cacheado para todo el batch.
 */
public class DirectoryStyleCatalog implements StyleCatalog {

    private static final Logger log = LoggerFactory.getLogger(DirectoryStyleCatalog.class);
    private static final TypeReference<LinkedHashMap<String, Object>> RAW = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper mapper;
    private final LoadingCache<String, Optional<StyleDefinition>> cache;

    public DirectoryStyleCatalog(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .build(this::load);
    }

    public DirectoryStyleCatalog(Path directory) {
        this(directory, new ObjectMapper());
    }

    @Override
    public Optional<StyleDefinition> find(String name) {
        if (name == null || name.isBlank() || directory == null) return Optional.empty();
        return cache.get(name);
    }

    public Path directory() {
        return directory;
    }

    private Optional<StyleDefinition> load(String name) {
        Path file;
        try {
            file = directory.resolve(name + ".json").normalize();
        } catch (InvalidPathException e) {
            log.debug("Style name '{}' is not a valid path: {}", name, e.getMessage());
            return Optional.empty();
        }
        // nombres con ../ no pueden salir del directorio
        if (!file.startsWith(directory.normalize()) || !Files.isRegularFile(file)) {
            log.debug("Style '{}' not found under {}", name, directory);
            return Optional.empty();
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read style " + file, e);
        }
        try {
            LinkedHashMap<String, Object> raw = mapper.readValue(json, RAW);
            if (raw == null) {
                throw new StyleLoadException(name, "root must be a JSON object", null);
            }
            log.debug("Loaded style '{}' from {}", name, file);
            return Optional.of(StyleDefinition.of(name, raw));
        } catch (JsonProcessingException e) {
            throw new StyleLoadException(name, e.getOriginalMessage(), e);
        }
    }
}
