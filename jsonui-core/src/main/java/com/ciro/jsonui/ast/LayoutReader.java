package com.ciro.jsonui.ast;

import com.ciro.jsonui.schema.DataSchemaEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Convierte un documento JSON en un árbol de {@link ComponentNode}.
 * Una pasada, recursiva; los mapas crudos de Jackson se conservan como atributos.
 */
public final class LayoutReader {

    private static final TypeReference<LinkedHashMap<String, Object>> RAW = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public LayoutReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public LayoutReader() {
        this(new ObjectMapper());
    }

    public ComponentNode read(String document, String json) {
        if (json == null || json.isBlank()) {
            throw new LayoutParseException(document, "empty document");
        }
        Map<String, Object> raw;
        try {
            raw = mapper.readValue(json, RAW);
        } catch (JsonProcessingException e) {
            throw new LayoutParseException(document, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new LayoutParseException(document, "root must be a JSON object");
        }
        return fromMap(raw);
    }

    public ComponentNode read(Path file) {
        String name = file.getFileName().toString();
        try {
            return read(name, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LayoutParseException(name, "cannot read file: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> readRaw(String document, String json) {
        try {
            Map<String, Object> raw = mapper.readValue(json, RAW);
            if (raw == null) throw new LayoutParseException(document, "root must be a JSON object");
            return raw;
        } catch (JsonProcessingException e) {
            throw new LayoutParseException(document, "invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Construye el nodo a partir del mapa crudo (también lo usan las definiciones de estilo). */
    public static ComponentNode fromMap(Map<String, Object> raw) {
        if (isMarker(raw)) {
            return ComponentNode.marker(declarationsOf(raw.get("data")));
        }

        Map<String, Object> attrs = new LinkedHashMap<>();
        String type = null;
        String style = null;
        String include = null;
        List<DataSchemaEntry> declarations = List.of();
        List<ComponentNode> children = new ArrayList<>();

        for (Map.Entry<String, Object> e : raw.entrySet()) {
            String key = e.getKey();
            Object val = e.getValue();
            switch (key) {
                case "type" -> type = val == null ? null : String.valueOf(val);
                case "style" -> {
                    if (val instanceof String s && !s.isBlank()) style = s;
                }
                case "include" -> include = val == null ? "" : String.valueOf(val);
                case "child", "children" -> children.addAll(childrenOf(val));
                case "data" -> {
                    // data como array = declaraciones; como objeto = props (include)
                    if (val instanceof List<?>) declarations = declarationsOf(val);
                    else attrs.put(key, val);
                }
                default -> attrs.put(key, val);
            }
        }
        return new ComponentNode(type, attrs, style, include, children, declarations, false);
    }

    static boolean isMarker(Map<String, Object> raw) {
        return !raw.containsKey("type") && !raw.containsKey("include") && raw.get("data") instanceof List<?>;
    }

    @SuppressWarnings("unchecked")
    private static List<ComponentNode> childrenOf(Object val) {
        List<ComponentNode> out = new ArrayList<>();
        if (val instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) out.add(fromMap((Map<String, Object>) m));
            }
        } else if (val instanceof Map<?, ?> m) {
            out.add(fromMap((Map<String, Object>) m));
        }
        return out;
    }

    private static List<DataSchemaEntry> declarationsOf(Object val) {
        List<DataSchemaEntry> out = new ArrayList<>();
        if (val instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> m) {
                    DataSchemaEntry entry = DataSchemaEntry.fromMap(m);
                    if (entry != null) out.add(entry);
                }
            }
        }
        return out;
    }
}
