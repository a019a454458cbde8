package com.ciro.jsonui.style;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fuente de estilos con nombre. Las implementaciones son de sólo lectura una vez
 * pobladas y se comparten entre documentos.
 */
public interface StyleCatalog {

    /**
     * @return el estilo, o vacío si no existe
     * @throws StyleLoadException si existe pero está mal formado
     */
    Optional<StyleDefinition> find(String name);

    static StyleCatalog empty() {
        return name -> Optional.empty();
    }

    /** Catálogo en memoria a partir de mapas crudos (nombre → atributos). */
    static StyleCatalog of(Map<String, Map<String, Object>> styles) {
        Map<String, StyleDefinition> defs = new LinkedHashMap<>();
        styles.forEach((name, raw) -> defs.put(name, StyleDefinition.of(name, raw)));
        Map<String, StyleDefinition> frozen = Map.copyOf(defs);
        return name -> Optional.ofNullable(frozen.get(name));
    }
}
