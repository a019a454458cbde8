package com.ciro.jsonui.mapping;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tabla valor → sufijo de clase con búsqueda del vecino más cercano.
 * Empates a igual distancia van a la clave menor. Las distancias se comparan en
 * millonésimas enteras: en double, 0.55 queda más cerca de 0.6 que de 0.5.
 */
final class SnapScale {

    private final NavigableMap<Double, String> table;

    private SnapScale(NavigableMap<Double, String> table) {
        this.table = table;
    }

    static SnapScale of(Object... pairs) {
        NavigableMap<Double, String> t = new TreeMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            t.put(((Number) pairs[i]).doubleValue(), (String) pairs[i + 1]);
        }
        return new SnapScale(t);
    }

    Optional<String> exact(double value) {
        return Optional.ofNullable(table.get(value));
    }

    boolean covers(double value) {
        return value >= table.firstKey() && value <= table.lastKey();
    }

    /** Clave más cercana dentro del rango; el llamador verifica {@link #covers} antes. */
    double nearestKey(double value) {
        Map.Entry<Double, String> floor = table.floorEntry(value);
        Map.Entry<Double, String> ceil = table.ceilingEntry(value);
        if (floor == null) return ceil.getKey();
        if (ceil == null) return floor.getKey();
        long down = micros(value) - micros(floor.getKey());
        long up = micros(ceil.getKey()) - micros(value);
        return up < down ? ceil.getKey() : floor.getKey();
    }

    private static long micros(double v) {
        return Math.round(v * 1_000_000d);
    }

    String nearest(double value) {
        return table.get(nearestKey(value));
    }
}
