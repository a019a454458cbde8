package com.ciro.jsonui.util;

import java.util.Locale;

/**
 * Conversión de nombres de documento a identificadores de salida.
 */
public final class Names {

    private Names() {}

    /** {@code main_menu} → {@code MainMenu}; {@code common/header} → {@code Header}. */
    public static String pascal(String raw) {
        if (raw == null || raw.isBlank()) return "";
        String base = baseName(raw);
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : base.toCharArray()) {
            if (c == '_' || c == '-' || c == ' ' || c == '.') {
                upper = true;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** {@code main_menu} → {@code mainMenu}. */
    public static String camel(String raw) {
        String p = pascal(raw);
        if (p.isEmpty()) return p;
        return Character.toLowerCase(p.charAt(0)) + p.substring(1);
    }

    /** {@code MainMenu} → {@code main_menu}. */
    public static String snake(String raw) {
        if (raw == null || raw.isBlank()) return "";
        String base = baseName(raw);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && base.charAt(i - 1) != '_') sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else if (c == '-' || c == ' ') {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /** Primera letra en mayúscula, resto intacto: {@code email} → {@code Email}. */
    public static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /** Último segmento de una ruta, sin extensión. */
    public static String baseName(String raw) {
        String s = raw.trim().replace('\\', '/');
        int slash = s.lastIndexOf('/');
        if (slash >= 0) s = s.substring(slash + 1);
        if (s.endsWith(".json")) s = s.substring(0, s.length() - 5);
        return s;
    }
}
