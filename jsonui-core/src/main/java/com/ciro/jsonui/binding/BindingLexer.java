package com.ciro.jsonui.binding;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parte un string crudo en segmentos de texto y de binding ({@code @{...}}) en una sola
 * pasada. Las llaves y comillas dentro de un string entre comillas no cierran el binding.
 */
public final class BindingLexer {

    public record Segment(boolean binding, String text) {}

    private static final Pattern PATH =
            Pattern.compile("!*\\s*[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");

    private BindingLexer() {}

    public static List<Segment> lex(String input) {
        List<Segment> out = new ArrayList<>();
        if (input == null || input.isEmpty()) return out;

        int i = 0;
        int len = input.length();
        StringBuilder text = new StringBuilder();

        while (i < len) {
            if (input.charAt(i) == '@' && i + 1 < len && input.charAt(i + 1) == '{') {
                int end = closingBrace(input, i + 2);
                if (end < 0) {
                    // sin cierre: es texto
                    text.append(input, i, len);
                    break;
                }
                flush(out, text);
                out.add(new Segment(true, input.substring(i + 2, end).trim()));
                i = end + 1;
                continue;
            }
            text.append(input.charAt(i));
            i++;
        }
        flush(out, text);
        return out;
    }

    /** Verdadero si el string completo es un único binding. */
    public static boolean isSingleBinding(String input) {
        if (input == null) return false;
        List<Segment> segs = lex(input.trim());
        return segs.size() == 1 && segs.get(0).binding();
    }

    public static boolean containsBinding(String input) {
        if (input == null || !input.contains("@{")) return false;
        for (Segment s : lex(input)) {
            if (s.binding()) return true;
        }
        return false;
    }

    /** Contenido del único binding, o null si el string no es exactamente uno. */
    public static String bindingContent(String input) {
        if (!isSingleBinding(input)) return null;
        return lex(input.trim()).get(0).text();
    }

    public static boolean isPath(String content) {
        return content != null && PATH.matcher(content.trim()).matches();
    }

    private static int closingBrace(String s, int from) {
        boolean inSingle = false;
        boolean inDouble = false;
        int depth = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && (inSingle || inDouble)) {
                i++;
            } else if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble) {
                if (c == '{') depth++;
                else if (c == '}') {
                    if (depth == 0) return i;
                    depth--;
                }
            }
        }
        return -1;
    }

    private static void flush(List<Segment> out, StringBuilder text) {
        if (text.length() > 0) {
            out.add(new Segment(false, text.toString()));
            text.setLength(0);
        }
    }
}
