package com.ciro.jsonui.binding;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interpreta un {@code visibility} con binding. Sólo reconoce un path suelto o el
 * ternario {@code cond ? 'a' : 'b'} con los pares gone/visible y visible/invisible;
 * cualquier otra forma no produce directiva.
 */
public final class VisibilityResolver {

    private static final Pattern TERNARY = Pattern.compile(
            "^(?<cond>!*\\s*[A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)\\s*\\?\\s*"
                    + "(?<q1>['\"])\\.?(?<yes>[A-Za-z]+)\\k<q1>\\s*:\\s*"
                    + "(?<q2>['\"])\\.?(?<no>[A-Za-z]+)\\k<q2>$");

    private final BindingConventions conventions;

    public VisibilityResolver(BindingConventions conventions) {
        this.conventions = conventions;
    }

    public VisibilityResolver() {
        this(BindingConventions.STANDARD);
    }

    public Optional<VisibilityDirective> resolve(Object value) {
        if (!(value instanceof String raw)) return Optional.empty();
        String content = BindingLexer.bindingContent(raw);
        if (content == null) return Optional.empty();

        if (BindingLexer.isPath(content)) {
            return Optional.of(new VisibilityDirective(
                    VisibilityDirective.Kind.HIDE_ENTIRELY, conventions.accessor(content), false));
        }

        Matcher m = TERNARY.matcher(content);
        if (!m.matches()) return Optional.empty();

        String cond = conventions.accessor(m.group("cond"));
        String yes = m.group("yes");
        String no = m.group("no");

        if (yes.equals("visible") && no.equals("gone")) {
            return Optional.of(new VisibilityDirective(VisibilityDirective.Kind.HIDE_ENTIRELY, cond, false));
        }
        if (yes.equals("gone") && no.equals("visible")) {
            return Optional.of(new VisibilityDirective(VisibilityDirective.Kind.HIDE_ENTIRELY, negate(cond), true));
        }
        if (yes.equals("visible") && no.equals("invisible")) {
            return Optional.of(new VisibilityDirective(VisibilityDirective.Kind.FADE_OUT, cond, false));
        }
        if (yes.equals("invisible") && no.equals("visible")) {
            return Optional.of(new VisibilityDirective(VisibilityDirective.Kind.FADE_OUT, cond, true));
        }
        return Optional.empty();
    }

    private static String negate(String accessor) {
        // !!x se simplifica a x
        if (accessor.startsWith("!")) return accessor.substring(1);
        return "!" + accessor;
    }
}
