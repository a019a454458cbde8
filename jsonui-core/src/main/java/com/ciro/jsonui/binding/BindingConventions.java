package com.ciro.jsonui.binding;

/**
 * Prefijos con los que se sintetizan los accessors.
 *
 * @param root      namespace raíz del view model ({@code viewModel})
 * @param canonical prefijo de los datos ({@code viewModel.data})
 * @param legacy    prefijo heredado que se reescribe al canónico ({@code data})
 */
public record BindingConventions(String root, String canonical, String legacy) {

    public static final BindingConventions STANDARD = new BindingConventions("viewModel", "viewModel.data", "data");

    /**
     * Path → accessor. Idempotente: pasar un accessor ya resuelto lo devuelve igual.
     */
    public String accessor(String path) {
        String p = path.trim();
        String negation = "";
        while (p.startsWith("!")) {
            negation += "!";
            p = p.substring(1).trim();
        }
        return negation + qualify(p);
    }

    private String qualify(String p) {
        if (p.equals(root) || p.startsWith(root + ".")) return p;
        if (p.equals(legacy)) return canonical;
        if (p.startsWith(legacy + ".")) return canonical + p.substring(legacy.length());
        return canonical + "." + p;
    }

    /** Método del view model para el selector {@code onclick="name"}. */
    public String selector(String name) {
        return root + "." + name.trim();
    }
}
