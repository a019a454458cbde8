package com.ciro.jsonui.gen;

/** TypeScript o JavaScript plano para los módulos generados. */
public enum OutputFlavor {
    TYPESCRIPT(".tsx", ".ts"),
    PLAIN(".jsx", ".js");

    private final String componentExtension;
    private final String moduleExtension;

    OutputFlavor(String componentExtension, String moduleExtension) {
        this.componentExtension = componentExtension;
        this.moduleExtension = moduleExtension;
    }

    public String componentExtension() {
        return componentExtension;
    }

    public String moduleExtension() {
        return moduleExtension;
    }

    public static OutputFlavor of(boolean typescript) {
        return typescript ? TYPESCRIPT : PLAIN;
    }
}
