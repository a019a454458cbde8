package com.ciro.jsonui.gen;

import com.ciro.jsonui.emit.JsxElement;
import com.ciro.jsonui.emit.ModuleUsage;

/**
 * Archivo de componente alrededor del markup: imports según lo que usó el markup, props
 * en la variante TypeScript y el export.
 */
public final class ComponentModuleGenerator {

    private final String dataImportBase;
    private final String extensionImportBase;

    public ComponentModuleGenerator(String dataImportBase, String extensionImportBase) {
        this.dataImportBase = dataImportBase;
        this.extensionImportBase = extensionImportBase;
    }

    public ComponentModuleGenerator() {
        this("@/generated/data", "@/components/extensions");
    }

    public String generate(String componentName, String markup, ModuleUsage usage, OutputFlavor flavor) {
        boolean ts = flavor == OutputFlavor.TYPESCRIPT;
        StringBuilder sb = new StringBuilder();
        if (!usage.extensions().isEmpty()) sb.append("\"use client\";\n\n");
        sb.append(Banner.LINE).append('\n');
        sb.append("import React from 'react';\n");
        if (usage.usesLink()) sb.append("import Link from 'next/link';\n");
        if (ts) {
            sb.append("import type { ").append(componentName).append("Data } from '")
              .append(dataImportBase).append('/').append(componentName).append("Data';\n");
        }
        for (String ext : usage.extensions()) {
            sb.append("import { ").append(ext).append(" } from '").append(extensionImportBase)
              .append('/').append(ext).append("';\n");
        }
        for (String inc : usage.includes()) {
            if (!inc.equals(componentName)) sb.append("import ").append(inc).append(" from './").append(inc).append("';\n");
        }
        sb.append('\n');

        if (ts) {
            sb.append("interface ").append(componentName).append("Props {\n");
            sb.append("  viewModel: { data: ").append(componentName).append("Data; [key: string]: any };\n");
            sb.append("}\n\n");
            sb.append("export const ").append(componentName).append(" = ({ viewModel }: ")
              .append(componentName).append("Props) => {\n");
        } else {
            sb.append("export const ").append(componentName).append(" = ({ viewModel }) => {\n");
        }
        sb.append("  return (\n");
        String body = markup == null || markup.isEmpty() ? "<></>" : markup;
        // una raíz condicional necesita un fragmento alrededor
        if (body.startsWith("{")) body = "<>\n" + JsxElement.indent(body) + "\n</>";
        sb.append(JsxElement.indent(JsxElement.indent(body))).append('\n');
        sb.append("  );\n};\n\nexport default ").append(componentName).append(";\n");
        return sb.toString();
    }
}
