package com.ciro.jsonui.gen;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.binding.BindingConventions;
import com.ciro.jsonui.binding.TwoWayBindings;

import java.util.List;

/**
 * Hook {@code use<Name>ViewModel}: estado del módulo de datos más un handler por defecto
 * para cada input bidireccional que el autor no cableó. El handler propio del view model,
 * si existe, siempre gana ({@code ??}).
 */
public final class StateScaffoldGenerator {

    private final BindingConventions conventions;
    private final String dataImportBase;

    public StateScaffoldGenerator(BindingConventions conventions, String dataImportBase) {
        this.conventions = conventions;
        this.dataImportBase = dataImportBase;
    }

    public StateScaffoldGenerator(BindingConventions conventions) {
        this(conventions, "@/generated/data");
    }

    public String generate(String componentName, ComponentNode root, OutputFlavor flavor) {
        String type = componentName + "Data";
        boolean ts = flavor == OutputFlavor.TYPESCRIPT;
        List<TwoWayBindings.TwoWay> handlers = TwoWayBindings.collect(root, conventions);

        StringBuilder sb = new StringBuilder("\"use client\";\n\n");
        sb.append(Banner.LINE).append("\n\n");
        sb.append("import { useState } from \"react\";\n");
        if (ts) {
            sb.append("import { ").append(type).append(", create").append(type).append(" } from \"")
              .append(dataImportBase).append('/').append(type).append("\";\n\n");
            sb.append("export function use").append(componentName).append("ViewModel(initial?: Partial<")
              .append(type).append(">) {\n");
            sb.append("  const [data, setData] = useState<").append(type).append(">({ ...create")
              .append(type).append("(), ...initial });\n\n");
        } else {
            sb.append("import { create").append(type).append(" } from \"")
              .append(dataImportBase).append('/').append(type).append("\";\n\n");
            sb.append("/**\n * @param {Partial<import(\"").append(dataImportBase).append('/').append(type)
              .append("\").").append(type).append(">} [initial]\n */\n");
            sb.append("export function use").append(componentName).append("ViewModel(initial) {\n");
            sb.append("  const [data, setData] = useState({ ...create").append(type).append("(), ...initial });\n\n");
        }

        if (handlers.isEmpty()) {
            sb.append("  const dataWithDefaults = data;\n");
        } else {
            sb.append("  const dataWithDefaults").append(ts ? ": " + type : "").append(" = {\n");
            sb.append("    ...data,\n");
            for (TwoWayBindings.TwoWay h : handlers) {
                String param = ts ? "(value: " + DataModuleGenerator.valueType(h) + ")" : "(value)";
                sb.append("    ").append(h.handlerName()).append(": data.").append(h.handlerName())
                  .append(" ?? (").append(param).append(" => setData(prev => ")
                  .append(update("prev", h.property().split("\\."), 0)).append(")),\n");
            }
            sb.append("  };\n");
        }
        sb.append("\n  return { data: dataWithDefaults, setData };\n}\n");
        return sb.toString();
    }

    /** {@code form.email} → {@code ({ ...prev, form: { ...prev.form, email: value } })}. */
    static String update(String source, String[] path, int index) {
        String key = path[index];
        String value = index == path.length - 1
                ? "value"
                : update(source + "." + key, path, index + 1);
        String inner = "{ ..." + source + ", " + key + ": " + value + " }";
        return index == 0 ? "(" + inner + ")" : inner;
    }
}
