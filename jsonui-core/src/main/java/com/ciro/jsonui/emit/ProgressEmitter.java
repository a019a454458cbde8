package com.ciro.jsonui.emit;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.mapping.TailwindMapper;

import java.util.List;

/** {@code <progress>} con la barra estilizada por pseudo-elementos. */
public class ProgressEmitter implements Emitter {

    @Override
    public String emit(ComponentNode node, List<String> children, EmitContext ctx) {
        JsxElement el = ElementSupport.base("progress", node, ctx);
        el.addClass("w-full h-2 rounded-full appearance-none");
        el.addClass("[&::-webkit-progress-bar]:rounded-full [&::-webkit-progress-bar]:bg-gray-200");
        el.addClass("[&::-webkit-progress-value]:rounded-full");
        Object tint = node.firstOf("progressTintColor", "tintColor");
        el.addClass(TailwindMapper.color("[&::-webkit-progress-value]:bg", tint)
                .orElse("[&::-webkit-progress-value]:bg-blue-500"));

        Object value = node.firstOf("value", "progress");
        String expr = ctx.bindings().expression(value, ctx.diagnostics(), node.label());
        Double literal = TailwindMapper.number(value);
        el.expression("value", expr != null ? expr : TailwindMapper.fmt(literal == null ? 0 : literal));
        Double max = TailwindMapper.number(node.firstOf("maximumValue", "max"));
        el.expression("max", TailwindMapper.fmt(max == null ? 100 : max));
        return el.render();
    }
}
