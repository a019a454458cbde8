package com.ciro.jsonui.emit;

import com.ciro.jsonui.Diagnostics;
import com.ciro.jsonui.ast.ComponentNode;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tipo del nodo → emisor. Las extensiones se consultan primero; un tipo desconocido cae
 * al contenedor genérico con un diagnóstico. Inmutable después de construido.
 */
public final class EmitterRegistry {

    private final Map<WidgetKind, Emitter> standard;
    private final Map<String, Emitter> extensions;
    private final Emitter fallback;

    private EmitterRegistry(Map<WidgetKind, Emitter> standard, Map<String, Emitter> extensions) {
        this.standard = standard;
        this.extensions = Map.copyOf(extensions);
        this.fallback = standard.get(WidgetKind.VIEW);
    }

    public static EmitterRegistry standard() {
        return withExtensions(Map.of());
    }

    public static EmitterRegistry withExtensions(Map<String, Emitter> extensions) {
        Map<WidgetKind, Emitter> m = new EnumMap<>(WidgetKind.class);
        m.put(WidgetKind.VIEW, new ViewEmitter());
        m.put(WidgetKind.LABEL, new LabelEmitter());
        m.put(WidgetKind.BUTTON, new ButtonEmitter());
        m.put(WidgetKind.TEXT_FIELD, new TextInputEmitter(false));
        m.put(WidgetKind.TEXT_VIEW, new TextInputEmitter(true));
        m.put(WidgetKind.IMAGE, new ImageEmitter(false));
        m.put(WidgetKind.CIRCLE_IMAGE, new ImageEmitter(true));
        m.put(WidgetKind.NETWORK_IMAGE, new ImageEmitter(false));
        m.put(WidgetKind.SCROLL, new ScrollEmitter());
        m.put(WidgetKind.SWITCH, new ToggleEmitter(true));
        m.put(WidgetKind.CHECKBOX, new ToggleEmitter(false));
        m.put(WidgetKind.COLLECTION, new CollectionEmitter());
        m.put(WidgetKind.SLIDER, new SliderEmitter());
        m.put(WidgetKind.SEGMENT, new SegmentEmitter());
        m.put(WidgetKind.RADIO, new RadioEmitter());
        m.put(WidgetKind.PROGRESS, new ProgressEmitter());
        m.put(WidgetKind.INDICATOR, new IndicatorEmitter());
        m.put(WidgetKind.SELECT_BOX, new SelectBoxEmitter());
        m.put(WidgetKind.ICON_LABEL, new IconLabelEmitter());
        m.put(WidgetKind.GRADIENT_VIEW, new DecoratedViewEmitter(DecoratedViewEmitter.Decoration.GRADIENT));
        m.put(WidgetKind.BLUR, new DecoratedViewEmitter(DecoratedViewEmitter.Decoration.BLUR));
        m.put(WidgetKind.CIRCLE_VIEW, new DecoratedViewEmitter(DecoratedViewEmitter.Decoration.CIRCLE));
        m.put(WidgetKind.WEB, new WebEmitter());
        m.put(WidgetKind.INCLUDE, new IncludeEmitter());
        return new EmitterRegistry(m, extensions);
    }

    /** Un {@link ExtensionEmitter} por cada nombre de componente. */
    public static EmitterRegistry withExtensionComponents(Collection<String> components) {
        Map<String, Emitter> ext = new LinkedHashMap<>();
        for (String c : components) ext.put(c, new ExtensionEmitter(c));
        return withExtensions(ext);
    }

    public Emitter resolve(ComponentNode node, Diagnostics diagnostics) {
        if (node.isInclude()) return standard.get(WidgetKind.INCLUDE);
        String type = node.type();
        if (type != null) {
            Emitter ext = extensions.get(type);
            if (ext != null) return ext;
        }
        Optional<WidgetKind> kind = WidgetKind.fromTag(type);
        if (kind.isPresent()) return standard.get(kind.get());
        diagnostics.warn(node.label(), "unknown type '" + type + "', emitted as View");
        return fallback;
    }

    public boolean isExtension(String type) {
        return extensions.containsKey(type);
    }
}
