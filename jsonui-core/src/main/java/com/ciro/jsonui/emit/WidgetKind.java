package com.ciro.jsonui.emit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conjunto cerrado de widgets que el compilador conoce. Cada tipo del JSON se traduce a
 * exactamente una constante; los alias comparten emisor.
 */
public enum WidgetKind {
    VIEW("View", "SafeAreaView"),
    LABEL("Label", "Text"),
    BUTTON("Button"),
    TEXT_FIELD("TextField"),
    TEXT_VIEW("TextView"),
    IMAGE("Image"),
    CIRCLE_IMAGE("CircleImage"),
    NETWORK_IMAGE("NetworkImage"),
    SCROLL("Scroll", "ScrollView"),
    SWITCH("Switch", "Toggle"),
    CHECKBOX("Check", "CheckBox", "Checkbox"),
    COLLECTION("Collection", "Table"),
    SLIDER("Slider"),
    SEGMENT("Segment"),
    RADIO("Radio"),
    PROGRESS("Progress"),
    INDICATOR("Indicator"),
    SELECT_BOX("SelectBox"),
    ICON_LABEL("IconLabel"),
    GRADIENT_VIEW("GradientView"),
    BLUR("Blur"),
    CIRCLE_VIEW("CircleView"),
    WEB("Web"),
    INCLUDE("Include");

    private static final Map<String, WidgetKind> BY_TAG = new HashMap<>();

    static {
        for (WidgetKind k : values()) {
            for (String tag : k.tags) BY_TAG.put(tag, k);
        }
    }

    private final List<String> tags;

    WidgetKind(String... tags) {
        this.tags = List.of(tags);
    }

    public List<String> tags() {
        return tags;
    }

    public static Optional<WidgetKind> fromTag(String tag) {
        if (tag == null) return Optional.of(VIEW);
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
