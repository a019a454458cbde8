package com.ciro.jsonui.binding;

import com.ciro.jsonui.Diagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BindingResolverTest {

    private final BindingResolver resolver = new BindingResolver();
    private final Diagnostics diagnostics = Diagnostics.forDocument("test");

    @Test
    void accessorSynthesis() {
        assertEquals("viewModel.data.title", resolver.accessor("title"));
        assertEquals("viewModel.data.name", resolver.accessor("data.name"));
        assertEquals("viewModel.onTap", resolver.accessor("viewModel.onTap"));
        assertEquals("!viewModel.data.isHidden", resolver.accessor("!isHidden"));
        assertEquals("viewModel.data.user.name", resolver.accessor("user.name"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"title", "data.name", "viewModel.onTap", "!isHidden", "user.profile.name"})
    void resolvingTwiceYieldsTheSameAccessor(String path) {
        String once = resolver.accessor(path);
        assertEquals(once, resolver.accessor(path));
        assertEquals(once, resolver.accessor(once));
    }

    @Test
    void classification() {
        assertEquals(new BindingExpression.DataBinding("a.b"), resolver.classify("@{a.b}", false));
        assertEquals(new BindingExpression.ActionBinding("onTap"), resolver.classify("@{onTap}", true));
        assertEquals(new BindingExpression.Literal("plain"), resolver.classify("plain", false));
        assertInstanceOf(BindingExpression.InvalidBinding.class, resolver.classify("@{a + 1}", false));
        assertFalse(resolver.classify(12, false).isBinding());
    }

    @Test
    void singleBindingText() {
        assertEquals("{viewModel.data.title}", resolver.text("@{title}", diagnostics, "Label"));
    }

    @Test
    void mixedTextInterleavesLiteralAndAccessor() {
        assertEquals("Hello {viewModel.data.name}!", resolver.text("Hello @{name}!", diagnostics, "Label"));
    }

    @Test
    void multiLineTextUsesFragmentAndLineBreaks() {
        assertEquals("<>first<br />{viewModel.data.second}</>",
                resolver.text("first\n@{second}", diagnostics, "Label"));
    }

    @Test
    void bracesForceVerbatimTemplate() {
        assertEquals("{`{x}`}", resolver.text("{x}", diagnostics, "Label"));
        assertEquals("{`a \\`b\\` \\${c} <d>`}", resolver.text("a `b` ${c} <d>", diagnostics, "Label"));
    }

    @Test
    void plainLiteralIsHtmlEscaped() {
        assertEquals("Tom &amp; Jerry", resolver.text("Tom & Jerry", diagnostics, "Label"));
    }

    @Test
    void invalidBindingInTextBecomesInlineComment() {
        String out = resolver.text("@{a + b}", diagnostics, "Label");
        assertTrue(out.startsWith("{/* jsonui: invalid binding"));
        assertEquals(1, diagnostics.entries().size());
    }

    @Test
    void attributeExpressions() {
        assertEquals("viewModel.data.url", resolver.expression("@{url}", diagnostics, "Image"));
        assertEquals("`Hi ${viewModel.data.name}`", resolver.expression("Hi @{name}", diagnostics, "Label"));
        assertNull(resolver.expression("static", diagnostics, "Label"));
        assertEquals("undefined", resolver.expression("@{a ? b : c}", diagnostics, "Label"));
    }

    @Test
    void camelCaseEventRequiresBinding() {
        ActionResolution ok = resolver.action("onClick", "@{onTap}", diagnostics, "Button");
        assertEquals("viewModel.data.onTap", ok.expression());

        ActionResolution wrong = resolver.action("onClick", "onTap", diagnostics, "Button");
        assertFalse(wrong.isHandler());
        assertTrue(wrong.inlineComment().startsWith("/* jsonui: onClick expects @{...} binding"));
        assertTrue(wrong.inlineComment().endsWith("*/"));
    }

    @Test
    void lowerCaseEventTakesASelector() {
        assertEquals("viewModel.submit", resolver.action("onclick", "submit", diagnostics, "Button").expression());

        ActionResolution wrong = resolver.action("onclick", "@{submit}", diagnostics, "Button");
        assertFalse(wrong.isHandler());
        assertTrue(wrong.inlineComment().contains("onclick expects a selector name"));
        assertEquals(1, diagnostics.entries().size());
    }

    @Test
    void linkDescriptorOpensUrl() {
        ActionResolution r = resolver.action("onClick", Map.of("action", "link", "url", "https://example.com"),
                diagnostics, "Button");
        assertEquals("() => window.open('https://example.com', '_blank')", r.expression());
    }

    @Test
    void camelEventName() {
        assertEquals("onClick", BindingResolver.camelEvent("onclick"));
        assertEquals("onValueChanged", BindingResolver.camelEvent("onValueChanged"));
    }
}
