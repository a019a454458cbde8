package com.ciro.jsonui.style;

import com.ciro.jsonui.Diagnostic;
import com.ciro.jsonui.Diagnostics;
import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.ast.LayoutReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StyleResolverTest {

    private final LayoutReader reader = new LayoutReader();

    private static StyleCatalog catalog(String name, String json) {
        Map<String, Map<String, Object>> styles = new LinkedHashMap<>();
        styles.put(name, new LayoutReader().readRaw(name, json));
        return StyleCatalog.of(styles);
    }

    @Test
    void overrideWinsPerKeyAndStyleFillsTheRest() {
        StyleCatalog cat = catalog("x", """
                {"type":"Label","background":"#112233","padding":8,"font":{"size":12,"weight":"bold"}}
                """);
        ComponentNode node = reader.read("doc", """
                {"type":"View","style":"x","background":"@{bg}","font":{"size":14}}
                """);
        Diagnostics d = Diagnostics.forDocument("doc");

        ComponentNode out = new StyleResolver(cat).resolve(node, d);

        assertEquals("View", out.type());
        assertNull(out.styleRef());
        assertEquals("@{bg}", out.attr("background"));
        assertEquals(8, out.attr("padding"));
        assertEquals(Map.of("size", 14, "weight", "bold"), out.attr("font"));
        assertTrue(d.isEmpty());
    }

    @Test
    void styleTypeIsUsedWhenNodeHasNone() {
        StyleCatalog cat = catalog("title", "{\"type\":\"Label\",\"fontSize\":24}");
        ComponentNode out = new StyleResolver(cat)
                .resolve(reader.read("doc", "{\"style\":\"title\",\"text\":\"Hi\"}"), Diagnostics.forDocument("doc"));
        assertEquals("Label", out.type());
        assertEquals(24, out.attr("fontSize"));
    }

    @Test
    void listsAreReplacedNotConcatenated() {
        StyleCatalog cat = catalog("x", "{\"margins\":[1,2]}");
        ComponentNode out = new StyleResolver(cat)
                .resolve(reader.read("doc", "{\"type\":\"View\",\"style\":\"x\",\"margins\":[3]}"),
                        Diagnostics.forDocument("doc"));
        assertEquals(List.of(3), out.attr("margins"));
    }

    @Test
    void mergeKeepsOverrideKeysAndBaseOnlyKeys() {
        Map<String, Object> base = new LinkedHashMap<>(Map.of("a", 1, "b", 2));
        Map<String, Object> override = new LinkedHashMap<>(Map.of("b", 3, "c", 4));

        Map<String, Object> merged = StyleResolver.deepMerge(base, override);

        for (String k : override.keySet()) assertEquals(override.get(k), merged.get(k));
        assertEquals(1, merged.get("a"));
    }

    @Test
    void missingStyleIsStrippedWithADiagnostic() {
        Diagnostics d = Diagnostics.forDocument("doc");
        ComponentNode out = new StyleResolver(StyleCatalog.empty())
                .resolve(reader.read("doc", "{\"type\":\"View\",\"style\":\"nope\",\"width\":10}"), d);

        assertNull(out.styleRef());
        assertEquals(10, out.attr("width"));
        assertEquals(1, d.entries().size());
        assertEquals(Diagnostic.Level.WARN, d.entries().get(0).level());
        assertTrue(d.entries().get(0).message().contains("nope"));
    }

    @Test
    void styleChildrenOnlyWhenNodeHasNone() {
        StyleCatalog cat = catalog("row", """
                {"orientation":"horizontal","child":[{"type":"Label","text":"from style"}]}
                """);
        StyleResolver resolver = new StyleResolver(cat);

        ComponentNode empty = resolver.resolve(reader.read("doc", "{\"type\":\"View\",\"style\":\"row\"}"),
                Diagnostics.forDocument("doc"));
        assertEquals("from style", empty.children().get(0).attr("text"));

        ComponentNode own = resolver.resolve(reader.read("doc",
                "{\"type\":\"View\",\"style\":\"row\",\"child\":[{\"type\":\"Button\"}]}"), Diagnostics.forDocument("doc"));
        assertEquals(1, own.children().size());
        assertEquals("Button", own.children().get(0).type());
    }

    @Test
    void nestedStyleReferencesAreResolvedPreOrder() {
        Map<String, Map<String, Object>> styles = new LinkedHashMap<>();
        styles.put("base", reader.readRaw("base", "{\"cornerRadius\":8}"));
        styles.put("card", reader.readRaw("card", "{\"style\":\"base\",\"background\":\"white\"}"));
        styles.put("title", reader.readRaw("title", "{\"fontSize\":20}"));
        StyleResolver resolver = new StyleResolver(StyleCatalog.of(styles));

        ComponentNode out = resolver.resolve(reader.read("doc", """
                {"type":"View","style":"card","child":[{"type":"Label","style":"title"}]}
                """), Diagnostics.forDocument("doc"));

        assertEquals(8, out.attr("cornerRadius"));
        assertEquals("white", out.attr("background"));
        assertEquals(20, out.children().get(0).attr("fontSize"));
    }

    @Test
    void styleCycleIsReportedNotFollowed() {
        Map<String, Map<String, Object>> styles = new LinkedHashMap<>();
        styles.put("a", reader.readRaw("a", "{\"style\":\"b\",\"width\":1}"));
        styles.put("b", reader.readRaw("b", "{\"style\":\"a\",\"height\":2}"));
        Diagnostics d = Diagnostics.forDocument("doc");

        ComponentNode out = new StyleResolver(StyleCatalog.of(styles))
                .resolve(reader.read("doc", "{\"type\":\"View\",\"style\":\"a\"}"), d);

        assertEquals(1, out.attr("width"));
        assertEquals(2, out.attr("height"));
        assertTrue(d.entries().stream().anyMatch(x -> x.message().contains("cycle")));
    }

    @Test
    void directoryCatalogLoadsLazilyAndReportsMalformedFiles(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("card.json"), "{\"background\":\"#ffffff\",\"cornerRadius\":12}");
        Files.writeString(dir.resolve("broken.json"), "{\"background\": ");
        StyleResolver resolver = new StyleResolver(new DirectoryStyleCatalog(dir));
        Diagnostics d = Diagnostics.forDocument("doc");

        ComponentNode ok = resolver.resolve(reader.read("doc", "{\"type\":\"View\",\"style\":\"card\"}"), d);
        assertEquals("#ffffff", ok.attr("background"));
        assertTrue(d.isEmpty());

        ComponentNode bad = resolver.resolve(reader.read("doc", "{\"type\":\"View\",\"style\":\"broken\",\"width\":5}"), d);
        assertNull(bad.styleRef());
        assertEquals(5, bad.attr("width"));
        assertEquals(1, d.entries().size());
        assertTrue(d.entries().get(0).message().startsWith("malformed style 'broken'"));
    }

    @Test
    void directoryCatalogDoesNotEscapeItsDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("outside.json"), "{\"width\":1}");
        Path styles = Files.createDirectory(dir.resolve("styles"));
        assertTrue(new DirectoryStyleCatalog(styles).find("../outside").isEmpty());
    }

    @Test
    void styleNameThatIsNotAPathIsReportedAsMissing(@TempDir Path dir) {
        StyleResolver resolver = new StyleResolver(new DirectoryStyleCatalog(dir));
        Diagnostics d = Diagnostics.forDocument("doc");

        ComponentNode out = resolver.resolve(
                reader.read("doc", "{\"type\":\"View\",\"style\":\"ca\\u0000rd\",\"width\":5}"), d);

        assertNull(out.styleRef());
        assertEquals(5, out.attr("width"));
        assertEquals(1, d.entries().size());
        assertTrue(d.entries().get(0).message().endsWith("not found"));
    }
}
