package com.ciro.jsonui.cli;

import com.ciro.jsonui.compiler.CompilerContext;
import com.ciro.jsonui.emit.EmitterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BatchCompilerTest {

    @TempDir
    Path root;

    private Path layouts;

    @BeforeEach
    void layoutTree() throws IOException {
        layouts = Files.createDirectories(root.resolve("src/Layouts"));
        Files.createDirectories(layouts.resolve("common"));
        Files.createDirectories(layouts.resolve("Resources"));
        Files.createDirectories(root.resolve("src/Styles"));

        Files.writeString(layouts.resolve("home.json"), """
                {"type": "View", "style": "card", "child": [
                  {"data": [{"class": "String", "name": "title"}]},
                  {"include": "common/header"},
                  {"type": "Label", "text": "@{title}"},
                  {"type": "Label", "text": "@{subtitle}"}
                ]}
                """);
        Files.writeString(layouts.resolve("common/header.json"), """
                {"type": "Label", "text": "Header"}
                """);
        Files.writeString(layouts.resolve("Resources/strings.json"), "{\"hello\": \"Hello\"}");
        Files.writeString(root.resolve("src/Styles/card.json"), "{\"background\": \"#112233\"}");
    }

    private CompilerConfig config(boolean typescript) {
        return new CompilerConfig(null, null, null, null, null, typescript, 2, null);
    }

    @Test
    void buildWritesThreeModulesPerDocument() throws IOException {
        BatchReport report = new BatchCompiler(config(false), root).build();

        assertEquals(2, report.documents());
        assertFalse(report.hasFailures());
        assertEquals(1, report.warnings());

        Path home = root.resolve("src/generated/components/Home.jsx");
        assertTrue(Files.exists(home));
        assertTrue(Files.exists(root.resolve("src/generated/components/Header.jsx")));
        assertTrue(Files.exists(root.resolve("src/generated/data/HomeData.js")));
        assertTrue(Files.exists(root.resolve("src/generated/hooks/useHomeViewModel.js")));

        String component = Files.readString(home);
        assertTrue(component.contains("import Header from './Header';"));
        assertTrue(component.contains("bg-[#112233]"));
        assertTrue(component.contains("<Header />"));
    }

    @Test
    void typescriptFlavorChangesExtensions() {
        new BatchCompiler(config(true), root).build();
        assertTrue(Files.exists(root.resolve("src/generated/components/Home.tsx")));
        assertTrue(Files.exists(root.resolve("src/generated/data/HomeData.ts")));
        assertTrue(Files.exists(root.resolve("src/generated/hooks/useHomeViewModel.ts")));
    }

    @Test
    void brokenDocumentDoesNotStopTheBatch() throws IOException {
        Files.writeString(layouts.resolve("broken.json"), "{\"type\": ");
        BatchReport report = new BatchCompiler(config(false), root).build();

        assertEquals(3, report.documents());
        assertEquals(List.of("broken"), report.failed());
        assertTrue(Files.exists(root.resolve("src/generated/components/Home.jsx")));
    }

    @Test
    void nonFiniteNumbersDoNotFailTheDocument() throws IOException {
        Files.writeString(layouts.resolve("wide.json"), """
                {"type": "View", "width": 1e400, "padding": "NaN", "cornerRadius": "Infinity"}
                """);
        BatchReport report = new BatchCompiler(config(false), root).build();

        assertEquals(3, report.documents());
        assertFalse(report.hasFailures());
        String wide = Files.readString(root.resolve("src/generated/components/Wide.jsx"));
        assertTrue(wide.contains("<div />"));
    }

    @Test
    void unexpectedCompilerErrorFailsOnlyThatDocument() throws IOException {
        Files.writeString(layouts.resolve("boom.json"), "{\"type\": \"Boom\"}");
        BatchCompiler compiler = new BatchCompiler(config(false), root) {
            @Override
            CompilerContext context(Set<String> knownDocuments) {
                return super.context(knownDocuments).withEmitters(EmitterRegistry.withExtensions(Map.of(
                        "Boom", (node, children, ctx) -> {
                            throw new IllegalStateException("emitter bug");
                        })));
            }
        };
        BatchReport report = compiler.build();

        assertEquals(3, report.documents());
        assertEquals(List.of("boom"), report.failed());
        assertTrue(Files.exists(root.resolve("src/generated/components/Home.jsx")));
        assertTrue(Files.exists(root.resolve("src/generated/components/Header.jsx")));
    }

    @Test
    void validateWritesNothing() {
        BatchReport report = new BatchCompiler(config(false), root).validate();
        assertEquals(1, report.warnings());
        assertFalse(Files.exists(root.resolve("src/generated")));
    }

    @Test
    void scannerSkipsResourceFolders() {
        List<LayoutScanner.LayoutFile> files = LayoutScanner.scan(layouts);
        assertEquals(List.of("common/header", "home"), files.stream().map(LayoutScanner.LayoutFile::document).toList());
        assertTrue(LayoutScanner.documentNames(files).contains("header"));
    }
}
