package com.ciro.jsonui.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Documentos de layout bajo la carpeta de layouts. Las carpetas de estilos y recursos
 * que viven ahí adentro no son layouts.
 */
public final class LayoutScanner {

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("Styles", "styles", "Resources", "resources");

    /** Un documento y su nombre relativo ({@code common/header}). */
    public record LayoutFile(Path path, String document) {}

    private LayoutScanner() {}

    public static List<LayoutFile> scan(Path layoutsDirectory) {
        if (!Files.isDirectory(layoutsDirectory)) return List.of();
        try (Stream<Path> files = Files.walk(layoutsDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !insideSkippedDirectory(layoutsDirectory.relativize(p)))
                    .sorted(Comparator.comparing(Path::toString))
                    .map(p -> new LayoutFile(p, documentName(layoutsDirectory, p)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + layoutsDirectory, e);
        }
    }

    /** Nombres válidos como destino de {@code include}: ruta relativa y nombre simple. */
    public static Set<String> documentNames(List<LayoutFile> files) {
        return files.stream()
                .flatMap(f -> Stream.of(f.document(), simpleName(f.document())))
                .collect(Collectors.toSet());
    }

    static String documentName(Path root, Path file) {
        String rel = root.relativize(file).toString().replace('\\', '/');
        return rel.substring(0, rel.length() - ".json".length());
    }

    private static String simpleName(String document) {
        int slash = document.lastIndexOf('/');
        return slash < 0 ? document : document.substring(slash + 1);
    }

    private static boolean insideSkippedDirectory(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (SKIPPED_DIRECTORIES.contains(relative.getName(i).toString())) return true;
        }
        return false;
    }
}
