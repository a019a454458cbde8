package com.ciro.jsonui.cli;

import com.ciro.jsonui.Diagnostic;
import com.ciro.jsonui.ast.LayoutParseException;
import com.ciro.jsonui.compiler.CompilationResult;
import com.ciro.jsonui.compiler.CompilerContext;
import com.ciro.jsonui.compiler.LayoutCompiler;
import com.ciro.jsonui.emit.EmitterRegistry;
import com.ciro.jsonui.gen.OutputFlavor;
import com.ciro.jsonui.style.DirectoryStyleCatalog;
import com.ciro.jsonui.style.StyleCatalog;
import com.ciro.jsonui.validation.ValidationWarning;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Compila o valida todos los documentos de la carpeta de layouts.
 * <p>
 * Cada documento es una tarea independiente en un pool fijo; un documento roto se
 * registra como fallido y el resto sigue. Cada archivo de salida tiene un único escritor.
 */
public class BatchCompiler {

    private static final Logger log = LoggerFactory.getLogger(BatchCompiler.class);

    private final CompilerConfig config;
    private final Path projectRoot;
    private final ObjectMapper mapper;

    public BatchCompiler(CompilerConfig config, Path projectRoot, ObjectMapper mapper) {
        this.config = config;
        this.projectRoot = projectRoot;
        this.mapper = mapper;
    }

    public BatchCompiler(CompilerConfig config, Path projectRoot) {
        this(config, projectRoot, ObjectMapperFactory.create());
    }

    /** Compila y escribe componente, módulo de datos y hook de cada documento. */
    public BatchReport build() {
        return run(true);
    }

    /** Sólo análisis de bindings; no escribe nada. */
    public BatchReport validate() {
        return run(false);
    }

    private BatchReport run(boolean write) {
        Path layouts = projectRoot.resolve(config.layoutsDirectory());
        List<LayoutScanner.LayoutFile> files = LayoutScanner.scan(layouts);
        if (files.isEmpty()) {
            log.warn("No layout documents under {}", layouts);
            return new BatchReport(0, List.of(), 0, 0);
        }
        LayoutCompiler compiler = new LayoutCompiler(context(LayoutScanner.documentNames(files)), mapper);
        log.info("{} {} documents from {} ({} threads)", write ? "Compiling" : "Validating",
                files.size(), layouts, config.parallelism());

        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism());
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (LayoutScanner.LayoutFile file : files) {
                futures.add(pool.submit(() -> process(compiler, file, write)));
            }
            return collect(futures);
        } finally {
            pool.shutdown();
        }
    }

    CompilerContext context(Set<String> knownDocuments) {
        Path styles = ConfigLoader.stylesDirectory(config, projectRoot);
        StyleCatalog catalog = Files.isDirectory(styles)
                ? new DirectoryStyleCatalog(styles, mapper)
                : StyleCatalog.empty();
        if (!Files.isDirectory(styles)) log.debug("No styles directory at {}", styles);
        return CompilerContext.defaults()
                .withStyles(catalog)
                .withEmitters(EmitterRegistry.withExtensionComponents(config.extensionComponents()))
                .withFlavor(OutputFlavor.of(config.typescript()))
                .withKnownDocuments(knownDocuments);
    }

    private record Outcome(String document, boolean failed, int warnings, int diagnostics) {}

    private Outcome process(LayoutCompiler compiler, LayoutScanner.LayoutFile file, boolean write) {
        String document = file.document();
        try {
            String json = Files.readString(file.path(), StandardCharsets.UTF_8);
            if (!write) {
                List<ValidationWarning> warnings = compiler.validate(document, json);
                warnings.forEach(w -> log.warn("{}", w.message()));
                return new Outcome(document, false, warnings.size(), 0);
            }
            CompilationResult result = compiler.compile(document, json);
            result.warnings().forEach(w -> log.warn("{}", w.message()));
            writeOutputs(result);
            return new Outcome(document, false, result.warnings().size(), result.diagnostics().size());
        } catch (LayoutParseException e) {
            log.error("Skipping {}: {}", document, e.getMessage());
            return new Outcome(document, true, 0, 0);
        } catch (IOException | UncheckedIOException e) {
            log.error("I/O failure on {}: {}", document, e.getMessage(), e);
            return new Outcome(document, true, 0, 0);
        } catch (RuntimeException e) {
            // un bug del compilador en un documento no corta el lote
            log.error("Compilation of {} failed", document, e);
            return new Outcome(document, true, 0, 0);
        }
    }

    private void writeOutputs(CompilationResult result) throws IOException {
        OutputFlavor flavor = OutputFlavor.of(config.typescript());
        String name = result.componentName();
        write(projectRoot.resolve(config.componentsDirectory()).resolve(name + flavor.componentExtension()),
                result.componentModule());
        write(projectRoot.resolve(config.dataDirectory()).resolve(name + "Data" + flavor.moduleExtension()),
                result.dataModule());
        write(projectRoot.resolve(config.hooksDirectory()).resolve("use" + name + "ViewModel" + flavor.moduleExtension()),
                result.hookModule());
        if (log.isDebugEnabled()) {
            for (Diagnostic d : result.diagnostics()) {
                log.debug("[{}] {} {}: {}", result.document(), d.level(), d.location(), d.message());
            }
        }
    }

    private static void write(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.debug("Wrote {}", target);
    }

    private BatchReport collect(List<Future<Outcome>> futures) {
        List<String> failed = new ArrayList<>();
        int warnings = 0;
        int diagnostics = 0;
        for (Future<Outcome> f : futures) {
            Outcome o;
            try {
                o = f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while compiling layouts", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Layout compilation failed", cause);
            }
            if (o.failed()) failed.add(o.document());
            warnings += o.warnings();
            diagnostics += o.diagnostics();
        }
        log.info("Done: {} documents, {} failed, {} warnings, {} diagnostics",
                futures.size(), failed.size(), warnings, diagnostics);
        return new BatchReport(futures.size(), failed, warnings, diagnostics);
    }
}
