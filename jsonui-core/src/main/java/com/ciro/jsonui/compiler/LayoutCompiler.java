package com.ciro.jsonui.compiler;

import com.ciro.jsonui.Diagnostics;
import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.ast.LayoutReader;
import com.ciro.jsonui.binding.BindingResolver;
import com.ciro.jsonui.binding.VisibilityResolver;
import com.ciro.jsonui.emit.EmitContext;
import com.ciro.jsonui.emit.TreeWalker;
import com.ciro.jsonui.gen.ComponentModuleGenerator;
import com.ciro.jsonui.gen.DataModuleGenerator;
import com.ciro.jsonui.gen.StateScaffoldGenerator;
import com.ciro.jsonui.style.StyleResolver;
import com.ciro.jsonui.util.Names;
import com.ciro.jsonui.validation.BindingValidator;
import com.ciro.jsonui.validation.ValidationWarning;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Pipeline de un documento: parseo → estilos → validación → emisión → módulos
 * complementarios. Sin estado mutable propio: una instancia sirve para todo el batch y
 * para varios hilos.
 */
public class LayoutCompiler {

    private static final Logger log = LoggerFactory.getLogger(LayoutCompiler.class);

    private final CompilerContext context;
    private final LayoutReader reader;
    private final StyleResolver styles;
    private final BindingResolver bindings;
    private final VisibilityResolver visibility;
    private final BindingValidator validator;
    private final TreeWalker walker;
    private final DataModuleGenerator dataModules;
    private final StateScaffoldGenerator hooks;
    private final ComponentModuleGenerator components;

    public LayoutCompiler(CompilerContext context, ObjectMapper mapper) {
        this.context = context;
        this.reader = new LayoutReader(mapper);
        this.styles = new StyleResolver(context.styles());
        this.bindings = new BindingResolver(context.conventions());
        this.visibility = new VisibilityResolver(context.conventions());
        this.validator = new BindingValidator(context.conventions());
        this.walker = new TreeWalker(context.emitters());
        this.dataModules = new DataModuleGenerator(mapper, context.conventions());
        this.hooks = new StateScaffoldGenerator(context.conventions());
        this.components = new ComponentModuleGenerator();
    }

    public LayoutCompiler(CompilerContext context) {
        this(context, new ObjectMapper());
    }

    /**
     * @throws com.ciro.jsonui.ast.LayoutParseException si el JSON no se puede parsear
     */
    public CompilationResult compile(String document, String json) {
        long start = System.nanoTime();
        Diagnostics diagnostics = Diagnostics.forDocument(document);
        ComponentNode root = resolve(document, json, diagnostics);

        List<ValidationWarning> warnings = validator.validate(root, document);

        EmitContext ctx = EmitContext.root(bindings, visibility, diagnostics, context.knownDocuments());
        String markup = walker.walk(root, ctx);
        if (markup == null) {
            diagnostics.warn(document, "root is a data-only node; nothing to render");
            markup = "";
        }

        String name = Names.pascal(document);
        CompilationResult result = new CompilationResult(
                document,
                name,
                markup,
                components.generate(name, markup, ctx.usage(), context.flavor()),
                dataModules.generate(name, root, context.flavor()),
                hooks.generate(name, root, context.flavor()),
                warnings,
                diagnostics.entries());

        log.debug("Compiled {} in {} ms ({} warnings, {} diagnostics)", document,
                (System.nanoTime() - start) / 1_000_000, warnings.size(), result.diagnostics().size());
        return result;
    }

    /** Sólo la validación de bindings, sin emitir nada. */
    public List<ValidationWarning> validate(String document, String json) {
        Diagnostics diagnostics = Diagnostics.forDocument(document);
        return validator.validate(resolve(document, json, diagnostics), document);
    }

    /** Árbol parseado y con estilos aplicados. */
    public ComponentNode resolve(String document, String json, Diagnostics diagnostics) {
        ComponentNode parsed = reader.read(document, json);
        return styles.resolve(parsed, diagnostics);
    }

    public CompilerContext context() {
        return context;
    }
}
