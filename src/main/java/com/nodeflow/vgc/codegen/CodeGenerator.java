package com.nodeflow.vgc.codegen;

import java.time.Clock;

import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.engine.VisualGraph;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a syntax tree into formatted Python source.
 *
 * <p>
 * Pipeline, in order:
 * <ol>
 * <li>type hints ({@link TypeHintPass}, option {@code addTypeHints})</li>
 * <li>docstrings ({@link DocstringPass}, option {@code addDocstrings})</li>
 * <li>node comments as docstrings ({@link CommentPreservationPass}, option
 * {@code preserveComments}, graph required)</li>
 * <li>explicit node docstrings ({@link CustomDocstringPass}, graph required)</li>
 * <li>rendering ({@link PythonUnparser}, {@link FallbackRenderer} when it fails)</li>
 * <li>header comments ({@link HeaderInjector}, graph required)</li>
 * <li>formatting ({@link CodeFormatter}, option {@code formatCode})</li>
 * <li>import hoisting ({@link ImportOptimizer}, option {@code optimizeCode})</li>
 * <li>inline variable comments ({@link InlineCommentPass}, option
 * {@code preserveComments}, graph required)</li>
 * </ol>
 * The input tree is never modified. {@link #validate} and {@link #metrics} are
 * separate read-only checks over the result.
 */
@Log4j2
public class CodeGenerator {
    private final PythonUnparser unparser = new PythonUnparser();
    private final FallbackRenderer fallback = new FallbackRenderer();
    private final HeaderInjector headerInjector;
    private final CodeFormatter formatter = new CodeFormatter();
    private final ImportOptimizer importOptimizer = new ImportOptimizer();
    private final InlineCommentPass inlineComments = new InlineCommentPass();
    private final CodeValidator validator = new CodeValidator();

    public CodeGenerator() {
        this(Clock.systemDefaultZone());
    }

    /** @param clock source of the generation timestamp in the header */
    public CodeGenerator(Clock clock) {
        this.headerInjector = new HeaderInjector(clock);
    }

    public String generate(Module module) {
        return generate(module, GeneratorOptions.DEFAULTS, null);
    }

    public String generate(Module module, GeneratorOptions options) {
        return generate(module, options, null);
    }

    /**
     * @param graph the graph the module was lowered from, or null; enables the
     *              comment, docstring and header passes
     */
    public String generate(Module module, GeneratorOptions options, VisualGraph graph) {
        Module tree = module;
        if (options.isAddTypeHints()) {
            tree = new TypeHintPass().transform(tree);
            log.debug("Type hints added");
        }
        DocstringPass docstrings = new DocstringPass();
        if (options.isAddDocstrings()) {
            tree = docstrings.transform(tree);
            log.debug("Synthesized {} docstrings", docstrings.synthesized().size());
        }
        if (graph != null) {
            if (options.isPreserveComments())
                tree = new CommentPreservationPass(graph, docstrings.synthesized()).transform(tree);
            tree = new CustomDocstringPass(graph).transform(tree);
        }

        String code = render(tree);

        if (graph != null)
            code = headerInjector.inject(code, graph.metadata());
        if (options.isFormatCode())
            code = formatter.format(code);
        if (options.isOptimizeCode())
            code = importOptimizer.optimize(code);
        if (graph != null && options.isPreserveComments())
            code = inlineComments.apply(code, graph);

        log.debug("Generated {} lines from {} statements", code.split("\n", -1).length, module.body().size());
        return code;
    }

    private String render(Module tree) {
        try {
            return unparser.unparse(tree);
        } catch (RuntimeException e) {
            log.warn("Falling back to line renderer: {}", e.getMessage());
            return fallback.render(tree);
        }
    }

    public CodeValidator.Result validate(String code) {
        return validator.validate(code);
    }

    public CodeMetrics metrics(String code) {
        return CodeMetrics.of(code);
    }
}
