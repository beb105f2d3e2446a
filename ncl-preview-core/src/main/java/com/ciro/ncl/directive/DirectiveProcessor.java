package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compone las pasadas en orden fijo. Una pasada que falla se registra y su
 * entrada sigue adelante sin cambios: la compilación nunca aborta.
 */
public final class DirectiveProcessor {

    private static final Logger log = LoggerFactory.getLogger(DirectiveProcessor.class);

    private static final List<DirectivePass> PASSES = List.of(
        new ComponentDefinitionPass(),
        new ViewPass(),
        new LayoutPass(),
        new SlotPropsPass(),
        new ScopedStylePass(),
        new ForPass(),
        new JinjaForPass(),
        new ConditionalPass(),
        new InlineIslandPass(),
        new ExternalIslandPass(),
        new LinkPass(),
        new ImagePass(),
        new DataLoadingPass(),
        new ClientOnlyPass(),
        new ServerScriptPass(),
        new FormPass(),
        new IncludePass()
    );

    private static final List<DirectivePass> FRAGMENT_PASSES = PASSES.subList(2, PASSES.size() - 1);

    private DirectiveProcessor() {}

    public static List<DirectivePass> passes() {
        return PASSES;
    }

    public static String process(String source, CompileContext ctx) {
        return run(PASSES, source, ctx);
    }

    /** Sin definiciones, sin vista y sin includes: para cuerpos incluidos o de componente. */
    public static String processFragment(String fragment, CompileContext ctx) {
        return run(FRAGMENT_PASSES, fragment, ctx);
    }

    private static String run(List<DirectivePass> passes, String input, CompileContext ctx) {
        String html = input == null ? "" : input;
        for (DirectivePass pass : passes) {
            try {
                html = pass.apply(html, ctx);
            } catch (RuntimeException e) {
                log.warn("Directive pass {} failed, keeping its input: {}", pass.name(), e.toString());
            }
        }
        return html;
    }
}
