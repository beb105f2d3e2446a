package com.ciro.ncl;

import com.ciro.ncl.component.ComponentRenderer;
import com.ciro.ncl.directive.DirectiveProcessor;
import com.ciro.ncl.template.SubstitutionEngine;
import com.ciro.ncl.template.TokenNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Punto de entrada: función pura y síncrona de (fuente, estilos, islas, opciones)
 * a un documento HTML completo. No guarda nada entre llamadas.
 *
 * <ol>
 *   <li>directivas (incluye la transpilación de islas)</li>
 *   <li>componentes</li>
 *   <li>sustitución de tokens</li>
 *   <li>normalización final</li>
 *   <li>esqueleto del documento + estilos</li>
 * </ol>
 */
public final class NclCompiler {

    private static final Logger log = LoggerFactory.getLogger(NclCompiler.class);

    private NclCompiler() {}

    public static String compile(String source) {
        return compile(source, "", Map.of(), CompileOptions.defaults());
    }

    public static String compile(String source, String style) {
        return compile(source, style, Map.of(), CompileOptions.defaults());
    }

    public static String compile(String source, String style, Map<String, String> islands) {
        return compile(source, style, islands, CompileOptions.defaults());
    }

    public static String compile(String source, String style, Map<String, String> islands, CompileOptions options) {
        long start = System.nanoTime();
        CompileContext ctx = new CompileContext(options, islands);

        String html = DirectiveProcessor.process(source == null ? "" : source, ctx);
        html = ComponentRenderer.render(html, ctx.definitions(),
                body -> DirectiveProcessor.processFragment(body, ctx));
        html = SubstitutionEngine.substitute(html, ctx.data());
        html = TokenNormalizer.normalize(html);

        String css = StyleBundler.bundle(style, ctx.options().minifyStyles());
        html = DocumentShell.finish(html, css, ctx.documentTitle(), ctx.options());

        if (ctx.options().prettyPrint()) {
            html = HtmlFormatter.format(html);
        }

        if (log.isDebugEnabled()) {
            log.debug("Compiled {} chars -> {} chars in {} µs ({} component definition(s))",
                    source == null ? 0 : source.length(), html.length(),
                    (System.nanoTime() - start) / 1_000, ctx.definitions().size());
        }
        return html;
    }
}
