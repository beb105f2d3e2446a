package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.HtmlEscaper;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;
import com.ciro.ncl.island.HydrationMode;
import com.ciro.ncl.island.ReactiveTranspiler;
import com.ciro.ncl.island.TranspiledIsland;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/** {@code <n:island client:mode>…</n:island>} con contenido propio. */
public final class InlineIslandPass implements DirectivePass {

    private static final Logger log = LoggerFactory.getLogger(InlineIslandPass.class);

    // no debe casar con la forma auto-cerrada
    private static final Pattern ISLAND = Pattern.compile(
        "<n:island\\b(" + Markup.ATTRS + "?)(?<!/)>([\\s\\S]*?)</n:island\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:island")) return html;
        return Markup.replace(html, ISLAND, m -> {
            String rawAttrs = m.group(1);
            if (ComponentAttributes.parse(rawAttrs).has("src")) return null;

            HydrationMode mode = HydrationMode.fromAttributes(rawAttrs);
            String open = "<div data-island=\"inline\" data-hydrate=\"" + mode.attributeValue() + "\">";
            try {
                TranspiledIsland island = ReactiveTranspiler.transpile(m.group(2), mode);
                return open + island.toHtml() + "</div>";
            } catch (RuntimeException e) {
                log.warn("Inline island failed to compile: {}", e.toString());
                return islandError(e);
            }
        });
    }

    static String islandError(RuntimeException e) {
        String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return "<div class=\"island-error\">Error compiling island: " + HtmlEscaper.escape(msg) + "</div>";
    }
}
