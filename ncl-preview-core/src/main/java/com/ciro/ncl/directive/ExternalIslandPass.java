package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;
import com.ciro.ncl.island.HydrationMode;
import com.ciro.ncl.island.ReactiveTranspiler;
import com.ciro.ncl.island.TranspiledIsland;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * {@code <n:island src="path" client:mode />}: el contenido sale de la tabla de
 * islas del llamador ({@code path}, {@code path.ncl}, {@code path.rs}).
 */
public final class ExternalIslandPass implements DirectivePass {

    private static final Logger log = LoggerFactory.getLogger(ExternalIslandPass.class);

    private static final Pattern SELF_CLOSING = Pattern.compile("<n:island\\b(" + Markup.ATTRS + "?)/>");
    private static final Pattern EMPTY_PAIR = Pattern.compile("<n:island\\b(" + Markup.ATTRS + "?)(?<!/)>\\s*</n:island\\s*>");

    private static final String[] SUFFIXES = { "", ".ncl", ".rs" };

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:island")) return html;
        String out = Markup.replace(html, SELF_CLOSING, m -> expand(m, ctx));
        return Markup.replace(out, EMPTY_PAIR, m -> expand(m, ctx));
    }

    private static String expand(MatchResult m, CompileContext ctx) {
        String rawAttrs = m.group(1);
        String src = ComponentAttributes.parse(rawAttrs).get("src");
        if (src == null || src.isBlank()) return null;
        src = src.trim();

        boolean declared = HydrationMode.isDeclared(rawAttrs);
        HydrationMode mode = HydrationMode.fromAttributes(rawAttrs);

        Optional<String> content = lookup(src, ctx);
        if (content.isEmpty()) {
            log.debug("Island '{}' not found in lookup table", src);
            return placeholder(src, declared ? mode : null);
        }

        try {
            TranspiledIsland island = ReactiveTranspiler.transpile(content.get(), mode);
            if (!island.hasSignals()) {
                island = ReactiveTranspiler.withDefaultCounter(island, mode);
            }
            return "<div data-island=\"" + src.replace('/', '-') + "\" data-hydrate=\"" + mode.attributeValue() + "\">"
                    + island.toHtml() + "</div>";
        } catch (RuntimeException e) {
            log.warn("Island '{}' failed to compile: {}", src, e.toString());
            return InlineIslandPass.islandError(e);
        }
    }

    private static Optional<String> lookup(String src, CompileContext ctx) {
        for (String suffix : SUFFIXES) {
            Optional<String> hit = ctx.island(src + suffix);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    private static String placeholder(String src, HydrationMode mode) {
        if (mode == null) {
            return "<div data-island=\"" + src + "\"><!-- Island: " + src + " --></div>";
        }
        return "<div data-island=\"" + src + "\" data-hydrate=\"" + mode.attributeValue() + "\">"
                + "<!-- Island: " + src + " (hydrate: " + mode.attributeValue() + ") --></div>";
    }
}
