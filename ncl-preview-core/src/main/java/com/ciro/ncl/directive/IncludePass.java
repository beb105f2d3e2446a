package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;
import com.ciro.ncl.component.ComponentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * {@code <n:include src="name"/>}: un solo nivel. El cuerpo incluido pasa por
 * las demás directivas pero no se vuelve a buscar includes en él.
 */
public final class IncludePass implements DirectivePass {

    private static final Logger log = LoggerFactory.getLogger(IncludePass.class);

    private static final Pattern SELF_CLOSING = Pattern.compile("<n:include\\b(" + Markup.ATTRS + "?)/>");
    private static final Pattern EMPTY_PAIR = Pattern.compile("<n:include\\b(" + Markup.ATTRS + "?)(?<!/)>\\s*</n:include\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:include")) return html;
        String out = Markup.replace(html, SELF_CLOSING, m -> include(m, ctx));
        return Markup.replace(out, EMPTY_PAIR, m -> include(m, ctx));
    }

    private static String include(MatchResult m, CompileContext ctx) {
        ComponentAttributes attrs = ComponentAttributes.parse(m.group(1));
        String name = attrs.has("src") ? attrs.get("src") : attrs.get("name");
        if (name == null || name.isBlank()) return null;
        name = name.trim();

        String self = ctx.options().documentName();
        if (name.equals(self) || (name + ".ncl").equals(self)) {
            log.debug("Self include of '{}' left as text", name);
            return null;
        }

        Optional<String> body = resolve(name, ctx);
        if (body.isEmpty()) {
            log.debug("Include target '{}' not found", name);
            return null;
        }
        return DirectiveProcessor.processFragment(body.get(), ctx);
    }

    private static Optional<String> resolve(String name, CompileContext ctx) {
        Optional<String> def = ctx.definition(name).map(ComponentDefinition::body);
        if (def.isPresent()) return def;
        Optional<String> exact = ctx.island(name);
        if (exact.isPresent()) return exact;
        return ctx.island(name + ".ncl");
    }
}
