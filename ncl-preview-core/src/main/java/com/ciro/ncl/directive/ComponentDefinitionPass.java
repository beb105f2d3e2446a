package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentDefinition;

import java.util.regex.Pattern;

/** Extrae {@code <n:component name="X">…</n:component>} antes que nada. */
public final class ComponentDefinitionPass implements DirectivePass {

    private static final Pattern DEFINITION = Pattern.compile(
        "<n:component\\s+name\\s*=\\s*[\"']([A-Za-z_][\\w-]*)[\"']" + Markup.ATTRS + ">([\\s\\S]*?)</n:component\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:component")) return html;
        return Markup.replace(html, DEFINITION, m -> {
            ctx.define(new ComponentDefinition(m.group(1), m.group(2).strip()));
            return "";
        });
    }
}
