package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <n:view title="T">} (o {@code <view>}): fija el título del documento y
 * desaparece. Solo la primera apertura cuenta; el esqueleto lo pone
 * {@link com.ciro.ncl.DocumentShell} al final, ya normalizado el cuerpo.
 */
public final class ViewPass implements DirectivePass {

    private static final Pattern OPEN = Pattern.compile("<(?:n:)?view\\b(" + Markup.ATTRS + "?)/?>");
    private static final Pattern CLOSE = Pattern.compile("</(?:n:)?view\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        Matcher open = OPEN.matcher(html);
        if (!open.find()) return html;

        ctx.documentTitle(ComponentAttributes.parse(open.group(1)).getOrDefault("title", ctx.options().defaultTitle()));

        // lo de antes y lo de después de la vista queda dentro del body
        String before = html.substring(0, open.start()).strip();
        String rest = OPEN.matcher(html.substring(open.end())).replaceAll("");
        rest = CLOSE.matcher(rest).replaceAll("");
        return before.isEmpty() ? rest : before + "\n" + rest;
    }
}
