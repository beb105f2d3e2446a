package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;

import java.util.regex.Pattern;

public final class LayoutPass implements DirectivePass {

    private static final Pattern OPEN = Pattern.compile("<n:layout\\b(" + Markup.ATTRS + "?)/?>");
    private static final Pattern CLOSE = Pattern.compile("</n:layout\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("n:layout")) return html;
        String out = Markup.replace(html, OPEN, m -> {
            String name = ComponentAttributes.parse(m.group(1)).get("name");
            return name == null || name.isBlank() ? null : "<!-- Layout: " + name + " -->";
        });
        return CLOSE.matcher(out).replaceAll("");
    }
}
