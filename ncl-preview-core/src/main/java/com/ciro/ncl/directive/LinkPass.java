package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;

import java.util.regex.Pattern;

/** {@code <n:link href>} → {@code <a … data-prefetch="true">}. */
public final class LinkPass implements DirectivePass {

    private static final Pattern LINK = Pattern.compile("<n:link\\b(" + Markup.ATTRS + "?)(?<!/)>([\\s\\S]*?)</n:link\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:link")) return html;
        return Markup.replace(html, LINK, m -> {
            ComponentAttributes attrs = ComponentAttributes.parse(m.group(1));
            if (attrs.get("href") == null) return null;
            String prefetch = attrs.has("prefetch") && !attrs.flag("prefetch") ? "" : " data-prefetch=\"true\"";
            return "<a" + attrs.toAttributeString("prefetch") + prefetch + ">" + m.group(2) + "</a>";
        });
    }
}
