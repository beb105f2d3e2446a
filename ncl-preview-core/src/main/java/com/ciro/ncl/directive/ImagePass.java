package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;

import java.util.regex.Pattern;

public final class ImagePass implements DirectivePass {

    private static final Pattern IMAGE = Pattern.compile("<n:image\\b(" + Markup.ATTRS + "?)/?>(?:\\s*</n:image\\s*>)?");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:image")) return html;
        return Markup.replace(html, IMAGE, m -> {
            ComponentAttributes attrs = ComponentAttributes.parse(m.group(1));
            if (attrs.get("src") == null) return null;
            String loading = attrs.has("loading") ? "" : " loading=\"lazy\"";
            String decoding = attrs.has("decoding") ? "" : " decoding=\"async\"";
            return "<img" + attrs.toAttributeString() + loading + decoding + " />";
        });
    }
}
