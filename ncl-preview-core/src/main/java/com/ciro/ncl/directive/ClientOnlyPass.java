package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;

import java.util.regex.Pattern;

public final class ClientOnlyPass implements DirectivePass {

    private static final Pattern OPEN = Pattern.compile("<n:client\\b" + Markup.ATTRS + ">");
    private static final Pattern CLOSE = Pattern.compile("</n:client\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("n:client")) return html;
        return CLOSE.matcher(OPEN.matcher(html).replaceAll("<script>")).replaceAll("</script>");
    }
}
