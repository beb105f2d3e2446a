package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;

import java.util.regex.Pattern;

public final class SlotPropsPass implements DirectivePass {

    private static final Pattern DEFAULT_SLOT = Pattern.compile("<n:slot\\s*/>|<n:slot\\s*>\\s*</n:slot\\s*>");
    private static final Pattern NAMED_SLOT = Pattern.compile("<n:slot\\s+name\\s*=\\s*[\"']([^\"']*)[\"']\\s*/>");
    private static final Pattern PROPS = Pattern.compile("<n:props\\b" + Markup.ATTRS + ">[\\s\\S]*?</n:props\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        String out = DEFAULT_SLOT.matcher(html).replaceAll("<!-- slot content -->");
        out = Markup.replace(out, NAMED_SLOT, m -> "<!-- slot: " + m.group(1) + " -->");
        return PROPS.matcher(out).replaceAll("");
    }
}
