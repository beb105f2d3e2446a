package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;

import java.util.regex.Pattern;

public final class ServerScriptPass implements DirectivePass {

    private static final Pattern SCRIPT = Pattern.compile("<n:script\\b" + Markup.ATTRS + ">[\\s\\S]*?</n:script\\s*>");

    @Override
    public String apply(String html, CompileContext ctx) {
        return SCRIPT.matcher(html).replaceAll("");
    }
}
