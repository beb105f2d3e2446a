package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;

import java.util.regex.Pattern;

public final class ScopedStylePass implements DirectivePass {

    private static final Pattern SCOPED = Pattern.compile(
        "(<style\\b[^>]*?)\\s+scoped\\b(?:\\s*=\\s*(?:\"[^\"]*\"|'[^']*'))?", Pattern.CASE_INSENSITIVE);

    @Override
    public String apply(String html, CompileContext ctx) {
        return SCOPED.matcher(html).replaceAll("$1");
    }
}
