package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;

/** {@code {% for x in coll %} … {% empty %} … {% endfor %}}. */
public final class JinjaForPass implements DirectivePass {

    @Override
    public String apply(String html, CompileContext ctx) {
        return LoopExpander.expandJinja(html, ctx.data());
    }
}
