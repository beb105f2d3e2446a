package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;

/** {@code <n:for item="x" in="coll">}, anidable. */
public final class ForPass implements DirectivePass {

    @Override
    public String apply(String html, CompileContext ctx) {
        return LoopExpander.expandNFor(html, ctx.data());
    }
}
