package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;

/**
 * Una reescritura de texto del documento completo. Las implementaciones no
 * guardan estado: todo lo que dura una compilación vive en {@link CompileContext}.
 */
public interface DirectivePass {

    String apply(String html, CompileContext ctx);

    default String name() {
        return getClass().getSimpleName();
    }
}
