package com.ciro.ncl.standalone;

import com.ciro.ncl.NclCompiler;

/** Compila una petición y la deja como última vista previa de la sesión. */
public class PreviewService {

    private final PreviewSessionStore store;

    public PreviewService(PreviewSessionStore store) {
        this.store = store;
    }

    public String compile(String sid, CompileRequest request) {
        String html = NclCompiler.compile(
                request.getSource(), request.getStyle(), request.getIslands(), request.toCompileOptions());
        store.remember(sid, html);
        return html;
    }

    public PreviewSessionStore store() {
        return store;
    }
}
