package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;

import java.util.regex.Pattern;

/** La carga de datos es del servidor: en la vista previa no queda nada. */
public final class DataLoadingPass implements DirectivePass {

    private static final Pattern LOAD = Pattern.compile("<n:load\\b" + Markup.ATTRS + "?(?:/>|>[\\s\\S]*?</n:load\\s*>)");
    private static final Pattern MODEL = Pattern.compile("<n:model\\b[\\s\\S]*?(?:/>|</n:model\\s*>)");

    @Override
    public String apply(String html, CompileContext ctx) {
        String out = LOAD.matcher(html).replaceAll("");
        return MODEL.matcher(out).replaceAll("<!-- data model binding -->");
    }
}
