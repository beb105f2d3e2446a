package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.CompileOptions;
import com.ciro.ncl.component.ComponentDefinition;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IncludePassTest {

    private final CompileContext ctx = new CompileContext(CompileOptions.defaults(), Map.of(
            "partials/header.ncl", "<n:link href=\"/\">Home</n:link><n:include src=\"partials/other\"/>",
            "partials/other", "<p>other</p>"));

    private final IncludePass pass = new IncludePass();

    @Test
    void includedBodyRunsThroughTheOtherDirectives() {
        assertEquals("<a href=\"/\" data-prefetch=\"true\">Home</a><n:include src=\"partials/other\"/>",
                pass.apply("<n:include src=\"partials/header\"/>", ctx));
    }

    @Test
    void definitionsCanBeIncludedByName() {
        ctx.define(new ComponentDefinition("Footer", "<footer>f</footer>"));
        assertEquals("<footer>f</footer>", pass.apply("<n:include name=\"Footer\"></n:include>", ctx));
    }

    @Test
    void selfAndMissingIncludesStayAsText() {
        assertEquals("<n:include src=\"main\"/>", pass.apply("<n:include src=\"main\"/>", ctx));
        assertEquals("<n:include src=\"nope\"/>", pass.apply("<n:include src=\"nope\"/>", ctx));
    }

    @Test
    void fragmentSkipsDefinitionAndViewPasses() {
        assertEquals("<view>x</view>", DirectiveProcessor.processFragment("<view>x</view>", ctx));
    }
}
