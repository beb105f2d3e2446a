package com.ciro.ncl.standalone;

import com.ciro.ncl.CompileOptions;
import com.ciro.ncl.NclCompiler;
import com.ciro.ncl.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompileRequestTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();

    @Test
    void mapsWireOptions() throws Exception {
        CompileRequest req = mapper.readValue("""
            {"source": "<view>x</view>", "style": "p{}", "islands": {"A": "<b>a</b>"},
             "options": {"title": "Draft", "tailwind": true, "minify": true, "pretty": false},
             "editorVersion": 3}
            """, CompileRequest.class);

        CompileOptions opts = req.toCompileOptions();
        assertEquals("<view>x</view>", req.getSource());
        assertEquals(Map.of("A", "<b>a</b>"), req.getIslands());
        assertEquals("Draft", opts.defaultTitle());
        assertTrue(opts.tailwind());
        assertTrue(opts.minifyStyles());
        assertFalse(opts.prettyPrint());
    }

    @Test
    void nullsFallBackToDefaults() throws Exception {
        CompileRequest req = mapper.readValue("{\"source\": null, \"islands\": null, \"options\": null}", CompileRequest.class);

        assertEquals("", req.getSource());
        assertEquals("", req.getStyle());
        assertTrue(req.getIslands().isEmpty());
        assertEquals(CompileOptions.DEFAULT_TITLE, req.toCompileOptions().defaultTitle());
    }

    @Test
    void suppliedMockDataReplacesTheBundledSet() throws Exception {
        CompileRequest req = mapper.readValue(
                "{\"source\": \"<p>{{ user.name }}</p>\", \"options\": {\"mockData\": {\"user\": {\"name\": \"Rita\"}}}}",
                CompileRequest.class);

        String html = NclCompiler.compile(req.getSource(), req.getStyle(), req.getIslands(), req.toCompileOptions());
        assertTrue(html.contains("<p>Rita</p>"));
    }
}
