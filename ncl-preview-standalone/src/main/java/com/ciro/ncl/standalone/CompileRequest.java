package com.ciro.ncl.standalone;

import com.ciro.ncl.CompileOptions;
import com.ciro.ncl.template.MockDataContext;

import java.util.Map;

/**
 * Cuerpo de {@code POST /compile} y de cada mensaje del WebSocket.
 * <pre>{"source": "...", "style": "...", "islands": {...}, "options": {...}}</pre>
 */
public class CompileRequest {

    private String source = "";
    private String style = "";
    private Map<String, String> islands = Map.of();
    private Options options = new Options();

    public static class Options {
        private String title;
        private boolean tailwind;
        private boolean minify;
        private boolean pretty;
        private Map<String, Object> mockData;

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public boolean isTailwind() { return tailwind; }
        public void setTailwind(boolean tailwind) { this.tailwind = tailwind; }

        public boolean isMinify() { return minify; }
        public void setMinify(boolean minify) { this.minify = minify; }

        public boolean isPretty() { return pretty; }
        public void setPretty(boolean pretty) { this.pretty = pretty; }

        public Map<String, Object> getMockData() { return mockData; }
        public void setMockData(Map<String, Object> mockData) { this.mockData = mockData; }
    }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source == null ? "" : source; }

    public String getStyle() { return style; }
    public void setStyle(String style) { this.style = style == null ? "" : style; }

    public Map<String, String> getIslands() { return islands; }
    public void setIslands(Map<String, String> islands) { this.islands = islands == null ? Map.of() : islands; }

    public Options getOptions() { return options; }
    public void setOptions(Options options) { this.options = options == null ? new Options() : options; }

    public CompileOptions toCompileOptions() {
        CompileOptions.Builder b = CompileOptions.builder()
                .tailwind(options.isTailwind())
                .minifyStyles(options.isMinify())
                .prettyPrint(options.isPretty());
        if (options.getTitle() != null && !options.getTitle().isBlank()) b.defaultTitle(options.getTitle());
        if (options.getMockData() != null) b.mockData(MockDataContext.of(options.getMockData()));
        return b.build();
    }
}
