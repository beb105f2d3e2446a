package com.ciro.ncl;

import com.ciro.ncl.template.MockDataContext;

/**
 * Opciones inmutables de una compilación.
 */
public final class CompileOptions {

    public static final String DEFAULT_TITLE = "NCL Preview";
    public static final String DEFAULT_DOCUMENT_NAME = "main.ncl";

    private final MockDataContext mockData;
    private final String defaultTitle;
    private final String documentName;
    private final boolean tailwind;
    private final boolean minifyStyles;
    private final boolean prettyPrint;

    private CompileOptions(Builder b) {
        this.mockData = b.mockData != null ? b.mockData : MockDataContext.defaults();
        this.defaultTitle = b.defaultTitle;
        this.documentName = b.documentName;
        this.tailwind = b.tailwind;
        this.minifyStyles = b.minifyStyles;
        this.prettyPrint = b.prettyPrint;
    }

    public static CompileOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MockDataContext mockData() { return mockData; }
    public String defaultTitle() { return defaultTitle; }
    public String documentName() { return documentName; }
    public boolean tailwind() { return tailwind; }
    public boolean minifyStyles() { return minifyStyles; }
    public boolean prettyPrint() { return prettyPrint; }

    public Builder toBuilder() {
        return new Builder()
            .mockData(mockData)
            .defaultTitle(defaultTitle)
            .documentName(documentName)
            .tailwind(tailwind)
            .minifyStyles(minifyStyles)
            .prettyPrint(prettyPrint);
    }

    public static final class Builder {
        private MockDataContext mockData;
        private String defaultTitle = DEFAULT_TITLE;
        private String documentName = DEFAULT_DOCUMENT_NAME;
        private boolean tailwind;
        private boolean minifyStyles;
        private boolean prettyPrint;

        private Builder() {}

        public Builder mockData(MockDataContext mockData) {
            this.mockData = mockData;
            return this;
        }

        /** JSON con la forma de {@code ncl/mock-data.json}. */
        public Builder mockDataJson(String json) {
            this.mockData = MockDataContext.fromJson(json);
            return this;
        }

        public Builder defaultTitle(String defaultTitle) {
            this.defaultTitle = (defaultTitle == null || defaultTitle.isBlank()) ? DEFAULT_TITLE : defaultTitle;
            return this;
        }

        public Builder documentName(String documentName) {
            this.documentName = (documentName == null || documentName.isBlank()) ? DEFAULT_DOCUMENT_NAME : documentName;
            return this;
        }

        public Builder tailwind(boolean tailwind) {
            this.tailwind = tailwind;
            return this;
        }

        public Builder minifyStyles(boolean minifyStyles) {
            this.minifyStyles = minifyStyles;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }
    }
}
