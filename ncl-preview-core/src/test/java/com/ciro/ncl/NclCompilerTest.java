package com.ciro.ncl;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NclCompilerTest {

    private static final Pattern DIRECTIVE_SYNTAX = Pattern.compile("<\\s*/?\\s*n:|\\{%|<view\\b|</view>");

    @Test
    void bareViewBecomesCompleteDocument() {
        String out = NclCompiler.compile("<view title=\"Hello\"><p>Hi</p></view>");

        assertTrue(out.startsWith("<!DOCTYPE html>"));
        assertTrue(out.contains("<title>Hello</title>"));
        assertTrue(out.contains("<p>Hi</p>"));
        assertFalse(out.contains("<view"));
        assertFalse(out.contains("</view>"));
        assertTrue(out.indexOf("<p>Hi</p>") > out.indexOf("<body>"));
    }

    @Test
    void namespacedViewWithoutTitleUsesDefault() {
        String out = NclCompiler.compile("<n:view><h1>x</h1></n:view>");
        assertTrue(out.contains("<title>NCL Preview</title>"));

        String custom = NclCompiler.compile("<n:view><h1>x</h1></n:view>", "", Map.of(),
                CompileOptions.builder().defaultTitle("Playground").build());
        assertTrue(custom.contains("<title>Playground</title>"));
    }

    @Test
    void fragmentWithoutViewIsWrapped() {
        String out = NclCompiler.compile("<p>solo</p>");
        assertTrue(out.startsWith("<!DOCTYPE html>"));
        assertTrue(out.contains("<body>"));
        assertTrue(out.contains("<p>solo</p>"));
        assertTrue(out.trim().endsWith("</html>"));
    }

    @Test
    void islandCounterScenario() {
        String src = """
            <n:view title="Counter">
              <n:island client:load>
                <n:script>let count = signal(0);</n:script>
                <div>
                  <p>{count}</p>
                  <button onclick={|_| count.update(|c| *c += 1)}>+</button>
                </div>
              </n:island>
            </n:view>
            """;
        String out = NclCompiler.compile(src);

        assertTrue(out.contains("state.count = 0;"));
        assertTrue(out.contains("data-n-action=\"count:+=:1\""));
        assertTrue(out.contains("<span data-n-bind=\"count\"></span>"));
        assertTrue(out.contains("data-island=\"inline\""));
        assertTrue(out.contains("data-hydrate=\"load\""));
    }

    @Test
    void buttonWithHrefBecomesLink() {
        String out = NclCompiler.compile("<Button href=\"/login\" variant=\"primary\">Login</Button>");
        assertTrue(out.contains("<a href=\"/login\" class=\"btn btn-primary btn-medium\">Login</a>"));
        assertFalse(out.contains("<button"));
    }

    @Test
    void styleBlockCarriesBaseAndAuthorCss() {
        String out = NclCompiler.compile("<n:view title=\"T\"><p>x</p></n:view>", ".custom-class { color: red; }");

        int styleAt = out.indexOf("<style>");
        assertTrue(styleAt > 0 && styleAt < out.indexOf("</head>"));
        assertTrue(out.contains(".btn {"));
        assertTrue(out.contains(".form-field {"));
        assertTrue(out.contains(".custom-class { color: red; }"));
        assertTrue(out.indexOf(".btn {") < out.indexOf(".custom-class"));
    }

    @Test
    void tailwindOptionAddsCdnScript() {
        String out = NclCompiler.compile("<p>x</p>", "", Map.of(), CompileOptions.builder().tailwind(true).build());
        assertTrue(out.contains("cdn.tailwindcss.com"));
        assertFalse(NclCompiler.compile("<p>x</p>").contains("cdn.tailwindcss.com"));
    }

    @Test
    void lengthHelperResolvesAgainstMockData() {
        String out = NclCompiler.compile("<p>{{ todos.len() }} items</p>");
        assertTrue(out.contains("<p>3 items</p>"));
    }

    @Test
    void compileIsPure() {
        String src = """
            <n:view title="Blog">
              <n:for item="post" in="posts"><h2>{{ post.title }}</h2></n:for>
              <n:island src="Counter" client:visible />
              <Card glass>{{ stats.revenue }}</Card>
            </n:view>
            """;
        Map<String, String> islands = Map.of("Counter.ncl", "let count = Signal::new(3);\n<div>{count}</div>");

        String first = NclCompiler.compile(src, "h2 { margin: 0; }", islands);
        String second = NclCompiler.compile(src, "h2 { margin: 0; }", islands);
        assertEquals(first, second);
    }

    @Test
    void outputNeverContainsDirectiveSyntax() {
        String src = """
            <n:view title="Broken">
              <n:for item="x">sin colección</n:for>
              <n:unknown foo="bar">?</n:unknown>
              {% for %}mal{% endfor %}
              {% weird thing %}
              <n:include src="missing"/>
              <p>{{ nobody.knows }} / {ghost}</p>
            </n:view>
            """;
        String out = NclCompiler.compile(src);

        assertFalse(DIRECTIVE_SYNTAX.matcher(stripScripts(out)).find(), out);
        assertTrue(out.contains("&lt;n:unknown"));
        assertTrue(out.contains("[nobody.knows]"));
        assertTrue(out.contains("[ghost]"));
        assertTrue(out.contains("&#123;%"));
    }

    @Test
    void componentDefinitionsAreLocalToOneCall() {
        String withDef = """
            <n:component name="Hero"><section class="hero">{{ title }}</section></n:component>
            <Hero title="Hola"/>
            """;
        assertTrue(NclCompiler.compile(withDef).contains("<section class=\"hero\">Hola</section>"));
        assertTrue(NclCompiler.compile("<Hero title=\"Hola\"/>").contains("<Hero title=\"Hola\"/>"));
    }

    @Test
    void directivesInsideComponentBodiesAreExpanded() {
        String src = "<n:component name=\"Hero\"><n:if condition=\"title\"><h1>{{ title }}</h1></n:if>"
                + "<n:link href=\"/a\">a</n:link></n:component><Hero title=\"Hi\"/>";
        String out = NclCompiler.compile(src);

        assertTrue(out.contains("<h1>Hi</h1><a href=\"/a\" data-prefetch=\"true\">a</a>"), out);
        assertFalse(DIRECTIVE_SYNTAX.matcher(stripScripts(out)).find());
    }

    @Test
    void prettyPrintReindents() {
        String out = NclCompiler.compile("<div><p>x</p></div>", "", Map.of(),
                CompileOptions.builder().prettyPrint(true).build());
        assertTrue(Pattern.compile("\n[ ]+<div>").matcher(out).find(), out);
    }

    @Test
    void nullInputsAreTolerated() {
        String out = NclCompiler.compile(null, null, null, null);
        assertTrue(out.startsWith("<!DOCTYPE html>"));
    }

    @Test
    void truncatedSourceStillClosesTheDocument() {
        String out = NclCompiler.compile("<n:view title=\"T\"><p>a</p>\n<n:for item=\"p\" in=\"posts\"");
        assertTrue(out.contains("<title>T</title>"));
        assertTrue(out.contains("</body>"));
        assertTrue(out.trim().endsWith("</html>"));
        assertFalse(DIRECTIVE_SYNTAX.matcher(stripScripts(out)).find());

        for (String partial : new String[] {"{% for p in posts", "<p>{{ user.na"}) {
            String body = stripScripts(NclCompiler.compile(partial));
            assertFalse(DIRECTIVE_SYNTAX.matcher(body).find(), body);
            assertFalse(body.contains("{{"), body);
        }
    }

    @Test
    void contentAfterTheViewLandsInsideTheBody() {
        String out = NclCompiler.compile("<n:view title=\"T\"><p>in</p></n:view>\n<p>after</p>");
        assertTrue(out.indexOf("<p>after</p>") < out.indexOf("</body>"));
        assertTrue(out.trim().endsWith("</html>"));
    }

    private static String stripScripts(String html) {
        return html.replaceAll("(?s)<script\\b.*?</script>", "");
    }
}
