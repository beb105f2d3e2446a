package com.ciro.ncl.template;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenNormalizerTest {

    @Test
    void tokensBecomeBracketedNames() {
        assertEquals("[x] [x.y] [a] [a.b]", TokenNormalizer.normalize("{{ x }} {{ x.y }} {a} {a.b}"));
    }

    @Test
    void expressionLeftoversAreBracketedToo() {
        assertEquals("[count * 2]", TokenNormalizer.normalize("{{ count * 2 }}"));
    }

    @Test
    void directivesBecomeVisibleText() {
        String out = TokenNormalizer.normalize("<n:for item=\"x\">a</n:for>{% foo %}<view>");
        assertTrue(out.startsWith("&lt;n:for item="));
        assertTrue(out.contains("&lt;/n:for&gt;"));
        assertTrue(out.contains("&#123;% foo %&#125;"));
        assertTrue(out.contains("&lt;view&gt;"));
        assertFalse(out.contains("<n:"));
    }

    @Test
    void idempotent() {
        String once = TokenNormalizer.normalize("<n:if condition=\"a\">{{ b }}</n:if>{% if x %}");
        assertEquals(once, TokenNormalizer.normalize(once));
    }

    @Test
    void ordinaryMarkupAndCodeAreKept() {
        String html = "<div class=\"a\"><script>if (a) { b(); }</script><style>.x { color: red; }</style></div>";
        assertEquals(html, TokenNormalizer.normalize(html));
    }

    @Test
    void halfTypedOpenersAreEscaped() {
        String out = TokenNormalizer.normalize("<p>a</p>\n<n:for item=\"p\" in=\"posts\"\n<p>b</p>");
        assertTrue(out.startsWith("<p>a</p>\n&lt;n:for item="));
        assertTrue(out.endsWith("<p>b</p>"));

        assertFalse(TokenNormalizer.normalize("{% for p in posts").contains("{%"));
        assertEquals("<p>&#123;&#123; user.na", TokenNormalizer.normalize("<p>{{ user.na"));
    }
}
