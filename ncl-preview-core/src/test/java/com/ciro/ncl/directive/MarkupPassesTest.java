package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.CompileOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkupPassesTest {

    private final CompileContext ctx = new CompileContext(CompileOptions.defaults(), Map.of());

    @Test
    void viewSetsTheTitleAndLeavesTheBody() {
        String out = new ViewPass().apply("<n:view title=\"Home\"><h1>Hi</h1></n:view>", ctx);
        assertEquals("<h1>Hi</h1>", out);
        assertEquals("Home", ctx.documentTitle());
    }

    @Test
    void bareViewUsesDefaultTitleAndKeepsLeadingContent() {
        String out = new ViewPass().apply("<p>pre</p>\n<view><p>in</p></view>", ctx);
        assertEquals("<p>pre</p>\n<p>in</p>", out);
        assertEquals("NCL Preview", ctx.documentTitle());
    }

    @Test
    void contentAfterTheViewStaysInTheBody() {
        String out = new ViewPass().apply("<n:view title=\"T\"><p>in</p></n:view>\n<p>after</p>", ctx);
        assertEquals("<p>in</p>\n<p>after</p>", out);
    }

    @Test
    void onlyTheFirstViewCounts() {
        String out = new ViewPass().apply("<n:view title=\"A\">1<n:view title=\"B\">2</n:view>3</n:view>", ctx);
        assertEquals("A", ctx.documentTitle());
        assertEquals("123", out);
    }

    @Test
    void titleWithAngleBracketIsKept() {
        new ViewPass().apply("<n:view title=\"a > b\"><p>x</p></n:view>", ctx);
        assertEquals("a > b", ctx.documentTitle());
    }

    @Test
    void noViewNoChange() {
        assertEquals("<div>x</div>", new ViewPass().apply("<div>x</div>", ctx));
    }

    @Test
    void layoutBecomesMarker() {
        assertEquals("<!-- Layout: main -->x", new LayoutPass().apply("<n:layout name=\"main\">x</n:layout>", ctx));
    }

    @Test
    void slotsAndProps() {
        String out = new SlotPropsPass().apply(
                "<n:props>title: String</n:props><n:slot/><n:slot name=\"footer\"/>", ctx);
        assertEquals("<!-- slot content --><!-- slot: footer -->", out);
    }

    @Test
    void scopedStyleAttributeIsDropped() {
        assertEquals("<style>a{}</style>", new ScopedStylePass().apply("<style scoped>a{}</style>", ctx));
        assertEquals("<style media=\"print\">", new ScopedStylePass().apply("<style scoped media=\"print\">", ctx));
    }

    @Test
    void links() {
        assertEquals("<a href=\"/about\" class=\"nav\" data-prefetch=\"true\">About</a>",
                new LinkPass().apply("<n:link href=\"/about\" class=\"nav\">About</n:link>", ctx));
        assertEquals("<a href=\"/x\">X</a>",
                new LinkPass().apply("<n:link href=\"/x\" prefetch=\"false\">X</n:link>", ctx));
    }

    @Test
    void images() {
        assertEquals("<img src=\"/a.png\" alt=\"A\" loading=\"lazy\" decoding=\"async\" />",
                new ImagePass().apply("<n:image src=\"/a.png\" alt=\"A\"/>", ctx));
        assertEquals("<img src=\"/a.png\" loading=\"eager\" decoding=\"async\" />",
                new ImagePass().apply("<n:image src=\"/a.png\" loading=\"eager\"></n:image>", ctx));
    }

    @Test
    void serverOnlyMarkupDisappears() {
        assertEquals("<p>x</p>", new DataLoadingPass().apply("<n:load from=\"/api/users\" as=\"users\"/><p>x</p>", ctx));
        assertEquals("<!-- data model binding -->", new DataLoadingPass().apply("<n:model name=\"User\"/>", ctx));
        assertEquals("<p>a</p>", new ServerScriptPass().apply("<n:script>let x = 1;</n:script><p>a</p>", ctx));
        assertEquals("<script>console.log(1)</script>", new ClientOnlyPass().apply("<n:client>console.log(1)</n:client>", ctx));
    }

    @Test
    void formsPostToParentWindow() {
        String out = new FormPass().apply(
                "<n:form action=\"/api/signup\" class=\"wide\"><n:field label=\"Email\" name=\"email\" type=\"email\" required/></n:form>", ctx);

        assertTrue(out.startsWith("<form action=\"/api/signup\" class=\"nucleus-form wide\" onsubmit=\"event.preventDefault();"));
        assertTrue(out.contains("window.parent.postMessage({ type: 'form:submit', action: '/api/signup', formData }, '*');"));
        assertTrue(out.contains("<div class=\"form-group\"><label for=\"email\">Email</label>"
                + "<input type=\"email\" id=\"email\" name=\"email\" required class=\"form-input\"></div>"));
        assertTrue(out.endsWith("</form>"));
    }

    @Test
    void wizardStepsAndWrappedFields() {
        String out = new FormPass().apply(
                "<n:step id=\"one\" title=\"Account\"><n:field label=\"Bio\"><textarea></textarea></n:field></n:step>", ctx);
        assertEquals("<fieldset class=\"wizard-step\" data-step=\"one\"><legend>Account</legend>"
                + "<div class=\"form-group\"><label>Bio</label><textarea></textarea></div></fieldset>", out);
    }
}
