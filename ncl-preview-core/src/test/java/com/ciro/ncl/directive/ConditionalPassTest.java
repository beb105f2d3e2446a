package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.CompileOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionalPassTest {

    private final ConditionalPass pass = new ConditionalPass();
    private final CompileContext ctx = new CompileContext(CompileOptions.defaults(), Map.of());

    @Test
    void heuristic() {
        assertFalse(ConditionHeuristic.evaluate("count == 0"));
        assertFalse(ConditionHeuristic.evaluate("items.length === 0"));
        assertFalse(ConditionHeuristic.evaluate("todos is empty"));
        assertFalse(ConditionHeuristic.evaluate("todos.is_empty()"));
        assertFalse(ConditionHeuristic.evaluate("list.isEmpty()"));
        assertTrue(ConditionHeuristic.evaluate("!todos.is_empty()"));
        assertTrue(ConditionHeuristic.evaluate("not items is empty"));
        assertFalse(ConditionHeuristic.evaluate("!user.logged_in"));
        assertTrue(ConditionHeuristic.evaluate("user.is_admin"));
        assertTrue(ConditionHeuristic.evaluate("count != 0"));
    }

    @Test
    void tagForm() {
        assertEquals("<p>yes</p>", pass.apply("<n:if condition=\"user.is_admin\"><p>yes</p></n:if>", ctx));
        assertEquals("", pass.apply("<n:if condition=\"todos.is_empty()\"><p>none</p></n:if>", ctx));
        assertEquals("B", pass.apply("<n:if condition=\"count == 0\">A<n:else/>B</n:if>", ctx));
    }

    @Test
    void comparisonInsideQuotedConditionDoesNotCloseTheTag() {
        assertEquals("<p>shown</p>", pass.apply("<n:if condition=\"count > 0\"><p>shown</p></n:if>", ctx));
        assertEquals("", pass.apply("<n:if condition='count == 0 && a > b'><p>x</p></n:if>", ctx));
    }

    @Test
    void nestedTags() {
        String src = "<n:if condition=\"a\">1<n:if condition=\"b == 0\">2</n:if>3</n:if>";
        assertEquals("13", pass.apply(src, ctx));
    }

    @Test
    void jinjaForm() {
        assertEquals("full", pass.apply("{% if cart.is_empty() %}empty{% else %}full{% endif %}", ctx));
        assertEquals("x-y", pass.apply("{% if a %}x-{% if b %}y{% else %}z{% endif %}{% else %}w{% endif %}", ctx));
    }

    @Test
    void missingConditionStaysLiteral() {
        String src = "<n:if>body</n:if>";
        assertEquals(src, pass.apply(src, ctx));
    }
}
