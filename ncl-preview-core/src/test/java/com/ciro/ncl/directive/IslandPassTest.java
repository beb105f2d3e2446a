package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.CompileOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IslandPassTest {

    private static CompileContext ctx(Map<String, String> islands) {
        return new CompileContext(CompileOptions.defaults(), islands);
    }

    @Test
    void inlineIslandIsWrappedWithItsRuntime() {
        String out = new InlineIslandPass().apply(
                "<n:island client:visible><n:script>let n = signal(2);</n:script><p>{n}</p></n:island>", ctx(Map.of()));

        assertTrue(out.startsWith("<div data-island=\"inline\" data-hydrate=\"visible\">"));
        assertTrue(out.contains("state.n = 2;"));
        assertTrue(out.contains("IntersectionObserver"));
        assertTrue(out.endsWith("</div>"));
    }

    @Test
    void inlinePassLeavesSourcedIslandsAlone() {
        String src = "<n:island src=\"A\"></n:island>";
        assertEquals(src, new InlineIslandPass().apply(src, ctx(Map.of())));
    }

    @Test
    void missingExternalIslandBecomesPlaceholder() {
        ExternalIslandPass pass = new ExternalIslandPass();
        assertEquals("<div data-island=\"widgets/Chart\" data-hydrate=\"idle\"><!-- Island: widgets/Chart (hydrate: idle) --></div>",
                pass.apply("<n:island src=\"widgets/Chart\" client:idle />", ctx(Map.of())));
        assertEquals("<div data-island=\"X\"><!-- Island: X --></div>",
                pass.apply("<n:island src=\"X\"></n:island>", ctx(Map.of())));
    }

    @Test
    void externalLookupTriesExtensionsAndSynthesisesCounter() {
        String out = new ExternalIslandPass().apply("<n:island src=\"widgets/Chart\"/>",
                ctx(Map.of("widgets/Chart.rs", "<div>static</div>")));

        assertTrue(out.startsWith("<div data-island=\"widgets-Chart\" data-hydrate=\"load\">"));
        assertTrue(out.contains("state.count = 0;"));
    }

    @Test
    void externalIslandKeepsDeclaredSignals() {
        String out = new ExternalIslandPass().apply("<n:island src=\"Counter\" client:load/>",
                ctx(Map.of("Counter.ncl", "let count = Signal::new(3);\n<div>{count}</div>")));
        assertTrue(out.contains("state.count = 3;"));
    }
}
