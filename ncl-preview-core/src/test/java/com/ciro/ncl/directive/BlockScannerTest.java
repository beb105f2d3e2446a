package com.ciro.ncl.directive;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class BlockScannerTest {

    private static final Pattern OPEN = Pattern.compile("<b>");
    private static final Pattern CLOSE = Pattern.compile("</b>");
    private static final Pattern SEP = Pattern.compile("\\|");

    @Test
    void rewritesOutermostBlocks() {
        String out = BlockScanner.rewrite("a<b>1<b>2</b></b>c<b>3</b>", OPEN, CLOSE, (open, body) -> "[" + body + "]");
        assertEquals("a[1<b>2</b>]c[3]", out);
    }

    @Test
    void unclosedAndRejectedOpenersStayAsText() {
        assertEquals("<b>x", BlockScanner.rewrite("<b>x", OPEN, CLOSE, (open, body) -> "!"));
        assertEquals("<b>x</b>", BlockScanner.rewrite("<b>x</b>", OPEN, CLOSE, (open, body) -> null));
    }

    @Test
    void matchingEndCountsDepth() {
        String html = "<b><b></b></b>";
        assertEquals(new BlockScanner.Span(10, 14), BlockScanner.findMatchingEnd(html, 3, OPEN, CLOSE));
        assertNull(BlockScanner.findMatchingEnd("<b><b></b>", 3, OPEN, CLOSE));
    }

    @Test
    void splitsOnlyAtTopLevel() {
        assertArrayEquals(new String[] { "a<b>|</b>", "c" },
                BlockScanner.splitAtTopLevel("a<b>|</b>|c", OPEN, CLOSE, SEP));
        assertArrayEquals(new String[] { "a", null },
                BlockScanner.splitAtTopLevel("a", OPEN, CLOSE, SEP));
    }
}
