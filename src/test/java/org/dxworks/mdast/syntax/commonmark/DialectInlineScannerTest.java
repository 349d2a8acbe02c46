package org.dxworks.mdast.syntax.commonmark;

import org.dxworks.mdast.syntax.SyntaxTreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialectInlineScannerTest {

    @Test
    void scan_FindsEveryDialectConstruct() {
        String text = "[[Note]] #tag ==hi== [@doe, p. 4] @roe [^1]";
        List<SyntaxTreeNode> nodes = new DialectInlineScanner(text).scan(0, text.length());

        assertEquals(List.of("ZknLink", "ZknTag", "Highlight", "Citation", "Citation", "Footnote"),
                nodes.stream().map(SyntaxTreeNode::getKind).toList());

        SyntaxTreeNode link = nodes.get(0);
        assertEquals(0, link.getFrom());
        assertEquals(8, link.getTo());
        assertEquals(2, link.getChild("ZknLinkContent").getFrom());
        assertEquals(6, link.getChild("ZknLinkContent").getTo());

        SyntaxTreeNode highlight = nodes.get(2);
        assertEquals(2, highlight.getChildren("HighlightMark").size());
        assertEquals("hi", text.substring(highlight.getChild("HighlightContent").getFrom(),
                highlight.getChild("HighlightContent").getTo()));
    }

    @Test
    void scan_RespectsTheRegion() {
        String text = "#outside inside #in";
        List<SyntaxTreeNode> nodes = new DialectInlineScanner(text).scan(9, text.length());

        assertEquals(1, nodes.size());
        assertEquals(16, nodes.get(0).getFrom());
    }

    @Test
    void scan_IgnoresLookalikes() {
        String text = "issue #12, mail a@b.org, a#b, ==  ==, [^1]: def";
        List<SyntaxTreeNode> nodes = new DialectInlineScanner(text).scan(0, text.length());

        assertTrue(nodes.isEmpty(), () -> nodes.toString());
    }

    @Test
    void scan_EmptyRegion() {
        assertTrue(new DialectInlineScanner("abc").scan(2, 2).isEmpty());
    }
}
