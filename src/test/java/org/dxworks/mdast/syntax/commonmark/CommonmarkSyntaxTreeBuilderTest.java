package org.dxworks.mdast.syntax.commonmark;

import org.dxworks.mdast.MarkdownAst;
import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.model.AstNodeType;
import org.dxworks.mdast.model.Citation;
import org.dxworks.mdast.model.FencedCode;
import org.dxworks.mdast.model.Footnote;
import org.dxworks.mdast.model.FootnoteRef;
import org.dxworks.mdast.model.Generic;
import org.dxworks.mdast.model.Heading;
import org.dxworks.mdast.model.Highlight;
import org.dxworks.mdast.model.InlineCode;
import org.dxworks.mdast.model.LinkOrImage;
import org.dxworks.mdast.model.ListBlock;
import org.dxworks.mdast.model.Table;
import org.dxworks.mdast.model.Text;
import org.dxworks.mdast.model.YamlFrontmatter;
import org.dxworks.mdast.model.ZettelkastenLink;
import org.dxworks.mdast.model.ZettelkastenTag;
import org.dxworks.mdast.syntax.SyntaxNode;
import org.dxworks.mdast.syntax.SyntaxNodes;
import org.dxworks.mdast.syntax.SyntaxTreeNode;
import org.dxworks.mdast.walker.AstQueries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommonmarkSyntaxTreeBuilderTest {

    private final CommonmarkSyntaxTreeBuilder builder = new CommonmarkSyntaxTreeBuilder();
    private final MarkdownAst markdownAst = new MarkdownAst();

    @Test
    void parse_DocumentSpansWholeSource() {
        String src = "# Title\n\nSome text.\n";
        SyntaxTreeNode tree = builder.parse(src);

        assertEquals("Document", tree.getKind());
        assertEquals(0, tree.getFrom());
        assertEquals(src.length(), tree.getTo());
        assertEquals(List.of("ATXHeading1", "Paragraph"),
                tree.getChildren().stream().map(SyntaxNode::getKind).toList());
    }

    @Test
    void parse_EmptySource() {
        SyntaxTreeNode tree = builder.parse("");
        assertEquals(0, tree.getTo());
        assertNull(tree.getFirstChild());
    }

    @Test
    void parse_AtxHeadingWithMarksAndEmphasis() {
        String src = "## Hello *world*";
        SyntaxNode heading = builder.parse(src).getFirstChild();

        assertEquals("ATXHeading2", heading.getKind());
        assertEquals("##", SyntaxNodes.text(src, heading.getChild("HeaderMark")));
        SyntaxNode emphasis = heading.getChild("Emphasis");
        assertEquals("*world*", SyntaxNodes.text(src, emphasis));
        assertEquals(2, emphasis.getChildren("EmphasisMark").size());

        Heading ast = (Heading) ((Generic) markdownAst.parse(src)).children.get(0);
        assertEquals(2, ast.level);
        assertEquals("Hello *world*", ast.value.value);
    }

    @Test
    void parse_HeadingAttributes() {
        Heading heading = first(markdownAst.parse("# Title {#intro .wide}\n"), AstNodeType.HEADING);

        assertEquals("Title {#intro .wide}", heading.value.value);
        assertEquals("intro", heading.attributes.get("id"));
        assertEquals("wide", heading.attributes.get("class"));
    }

    @Test
    void parse_SetextHeadings() {
        String src = "Title\n=====\n\nSub\n---\n";
        List<Heading> headings = AstQueries.extractNodes(markdownAst.parse(src), AstNodeType.HEADING);

        assertEquals(2, headings.size());
        assertEquals(1, headings.get(0).level);
        assertEquals("Title", headings.get(0).value.value);
        assertEquals(2, headings.get(1).level);
        assertEquals("Sub", headings.get(1).value.value);
    }

    @Test
    void parse_DialectInlinesInParagraph() {
        String src = "See [[Some Note]] and #idea, ==this== and [@doe2020, p. 4][^1].\n";
        AstNode ast = markdownAst.parse(src);

        ZettelkastenLink link = first(ast, AstNodeType.ZETTELKASTEN_LINK);
        assertEquals("Some Note", link.value.value);
        ZettelkastenTag tag = first(ast, AstNodeType.ZETTELKASTEN_TAG);
        assertEquals("#idea", tag.value.value);
        Highlight highlight = first(ast, AstNodeType.HIGHLIGHT);
        assertEquals("this", ((Text) highlight.children.get(0)).value);
        Citation citation = first(ast, AstNodeType.CITATION);
        assertEquals("doe2020", citation.parsedCitation.citations.get(0).id);
        Footnote footnote = first(ast, AstNodeType.FOOTNOTE);
        assertEquals("1", footnote.label);
    }

    @Test
    void parse_InlineCodeHidesDialectSyntax() {
        AstNode ast = markdownAst.parse("Use `a==b #no` here\n");

        InlineCode code = first(ast, AstNodeType.INLINE_CODE);
        assertEquals("a==b #no", code.source);
        assertTrue(AstQueries.extractNodes(ast, AstNodeType.HIGHLIGHT).isEmpty());
        assertTrue(AstQueries.extractNodes(ast, AstNodeType.ZETTELKASTEN_TAG).isEmpty());
    }

    @Test
    void parse_LinkWithTitleAndAttributes() {
        String src = "[Zettlr](https://zettlr.com \"Home\"){.big}\n";
        SyntaxNode linkNode = builder.parse(src).getFirstChild().getFirstChild();

        assertEquals("Link", linkNode.getKind());
        assertEquals("https://zettlr.com", SyntaxNodes.text(src, linkNode.getChild("URL")));
        assertEquals("\"Home\"", SyntaxNodes.text(src, linkNode.getChild("LinkTitle")));
        assertEquals("{.big}", SyntaxNodes.text(src, linkNode.getChild("PandocAttribute")));

        LinkOrImage link = first(markdownAst.parse(src), AstNodeType.LINK);
        assertEquals("Zettlr", link.alt.value);
        assertEquals("https://zettlr.com", link.url.value);
        assertEquals("big", link.attributes.get("class"));
    }

    @Test
    void parse_ImageAndAutolink() {
        AstNode ast = markdownAst.parse("![A cat](cat.png) and <https://example.org>\n");

        LinkOrImage image = first(ast, AstNodeType.IMAGE);
        assertEquals("A cat", image.alt.value);
        assertEquals("cat.png", image.url.value);
        LinkOrImage autolink = first(ast, AstNodeType.LINK);
        assertEquals("https://example.org", autolink.url.value);
    }

    @Test
    void parse_TaskList() {
        ListBlock list = first(markdownAst.parse("- [x] done\n- [ ] open\n- plain\n"), AstNodeType.LIST);

        assertFalse(list.ordered);
        assertEquals(3, list.items.size());
        assertEquals(Boolean.TRUE, list.items.get(0).checked);
        assertEquals(Boolean.FALSE, list.items.get(1).checked);
        assertNull(list.items.get(2).checked);
        assertEquals("-", list.items.get(0).marker.symbol);
        assertEquals(0, list.items.get(0).marker.from);
    }

    @Test
    void parse_OrderedList() {
        String src = "1. one\n2. two\n";
        ListBlock list = first(markdownAst.parse(src), AstNodeType.LIST);

        assertTrue(list.ordered);
        assertEquals(2, list.items.size());
        assertNull(list.items.get(1).marker.symbol);
        assertEquals("2.", src.substring(list.items.get(1).marker.from, list.items.get(1).marker.to));
    }

    @Test
    void parse_FencedAndIndentedCode() {
        AstNode ast = markdownAst.parse("```python\nprint(1)\nprint(2)\n```\n\n    indented\n");
        List<FencedCode> blocks = AstQueries.extractNodes(ast, AstNodeType.FENCED_CODE);

        assertEquals(2, blocks.size());
        assertEquals("python", blocks.get(0).info);
        assertEquals("print(1)\nprint(2)", blocks.get(0).source);
        assertEquals("", blocks.get(1).info);
        assertTrue(blocks.get(1).source.contains("indented"));
    }

    @Test
    void parse_Frontmatter() {
        String src = "---\ntitle: Notes\nauthor: Me\n---\n\nBody\n";
        AstNode ast = markdownAst.parse(src);

        YamlFrontmatter frontmatter = first(ast, AstNodeType.YAML_FRONTMATTER);
        assertEquals("title: Notes\nauthor: Me", frontmatter.source);
        assertEquals(0, frontmatter.from);
        assertTrue(AstQueries.toPlainText(ast).contains("Body"));
    }

    @Test
    void parse_Table() {
        String src = "| a | b |\n|---|---|\n| c | d |\n";
        Table table = first(markdownAst.parse(src), AstNodeType.TABLE);

        assertEquals(2, table.rows.size());
        assertTrue(table.rows.get(0).isHeaderOrFooter);
        assertFalse(table.rows.get(1).isHeaderOrFooter);
        assertEquals(2, table.rows.get(0).cells.size());
        assertEquals("a", AstQueries.toPlainText(table.rows.get(0).cells.get(0)));
        assertEquals("b", AstQueries.toPlainText(table.rows.get(0).cells.get(1)));
        assertEquals("d", AstQueries.toPlainText(table.rows.get(1).cells.get(1)));
    }

    @Test
    void parse_FootnoteDefinition() {
        AstNode ast = markdownAst.parse("Text[^1].\n\n[^1]: The actual note.\n");

        Footnote footnote = first(ast, AstNodeType.FOOTNOTE);
        assertEquals("1", footnote.label);
        FootnoteRef ref = first(ast, AstNodeType.FOOTNOTE_REF);
        assertEquals("1", ref.label);
        assertEquals("The actual note.", AstQueries.toPlainText(ref));
    }

    @Test
    void parse_Blockquote() {
        String src = "> quoted *text*\n";
        SyntaxNode quote = builder.parse(src).getFirstChild();

        assertEquals("Blockquote", quote.getKind());
        assertEquals(0, quote.getChild("QuoteMark").getFrom());
        assertNotNull(quote.getChild("Paragraph"));
    }

    @Test
    void parse_MultiLineBlockquote_MarksAreNotText() {
        String src = "> first line\n> second line";
        AstNode ast = markdownAst.parse(src);

        List<Text> texts = AstQueries.extractTextNodes(ast);
        assertTrue(texts.stream().noneMatch(text -> text.value.contains(">")), () -> texts.toString());
        assertEquals(" first line\n second line", AstQueries.toPlainText(ast));
        long marks = AstQueries.<Generic>extractNodes(ast, AstNodeType.GENERIC).stream()
                .filter(node -> node.kind.equals("QuoteMark"))
                .count();
        assertEquals(2, marks);
    }

    @Test
    void parse_NestedBlockquote_EveryMarkIsDropped() {
        String src = "> outer\n>\n> > inner one\n> > inner two\n";
        AstNode ast = markdownAst.parse(src);

        assertFalse(AstQueries.toPlainText(ast).contains(">"), AstQueries.toPlainText(ast));
        assertTrue(AstQueries.toPlainText(ast).contains("inner two"));
    }

    @Test
    void parse_HighlightAroundEmphasis() {
        String src = "Some ==high *em*== text";
        AstNode ast = markdownAst.parse(src);

        List<Highlight> highlights = AstQueries.extractNodes(ast, AstNodeType.HIGHLIGHT);
        assertEquals(1, highlights.size());
        assertEquals(5, highlights.get(0).from);
        assertEquals(18, highlights.get(0).to);
        assertEquals(List.of(AstNodeType.TEXT, AstNodeType.EMPHASIS),
                highlights.get(0).children.stream().map(node -> node.type).toList());
        assertEquals("Some high em text", AstQueries.toPlainText(ast));
    }

    @Test
    void parse_HighlightAroundInlineCodeAndLink() {
        String src = "==see `x` at [a](b)== and ==plain==";
        List<Highlight> highlights = AstQueries.extractNodes(markdownAst.parse(src), AstNodeType.HIGHLIGHT);

        assertEquals(2, highlights.size());
        assertNotNull(first(highlights.get(0), AstNodeType.INLINE_CODE));
        assertNotNull(first(highlights.get(0), AstNodeType.LINK));
        assertEquals(26, highlights.get(1).from);
    }

    @Test
    void parse_HighlightMarksInsideCodeAreIgnored() {
        String src = "`a ==b== c`";
        assertTrue(AstQueries.extractNodes(markdownAst.parse(src), AstNodeType.HIGHLIGHT).isEmpty());
    }

    @Test
    void parse_MathBlock() {
        String src = "Before\n\n$$\nx^2 + y^2\n$$\n";
        SyntaxNode math = builder.parse(src).getFirstChild().getNextSibling();

        assertEquals("FencedCode", math.getKind());
        assertEquals(2, math.getChildren("CodeMark").size());

        FencedCode code = first(markdownAst.parse(src), AstNodeType.FENCED_CODE);
        assertEquals("$$", code.info);
        assertEquals("x^2 + y^2", code.source);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "> first line\n> second line\n>\n> > nested\n> > quote\n",
            "- one\n- two\n  continued\n\n1. first\n2. second\n",
            "| a | b |\n| --- | --- |\n| c | d |\n",
            "See [site](https://x.org){.ext} and ![img](a.png) here.\n",
            "Some ==high *em*== and **bold** text\n> with a quote\n"
    })
    void parse_TextLeavesAreVerbatimDisjointAndFreeOfMarks(String src) {
        List<Text> texts = AstQueries.extractTextNodes(markdownAst.parse(src));

        int end = 0;
        for (Text text : texts) {
            assertEquals(src.substring(text.from, text.to), text.value);
            assertTrue(text.from >= end, () -> "overlapping text " + text + " in " + texts);
            end = text.to;
            for (String mark : List.of(">", "|", "---", "- ", "1.", "{", "](", "==", "**")) {
                assertFalse(text.value.contains(mark), () -> "mark " + mark + " left in " + text);
            }
        }
    }

    @Test
    void parse_SiblingsNeverOverlapAndStayInsideParent() {
        String src = "---\ntitle: x\n---\n\n# H {#h}\n\n> - [ ] a [[b]] #c\n>   - 1. d\n\n"
                + "| x | y |\n|---|---|\n| [l](u) | `c` |\n\n"
                + "Para with **bold _nested_** and ~~gone~~ ==hl== [@k] [^n].\n\n[^n]: note\n\n"
                + "```\ncode\n```\n\n***\n\n<div>html</div>\n";
        assertWellFormed(builder.parse(src), src);
    }

    private static void assertWellFormed(SyntaxNode node, String src) {
        assertTrue(node.getFrom() >= 0 && node.getFrom() <= node.getTo() && node.getTo() <= src.length(),
                () -> "bad range " + node);
        int end = node.getFrom();
        for (SyntaxNode child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            SyntaxNode current = child;
            int previousEnd = end;
            assertTrue(current.getFrom() >= previousEnd, () -> "overlap at " + current + " in\n" + SyntaxNodes.outline(node));
            assertTrue(current.getTo() <= node.getTo(), () -> "outside parent " + current + " in " + node);
            assertWellFormed(current, src);
            end = current.getTo();
        }
    }

    private static <T extends AstNode> T first(AstNode ast, AstNodeType type) {
        List<T> nodes = AstQueries.extractNodes(ast, type);
        assertFalse(nodes.isEmpty(), () -> "no " + type + " in the AST");
        return nodes.get(0);
    }
}
