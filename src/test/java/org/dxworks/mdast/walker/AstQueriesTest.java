package org.dxworks.mdast.walker;

import org.dxworks.mdast.converter.MarkdownAstConverter;
import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.model.AstNodeType;
import org.dxworks.mdast.model.Heading;
import org.dxworks.mdast.model.Text;
import org.dxworks.mdast.model.ZettelkastenTag;
import org.dxworks.mdast.syntax.SyntaxTreeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.mdast.syntax.SyntaxTreeNode.node;
import static org.junit.jupiter.api.Assertions.*;

class AstQueriesTest {

    // "# Notes\n\nSee [site](http://a.b) #todo\n\n```js\nx\n```"
    private static final String SOURCE = "# Notes\n\nSee [site](http://a.b) #todo\n\n```js\nx\n```";

    private AstNode ast;

    @BeforeEach
    void setUp() {
        SyntaxTreeNode tree = node("Document", 0, 50,
                node("ATXHeading1", 0, 7, node("HeaderMark", 0, 1)),
                node("Paragraph", 9, 37,
                        node("Link", 13, 31,
                                node("LinkMark", 13, 14),
                                node("LinkMark", 18, 19),
                                node("LinkMark", 19, 20),
                                node("URL", 20, 30),
                                node("LinkMark", 30, 31)),
                        node("ZknTag", 32, 37)),
                node("FencedCode", 39, 50,
                        node("CodeMark", 39, 42),
                        node("CodeInfo", 42, 44),
                        node("CodeText", 45, 46),
                        node("CodeMark", 47, 50)));
        ast = new MarkdownAstConverter().convert(tree, SOURCE);
    }

    @Test
    void extractTextNodes_SkipsCodeAndUrls() {
        List<String> values = new ArrayList<>();
        for (Text text : AstQueries.extractTextNodes(ast)) {
            values.add(text.value);
        }
        assertEquals(List.of("Notes", "See ", "site", " ", "#todo"), values);
    }

    @Test
    void extractTextNodes_FilterStopsDescent() {
        List<Text> texts = AstQueries.extractTextNodes(ast, node -> node.type != AstNodeType.HEADING);
        assertEquals("See ", texts.get(0).value);
    }

    @Test
    void extractNodes_ByType() {
        List<Heading> headings = AstQueries.extractNodes(ast, AstNodeType.HEADING);
        List<ZettelkastenTag> tags = AstQueries.extractNodes(ast, AstNodeType.ZETTELKASTEN_TAG);

        assertEquals(1, headings.size());
        assertEquals("Notes", headings.get(0).value.value);
        assertEquals("#todo", tags.get(0).value.value);
        assertEquals(1, AstQueries.extractNodes(ast, AstNodeType.FENCED_CODE).size());
        assertTrue(AstQueries.extractNodes(ast, AstNodeType.TABLE).isEmpty());
    }

    @Test
    void toPlainText_JoinsProse() {
        assertEquals("NotesSee site #todo", AstQueries.toPlainText(ast));
    }

    @Test
    void visitor_SeesEveryNodeKindOnce() {
        List<String> visited = new ArrayList<>();
        ast.accept(new AbstractAstVisitor() {
            @Override
            public void visit(Heading heading) {
                visited.add("heading");
                super.visit(heading);
            }

            @Override
            public void visit(ZettelkastenTag tag) {
                visited.add("tag");
                super.visit(tag);
            }
        });
        assertEquals(List.of("heading", "tag"), visited);
    }
}
