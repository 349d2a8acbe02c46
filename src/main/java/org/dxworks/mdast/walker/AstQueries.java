package org.dxworks.mdast.walker;

import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.model.AstNodeType;
import org.dxworks.mdast.model.Citation;
import org.dxworks.mdast.model.Emphasis;
import org.dxworks.mdast.model.FencedCode;
import org.dxworks.mdast.model.Footnote;
import org.dxworks.mdast.model.FootnoteRef;
import org.dxworks.mdast.model.Generic;
import org.dxworks.mdast.model.Heading;
import org.dxworks.mdast.model.Highlight;
import org.dxworks.mdast.model.InlineCode;
import org.dxworks.mdast.model.LinkOrImage;
import org.dxworks.mdast.model.ListBlock;
import org.dxworks.mdast.model.ListItem;
import org.dxworks.mdast.model.Table;
import org.dxworks.mdast.model.TableCell;
import org.dxworks.mdast.model.TableRow;
import org.dxworks.mdast.model.Text;
import org.dxworks.mdast.model.YamlFrontmatter;
import org.dxworks.mdast.model.ZettelkastenLink;
import org.dxworks.mdast.model.ZettelkastenTag;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only queries over a converted AST, used by spellchecking, readability scoring and the
 * plain-text output of the command line tool.
 */
public final class AstQueries {

    private AstQueries() {
    }

    /**
     * Collects the prose of a document in document order. Code, front matter, footnote markers
     * and link targets carry no prose and are skipped.
     */
    public static List<Text> extractTextNodes(AstNode ast) {
        return extractTextNodes(ast, node -> true);
    }

    /**
     * Like {@link #extractTextNodes(AstNode)}, but does not descend into nodes rejected by
     * {@code filter}. A rejected {@link Text} node is dropped.
     */
    public static List<Text> extractTextNodes(AstNode ast, Predicate<AstNode> filter) {
        List<Text> result = new ArrayList<>();
        ast.accept(new FilteringVisitor(filter) {
            @Override
            public void visit(Text text) {
                if (accepts(text)) {
                    result.add(text);
                }
            }
        });
        return result;
    }

    /**
     * Returns every node of the given type in document order, the root included. Nodes nested
     * inside a match are returned as well.
     */
    @SuppressWarnings("unchecked")
    public static <T extends AstNode> List<T> extractNodes(AstNode ast, AstNodeType type) {
        List<AstNode> result = new ArrayList<>();
        collect(ast, type, result);
        return (List<T>) (List<?>) result;
    }

    /**
     * Joins all prose text nodes. Blocks are not separated, their own whitespace is kept.
     */
    public static String toPlainText(AstNode ast) {
        StringBuilder text = new StringBuilder();
        for (Text node : extractTextNodes(ast)) {
            text.append(node.value);
        }
        return text.toString();
    }

    private static void collect(AstNode node, AstNodeType type, List<AstNode> result) {
        if (node.type == type) {
            result.add(node);
        }
        for (AstNode child : directChildren(node)) {
            collect(child, type, result);
        }
    }

    /**
     * The structural children of a node: list items, table rows and cells included, text
     * fields such as a heading's value excluded.
     */
    public static List<? extends AstNode> directChildren(AstNode node) {
        return switch (node.type) {
            case FOOTNOTE_REF -> ((FootnoteRef) node).children;
            case HIGHLIGHT -> ((Highlight) node).children;
            case EMPHASIS -> ((Emphasis) node).children;
            case LIST -> ((ListBlock) node).items;
            case LIST_ITEM -> ((ListItem) node).children;
            case TABLE -> ((Table) node).rows;
            case TABLE_ROW -> ((TableRow) node).cells;
            case TABLE_CELL -> ((TableCell) node).children;
            case GENERIC -> ((Generic) node).children;
            case TEXT, HEADING, CITATION, FOOTNOTE, LINK, IMAGE, FENCED_CODE, YAML_FRONTMATTER,
                    INLINE_CODE, ZETTELKASTEN_LINK, ZETTELKASTEN_TAG -> List.of();
        };
    }

    /**
     * Descends like {@link AbstractAstVisitor} but stops at nodes the filter rejects.
     */
    private abstract static class FilteringVisitor extends AbstractAstVisitor {
        private final Predicate<AstNode> filter;

        FilteringVisitor(Predicate<AstNode> filter) {
            this.filter = filter;
        }

        boolean accepts(AstNode node) {
            return filter.test(node);
        }

        @Override
        public void visit(Heading heading) {
            if (accepts(heading)) super.visit(heading);
        }

        @Override
        public void visit(Citation citation) {
            if (accepts(citation)) super.visit(citation);
        }

        @Override
        public void visit(Footnote footnote) {
        }

        @Override
        public void visit(FootnoteRef footnoteRef) {
            if (accepts(footnoteRef)) super.visit(footnoteRef);
        }

        @Override
        public void visit(LinkOrImage linkOrImage) {
            if (accepts(linkOrImage)) super.visit(linkOrImage);
        }

        @Override
        public void visit(Highlight highlight) {
            if (accepts(highlight)) super.visit(highlight);
        }

        @Override
        public void visit(Emphasis emphasis) {
            if (accepts(emphasis)) super.visit(emphasis);
        }

        @Override
        public void visit(ListBlock list) {
            if (accepts(list)) super.visit(list);
        }

        @Override
        public void visit(ListItem listItem) {
            if (accepts(listItem)) super.visit(listItem);
        }

        @Override
        public void visit(FencedCode fencedCode) {
        }

        @Override
        public void visit(YamlFrontmatter frontmatter) {
        }

        @Override
        public void visit(InlineCode inlineCode) {
        }

        @Override
        public void visit(Table table) {
            if (accepts(table)) super.visit(table);
        }

        @Override
        public void visit(TableRow tableRow) {
            if (accepts(tableRow)) super.visit(tableRow);
        }

        @Override
        public void visit(TableCell tableCell) {
            if (accepts(tableCell)) super.visit(tableCell);
        }

        @Override
        public void visit(ZettelkastenLink link) {
            if (accepts(link)) super.visit(link);
        }

        @Override
        public void visit(ZettelkastenTag tag) {
            if (accepts(tag)) super.visit(tag);
        }

        @Override
        public void visit(Generic generic) {
            if (accepts(generic)) super.visit(generic);
        }
    }
}
