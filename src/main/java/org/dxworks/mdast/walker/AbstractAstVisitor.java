package org.dxworks.mdast.walker;

import org.dxworks.mdast.model.AstNode;
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

import java.util.List;

/**
 * Visitor that walks the whole tree in document order. Override the methods you care about
 * and call {@code super.visit(...)} to keep descending.
 *
 * <p>The {@link Text} fields of headings, citations, links and Zettelkasten nodes are visited
 * as if they were children. For links and images only the alt text is visited, never the URL.
 */
public abstract class AbstractAstVisitor implements AstVisitor {

    @Override
    public void visit(Text text) {
    }

    @Override
    public void visit(Heading heading) {
        heading.value.accept(this);
    }

    @Override
    public void visit(Citation citation) {
        citation.value.accept(this);
    }

    @Override
    public void visit(Footnote footnote) {
    }

    @Override
    public void visit(FootnoteRef footnoteRef) {
        visitChildren(footnoteRef.children);
    }

    @Override
    public void visit(LinkOrImage linkOrImage) {
        linkOrImage.alt.accept(this);
    }

    @Override
    public void visit(Highlight highlight) {
        visitChildren(highlight.children);
    }

    @Override
    public void visit(Emphasis emphasis) {
        visitChildren(emphasis.children);
    }

    @Override
    public void visit(ListBlock list) {
        visitChildren(list.items);
    }

    @Override
    public void visit(ListItem listItem) {
        visitChildren(listItem.children);
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
        visitChildren(table.rows);
    }

    @Override
    public void visit(TableRow tableRow) {
        visitChildren(tableRow.cells);
    }

    @Override
    public void visit(TableCell tableCell) {
        visitChildren(tableCell.children);
    }

    @Override
    public void visit(ZettelkastenLink link) {
        link.value.accept(this);
    }

    @Override
    public void visit(ZettelkastenTag tag) {
        tag.value.accept(this);
    }

    @Override
    public void visit(Generic generic) {
        visitChildren(generic.children);
    }

    protected void visitChildren(List<? extends AstNode> children) {
        for (AstNode child : children) {
            child.accept(this);
        }
    }
}
