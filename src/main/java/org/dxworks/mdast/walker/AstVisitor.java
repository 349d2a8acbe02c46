package org.dxworks.mdast.walker;

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

/**
 * Visitor over every AST variant. Adding a variant breaks every implementation, which is the
 * point: consumers have to decide what to do with it.
 */
public interface AstVisitor {

    void visit(Text text);

    void visit(Heading heading);

    void visit(Citation citation);

    void visit(Footnote footnote);

    void visit(FootnoteRef footnoteRef);

    void visit(LinkOrImage linkOrImage);

    void visit(Highlight highlight);

    void visit(Emphasis emphasis);

    void visit(ListBlock list);

    void visit(ListItem listItem);

    void visit(FencedCode fencedCode);

    void visit(YamlFrontmatter frontmatter);

    void visit(InlineCode inlineCode);

    void visit(Table table);

    void visit(TableRow tableRow);

    void visit(TableCell tableCell);

    void visit(ZettelkastenLink link);

    void visit(ZettelkastenTag tag);

    void visit(Generic generic);
}
