package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class TableRow extends AstNode {

    public final boolean isHeaderOrFooter;
    public final List<TableCell> cells;

    public TableRow(String kind, int from, int to, Map<String, String> attributes,
                    boolean isHeaderOrFooter, List<TableCell> cells) {
        super(AstNodeType.TABLE_ROW, kind, from, to, attributes);
        this.isHeaderOrFooter = isHeaderOrFooter;
        this.cells = immutable(cells);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableRow other)) return false;
        return sameBase(other) && isHeaderOrFooter == other.isHeaderOrFooter && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), isHeaderOrFooter, cells);
    }
}
