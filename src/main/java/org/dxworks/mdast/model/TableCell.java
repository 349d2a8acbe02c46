package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class TableCell extends AstNode {

    public final List<AstNode> children;

    public TableCell(String kind, int from, int to, Map<String, String> attributes, List<AstNode> children) {
        super(AstNodeType.TABLE_CELL, kind, from, to, attributes);
        this.children = immutable(children);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableCell other)) return false;
        return sameBase(other) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), children);
    }
}
