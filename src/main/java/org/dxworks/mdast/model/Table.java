package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Table extends AstNode {

    public final List<TableRow> rows; // header rows first

    public Table(String kind, int from, int to, Map<String, String> attributes, List<TableRow> rows) {
        super(AstNodeType.TABLE, kind, from, to, attributes);
        this.rows = immutable(rows);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        return sameBase(other) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), rows);
    }
}
