package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered (enumerated) or bullet (itemized) list.
 */
public final class ListBlock extends AstNode {

    public final boolean ordered;
    public final List<ListItem> items;

    public ListBlock(String kind, int from, int to, Map<String, String> attributes,
                     boolean ordered, List<ListItem> items) {
        super(AstNodeType.LIST, kind, from, to, attributes);
        this.ordered = ordered;
        this.items = immutable(items);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListBlock other)) return false;
        return sameBase(other) && ordered == other.ordered && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), ordered, items);
    }
}
