package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ListItem extends AstNode {

    /** Only set for task items: whether the checkbox is ticked. */
    public final Boolean checked;
    public final ListMarker marker;
    public final List<AstNode> children; // may contain nested ListBlock nodes

    public ListItem(String kind, int from, int to, Map<String, String> attributes,
                    Boolean checked, ListMarker marker, List<AstNode> children) {
        super(AstNodeType.LIST_ITEM, kind, from, to, attributes);
        this.checked = checked;
        this.marker = Objects.requireNonNull(marker, "marker");
        this.children = immutable(children);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListItem other)) return false;
        return sameBase(other) && Objects.equals(checked, other.checked)
                && marker.equals(other.marker) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), checked, marker, children);
    }
}
