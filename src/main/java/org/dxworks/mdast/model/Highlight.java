package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Highlighted text, {@code ==like this==}.
 */
public final class Highlight extends AstNode {

    public final List<AstNode> children;

    public Highlight(String kind, int from, int to, Map<String, String> attributes, List<AstNode> children) {
        super(AstNodeType.HIGHLIGHT, kind, from, to, attributes);
        this.children = immutable(children);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Highlight other)) return false;
        return sameBase(other) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), children);
    }
}
