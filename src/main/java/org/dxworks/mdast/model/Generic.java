package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Any syntax node without a dedicated variant. Keeps the original node name in {@code kind}
 * so that no part of the source tree is lost, even for node kinds added to the grammar later.
 */
public final class Generic extends AstNode {

    public final List<AstNode> children;

    public Generic(String kind, int from, int to, Map<String, String> attributes, List<AstNode> children) {
        super(AstNodeType.GENERIC, kind, from, to, attributes);
        this.children = immutable(children);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Generic other)) return false;
        return sameBase(other) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), children);
    }
}
