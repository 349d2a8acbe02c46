package org.dxworks.mdast.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable in-memory syntax node. Used by the commonmark tree builder, and handy for building
 * trees by hand:
 *
 * <pre>{@code
 * SyntaxTreeNode tree = node("Paragraph", 0, 9,
 *         node("Emphasis", 0, 5, node("EmphasisMark", 0, 1), node("EmphasisMark", 4, 5)));
 * }</pre>
 *
 * A node links itself to its children when constructed, so every node belongs to at most one
 * parent.
 */
public final class SyntaxTreeNode implements SyntaxNode {

    private final String kind;
    private final int from;
    private final int to;
    private final List<SyntaxTreeNode> children;
    private SyntaxTreeNode parent;
    private int index;

    public SyntaxTreeNode(String kind, int from, int to, List<SyntaxTreeNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ") for " + kind);
        }
        this.from = from;
        this.to = to;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        for (int i = 0; i < this.children.size(); i++) {
            SyntaxTreeNode child = this.children.get(i);
            if (child.parent != null) {
                throw new IllegalArgumentException("Node " + child + " already has a parent");
            }
            child.parent = this;
            child.index = i;
        }
    }

    public static SyntaxTreeNode node(String kind, int from, int to, SyntaxTreeNode... children) {
        return new SyntaxTreeNode(kind, from, to, List.of(children));
    }

    public static SyntaxTreeNode node(NodeKind kind, int from, int to, SyntaxTreeNode... children) {
        return node(kind.getName(), from, to, children);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public int getFrom() {
        return from;
    }

    @Override
    public int getTo() {
        return to;
    }

    @Override
    public SyntaxTreeNode getFirstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public SyntaxTreeNode getNextSibling() {
        if (parent == null || index + 1 >= parent.children.size()) {
            return null;
        }
        return parent.children.get(index + 1);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public SyntaxTreeNode getParent() {
        return parent;
    }

    @Override
    public String toString() {
        return kind + "[" + from + ", " + to + ")";
    }
}
