package org.dxworks.mdast.syntax;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exposes a tree-sitter parse tree as a {@link SyntaxNode}. Only named nodes are visited;
 * anonymous tokens end up in the gaps between children and are materialized as text by the
 * converter.
 *
 * <p>Tree-sitter reports UTF-8 byte offsets. They are translated to {@code String} indices of
 * the source the tree was parsed from, so the adapter must be created with that same source.
 */
public final class TreeSitterSyntaxNode implements SyntaxNode {

    private final TSNode node;
    private final ByteOffsets offsets;
    private final TreeSitterSyntaxNode parent;
    private final int index;
    private volatile List<TreeSitterSyntaxNode> children;

    private TreeSitterSyntaxNode(TSNode node, ByteOffsets offsets, TreeSitterSyntaxNode parent, int index) {
        this.node = node;
        this.offsets = offsets;
        this.parent = parent;
        this.index = index;
    }

    public static TreeSitterSyntaxNode root(TSNode rootNode, String source) {
        if (rootNode == null || rootNode.isNull()) {
            throw new IllegalArgumentException("Tree-sitter root node is null");
        }
        return new TreeSitterSyntaxNode(rootNode, ByteOffsets.of(source), null, 0);
    }

    @Override
    public String getKind() {
        return node.getType();
    }

    @Override
    public int getFrom() {
        return offsets.toCharIndex(node.getStartByte());
    }

    @Override
    public int getTo() {
        return offsets.toCharIndex(node.getEndByte());
    }

    @Override
    public SyntaxNode getFirstChild() {
        List<TreeSitterSyntaxNode> list = children();
        return list.isEmpty() ? null : list.get(0);
    }

    @Override
    public SyntaxNode getNextSibling() {
        if (parent == null) return null;
        List<TreeSitterSyntaxNode> siblings = parent.children();
        return index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children());
    }

    // Wrapped lazily; concurrent callers may wrap twice and publish equivalent lists
    private List<TreeSitterSyntaxNode> children() {
        List<TreeSitterSyntaxNode> current = children;
        if (current == null) {
            current = new ArrayList<>();
            int count = node.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = node.getNamedChild(i);
                if (child != null && !child.isNull()) {
                    current.add(new TreeSitterSyntaxNode(child, offsets, this, current.size()));
                }
            }
            current = List.copyOf(current);
            children = current;
        }
        return current;
    }

    @Override
    public String toString() {
        return getKind() + "[" + getFrom() + ", " + getTo() + ")";
    }
}
