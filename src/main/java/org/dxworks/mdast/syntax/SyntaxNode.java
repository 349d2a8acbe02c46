package org.dxworks.mdast.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of a concrete syntax tree: a kind name, a half-open range {@code [from, to)} of
 * offsets into the source text, and navigation to children and siblings.
 *
 * <p>Offsets must use the same unit as the {@code String} the tree is converted against. Trees
 * whose producer counts bytes are translated before they reach the converter
 * (see {@link TreeSitterSyntaxNode}).
 */
public interface SyntaxNode {

    String getKind();

    int getFrom();

    int getTo();

    /** First direct child, or {@code null} for a leaf. */
    SyntaxNode getFirstChild();

    /** Next node with the same parent, or {@code null} for the last child. */
    SyntaxNode getNextSibling();

    default List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        for (SyntaxNode child = getFirstChild(); child != null; child = child.getNextSibling()) {
            children.add(child);
        }
        return children;
    }

    /** First direct child of the given kind, or {@code null}. */
    default SyntaxNode getChild(String kind) {
        for (SyntaxNode child = getFirstChild(); child != null; child = child.getNextSibling()) {
            if (kind.equals(child.getKind())) {
                return child;
            }
        }
        return null;
    }

    /** All direct children of the given kind, in document order. */
    default List<SyntaxNode> getChildren(String kind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child = getFirstChild(); child != null; child = child.getNextSibling()) {
            if (kind.equals(child.getKind())) {
                result.add(child);
            }
        }
        return result;
    }
}
