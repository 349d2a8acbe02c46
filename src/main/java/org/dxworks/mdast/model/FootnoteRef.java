package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A footnote definition: {@code [^1]: The body}.
 */
public final class FootnoteRef extends AstNode {

    public final String label;
    public final List<AstNode> children; // the footnote body

    public FootnoteRef(String kind, int from, int to, Map<String, String> attributes,
                       String label, List<AstNode> children) {
        super(AstNodeType.FOOTNOTE_REF, kind, from, to, attributes);
        this.label = Objects.requireNonNull(label, "label");
        this.children = immutable(children);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FootnoteRef other)) return false;
        return sameBase(other) && label.equals(other.label) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), label, children);
    }
}
