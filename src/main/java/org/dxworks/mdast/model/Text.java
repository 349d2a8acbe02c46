package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Objects;

/**
 * Verbatim run of source text. Every range of the source that no other node claims ends up
 * in one of these.
 */
public final class Text extends AstNode {

    /**
     * Kind of every text node. Text is synthesized for the ranges between syntax nodes, so its
     * kind is not the name of a syntax node.
     */
    public static final String KIND = "text";

    public final String value;

    public Text(int from, int to, String value) {
        super(AstNodeType.TEXT, KIND, from, to, null);
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Text other)) return false;
        return sameBase(other) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * baseHash() + value.hashCode();
    }

    @Override
    public String toString() {
        return super.toString() + " \"" + value + "\"";
    }
}
