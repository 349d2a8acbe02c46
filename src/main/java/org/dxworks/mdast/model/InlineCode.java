package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

public final class InlineCode extends AstNode {

    public final String source; // between the backticks, verbatim

    public InlineCode(String kind, int from, int to, Map<String, String> attributes, String source) {
        super(AstNodeType.INLINE_CODE, kind, from, to, attributes);
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InlineCode other)) return false;
        return sameBase(other) && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), source);
    }
}
