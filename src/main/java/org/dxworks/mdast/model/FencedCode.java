package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

/**
 * A fenced or indented code block. Math blocks fenced with {@code $$} carry {@code "$$"} as
 * their info string.
 */
public final class FencedCode extends AstNode {

    /** The fence info string; empty for indented code. */
    public final String info;
    /** Verbatim code, not tokenized. Whitespace is significant. */
    public final String source;

    public FencedCode(String kind, int from, int to, Map<String, String> attributes, String info, String source) {
        super(AstNodeType.FENCED_CODE, kind, from, to, attributes);
        this.info = Objects.requireNonNull(info, "info");
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FencedCode other)) return false;
        return sameBase(other) && info.equals(other.info) && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), info, source);
    }
}
