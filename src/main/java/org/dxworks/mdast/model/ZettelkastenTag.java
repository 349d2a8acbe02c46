package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

/**
 * A tag such as {@code #todo}; {@code value} includes the hash sign.
 */
public final class ZettelkastenTag extends AstNode {

    public final Text value;

    public ZettelkastenTag(String kind, int from, int to, Map<String, String> attributes, Text value) {
        super(AstNodeType.ZETTELKASTEN_TAG, kind, from, to, attributes);
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ZettelkastenTag other)) return false;
        return sameBase(other) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), value);
    }
}
