package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

/**
 * An internal link, {@code [[Some file]]}. {@code value} holds what is between the brackets.
 */
public final class ZettelkastenLink extends AstNode {

    public final Text value;

    public ZettelkastenLink(String kind, int from, int to, Map<String, String> attributes, Text value) {
        super(AstNodeType.ZETTELKASTEN_LINK, kind, from, to, attributes);
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ZettelkastenLink other)) return false;
        return sameBase(other) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), value);
    }
}
