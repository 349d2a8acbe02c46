package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

public final class Heading extends AstNode {

    public final Text value;
    public final int level; // 1-6

    public Heading(String kind, int from, int to, Map<String, String> attributes, Text value, int level) {
        super(AstNodeType.HEADING, kind, from, to, attributes);
        this.value = Objects.requireNonNull(value, "value");
        this.level = level;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Heading other)) return false;
        return sameBase(other) && level == other.level && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), value, level);
    }
}
