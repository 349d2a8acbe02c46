package org.dxworks.mdast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.dxworks.mdast.walker.AstVisitor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Emphasis extends AstNode {

    public enum Which {
        ITALIC("italic"),
        BOLD("bold");

        private final String name;

        Which(String name) {
            this.name = name;
        }

        @JsonValue
        public String getName() {
            return name;
        }
    }

    public final Which which;
    public final List<AstNode> children;

    public Emphasis(String kind, int from, int to, Map<String, String> attributes,
                    Which which, List<AstNode> children) {
        super(AstNodeType.EMPHASIS, kind, from, to, attributes);
        this.which = Objects.requireNonNull(which, "which");
        this.children = immutable(children);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Emphasis other)) return false;
        return sameBase(other) && which == other.which && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), which, children);
    }
}
