package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base of the Markdown AST. Every node keeps the name of the syntax node it was built from
 * ({@code kind}), its semantic {@code type} and the half-open range {@code [from, to)} into
 * the source it was converted from.
 *
 * <p>Nodes are immutable once constructed. The variants all live in this package.
 */
public abstract class AstNode {

    public final AstNodeType type;
    public final String kind;
    public final int from;
    public final int to;
    public final Map<String, String> attributes; // nullable, Pandoc-style {#id .class key=value}

    AstNode(AstNodeType type, String kind, int from, int to, Map<String, String> attributes) {
        this.type = Objects.requireNonNull(type, "type");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.from = from;
        this.to = to;
        this.attributes = (attributes == null || attributes.isEmpty())
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public abstract void accept(AstVisitor visitor);

    protected static <T> List<T> immutable(List<T> items) {
        return items == null ? List.of() : List.copyOf(items);
    }

    protected boolean sameBase(AstNode other) {
        return type == other.type
                && from == other.from
                && to == other.to
                && kind.equals(other.kind)
                && Objects.equals(attributes, other.attributes);
    }

    protected int baseHash() {
        return Objects.hash(type, kind, from, to, attributes);
    }

    @Override
    public String toString() {
        return type.getName() + "(" + kind + ")[" + from + ", " + to + ")";
    }
}
