package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

/**
 * The footnote marker inside running text, e.g. {@code [^1]}. Not the definition, see
 * {@link FootnoteRef}.
 */
public final class Footnote extends AstNode {

    public final String label;
    /** When true, {@link #label} holds the footnote text itself rather than a reference label. */
    public final boolean inline;

    public Footnote(String kind, int from, int to, Map<String, String> attributes, String label, boolean inline) {
        super(AstNodeType.FOOTNOTE, kind, from, to, attributes);
        this.label = Objects.requireNonNull(label, "label");
        this.inline = inline;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Footnote other)) return false;
        return sameBase(other) && inline == other.inline && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), label, inline);
    }
}
