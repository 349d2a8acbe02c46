package org.dxworks.mdast.model;

import org.dxworks.mdast.citation.CitationPosition;
import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

public final class Citation extends AstNode {

    /** The raw citation code, e.g. {@code [see @doe2020, p. 4]}. */
    public final Text value;
    /** First citation the extractor found in {@link #value}, or {@code null} if it found none. */
    public final CitationPosition parsedCitation;

    public Citation(String kind, int from, int to, Map<String, String> attributes,
                    Text value, CitationPosition parsedCitation) {
        super(AstNodeType.CITATION, kind, from, to, attributes);
        this.value = Objects.requireNonNull(value, "value");
        this.parsedCitation = parsedCitation;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Citation other)) return false;
        return sameBase(other) && value.equals(other.value)
                && Objects.equals(parsedCitation, other.parsedCitation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), value, parsedCitation);
    }
}
