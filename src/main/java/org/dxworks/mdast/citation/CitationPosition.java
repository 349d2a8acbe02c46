package org.dxworks.mdast.citation;

import java.util.List;
import java.util.Objects;

/**
 * One citation found in a piece of text. Offsets are relative to the string handed to the
 * {@link CitationExtractor}.
 */
public final class CitationPosition {

    public final int from;
    public final int to;
    /** True for in-text citations such as {@code @doe2020 [p. 4]}, rendered as "Doe (2020, p. 4)". */
    public final boolean composite;
    public final List<CitationItem> citations;

    public CitationPosition(int from, int to, boolean composite, List<CitationItem> citations) {
        this.from = from;
        this.to = to;
        this.composite = composite;
        this.citations = List.copyOf(citations);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CitationPosition other)) return false;
        return from == other.from && to == other.to && composite == other.composite
                && citations.equals(other.citations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, composite, citations);
    }

    @Override
    public String toString() {
        return "CitationPosition[" + from + ", " + to + ") " + citations;
    }
}
