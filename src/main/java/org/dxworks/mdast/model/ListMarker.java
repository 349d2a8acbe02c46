package org.dxworks.mdast.model;

import java.util.Objects;

/**
 * Position of a list item's marker glyph. {@code symbol} is one of {@code * - +} for bullet
 * lists and {@code null} for ordered lists.
 */
public final class ListMarker {

    public final String symbol;
    public final int from;
    public final int to;

    public ListMarker(String symbol, int from, int to) {
        this.symbol = symbol;
        this.from = from;
        this.to = to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListMarker other)) return false;
        return from == other.from && to == other.to && Objects.equals(symbol, other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, from, to);
    }
}
