package org.dxworks.mdast.citation;

import java.util.Objects;

public final class CitationItem {

    public final String id;
    public final String prefix;
    public final String suffix;
    public final String locator; // empty when the citation has none
    public final String label; // CSL locator label such as "page" or "chapter"; null without locator
    public final boolean suppressAuthor;

    public CitationItem(String id, String prefix, String suffix, String locator, String label, boolean suppressAuthor) {
        this.id = Objects.requireNonNull(id, "id");
        this.prefix = prefix;
        this.suffix = suffix;
        this.locator = locator;
        this.label = label;
        this.suppressAuthor = suppressAuthor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CitationItem other)) return false;
        return suppressAuthor == other.suppressAuthor
                && id.equals(other.id)
                && Objects.equals(prefix, other.prefix)
                && Objects.equals(suffix, other.suffix)
                && Objects.equals(locator, other.locator)
                && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, prefix, suffix, locator, label, suppressAuthor);
    }

    @Override
    public String toString() {
        return (suppressAuthor ? "-@" : "@") + id;
    }
}
