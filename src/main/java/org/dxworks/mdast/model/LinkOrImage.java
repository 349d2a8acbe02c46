package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

/**
 * A link or an image. The two differ by a single leading {@code !} in the source, so they
 * share one shape and are told apart by {@link #type}.
 */
public final class LinkOrImage extends AstNode {

    public final Text url;
    public final Text alt;
    // TODO: populate from the LinkTitle node once renderers agree on how titles are escaped
    public final Text title;

    public LinkOrImage(AstNodeType type, String kind, int from, int to, Map<String, String> attributes,
                       Text url, Text alt, Text title) {
        super(checkType(type), kind, from, to, attributes);
        this.url = Objects.requireNonNull(url, "url");
        this.alt = Objects.requireNonNull(alt, "alt");
        this.title = title;
    }

    private static AstNodeType checkType(AstNodeType type) {
        if (type != AstNodeType.LINK && type != AstNodeType.IMAGE) {
            throw new IllegalArgumentException("Not a link or image type: " + type);
        }
        return type;
    }

    public boolean image() {
        return type == AstNodeType.IMAGE;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinkOrImage other)) return false;
        return sameBase(other) && url.equals(other.url) && alt.equals(other.alt)
                && Objects.equals(title, other.title);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), url, alt, title);
    }
}
