package org.dxworks.mdast.model;

import org.dxworks.mdast.walker.AstVisitor;

import java.util.Map;
import java.util.Objects;

/**
 * YAML front matter. The YAML itself is kept verbatim, not parsed.
 */
public final class YamlFrontmatter extends AstNode {

    public final String info;
    public final String source; // verbatim YAML

    public YamlFrontmatter(String kind, int from, int to, Map<String, String> attributes, String info, String source) {
        super(AstNodeType.YAML_FRONTMATTER, kind, from, to, attributes);
        this.info = Objects.requireNonNull(info, "info");
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YamlFrontmatter other)) return false;
        return sameBase(other) && info.equals(other.info) && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), info, source);
    }
}
