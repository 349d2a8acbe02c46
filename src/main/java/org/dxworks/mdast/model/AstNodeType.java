package org.dxworks.mdast.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic category of an {@link AstNode}. Consumers switch over this tag instead of
 * inspecting the node class.
 */
public enum AstNodeType {
    TEXT("Text"),
    HEADING("Heading"),
    CITATION("Citation"),
    FOOTNOTE("Footnote"),
    FOOTNOTE_REF("FootnoteRef"),
    LINK("Link"),
    IMAGE("Image"),
    HIGHLIGHT("Highlight"),
    EMPHASIS("Emphasis"),
    LIST("List"),
    LIST_ITEM("ListItem"),
    FENCED_CODE("FencedCode"),
    YAML_FRONTMATTER("YAMLFrontmatter"),
    INLINE_CODE("InlineCode"),
    TABLE("Table"),
    TABLE_ROW("TableRow"),
    TABLE_CELL("TableCell"),
    ZETTELKASTEN_LINK("ZettelkastenLink"),
    ZETTELKASTEN_TAG("ZettelkastenTag"),
    GENERIC("Generic");

    private final String name;

    AstNodeType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
