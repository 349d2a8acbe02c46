package org.dxworks.mdast.syntax;

import java.util.HashMap;
import java.util.Map;

/**
 * Node kinds of the Markdown grammar that the converter or the tree builder refer to by name.
 * Any other name is valid input and maps to {@link #OTHER}.
 */
public enum NodeKind {
    DOCUMENT("Document", true),
    PARAGRAPH("Paragraph"),
    BLOCKQUOTE("Blockquote"),
    QUOTE_MARK("QuoteMark", true),
    HORIZONTAL_RULE("HorizontalRule"),
    HTML_BLOCK("HTMLBlock"),
    HTML_TAG("HTMLTag"),
    HARD_BREAK("HardBreak"),
    LINK_REFERENCE("LinkReference"),

    ATX_HEADING_1("ATXHeading1"),
    ATX_HEADING_2("ATXHeading2"),
    ATX_HEADING_3("ATXHeading3"),
    ATX_HEADING_4("ATXHeading4"),
    ATX_HEADING_5("ATXHeading5"),
    ATX_HEADING_6("ATXHeading6"),
    SETEXT_HEADING_1("SetextHeading1"),
    SETEXT_HEADING_2("SetextHeading2"),
    HEADER_MARK("HeaderMark", true),

    LINK("Link"),
    IMAGE("Image"),
    AUTOLINK("Autolink"),
    URL("URL"),
    LINK_MARK("LinkMark"),
    LINK_LABEL("LinkLabel"),
    LINK_TITLE("LinkTitle"),

    EMPHASIS("Emphasis"),
    STRONG_EMPHASIS("StrongEmphasis"),
    EMPHASIS_MARK("EmphasisMark", true),
    STRIKETHROUGH("Strikethrough"),
    STRIKETHROUGH_MARK("StrikethroughMark"),
    HIGHLIGHT("Highlight"),
    HIGHLIGHT_MARK("HighlightMark"),
    HIGHLIGHT_CONTENT("HighlightContent"),

    INLINE_CODE("InlineCode"),
    FENCED_CODE("FencedCode"),
    CODE_BLOCK("CodeBlock"),
    CODE_MARK("CodeMark", true),
    CODE_INFO("CodeInfo"),
    CODE_TEXT("CodeText"),
    YAML_FRONTMATTER_START("YAMLFrontmatterStart", true),
    YAML_FRONTMATTER_END("YAMLFrontmatterEnd", true),

    BULLET_LIST("BulletList"),
    ORDERED_LIST("OrderedList"),
    LIST("List", true),
    LIST_ITEM("ListItem", true),
    LIST_MARK("ListMark", true),
    TASK("Task"),
    TASK_MARKER("TaskMarker"),

    TABLE("Table"),
    TABLE_HEADER("TableHeader"),
    TABLE_ROW("TableRow"),
    TABLE_CELL("TableCell"),
    TABLE_DELIMITER("TableDelimiter"),

    CITATION("Citation"),
    FOOTNOTE("Footnote"),
    FOOTNOTE_REF("FootnoteRef"),
    FOOTNOTE_REF_LABEL("FootnoteRefLabel"),
    FOOTNOTE_REF_BODY("FootnoteRefBody"),
    ZKN_LINK("ZknLink"),
    ZKN_LINK_CONTENT("ZknLinkContent"),
    ZKN_TAG("ZknTag"),
    PANDOC_ATTRIBUTE("PandocAttribute", true),

    /** Any kind not listed above. */
    OTHER("", false);

    private static final Map<String, NodeKind> BY_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind != OTHER) {
                BY_NAME.put(kind.name, kind);
            }
        }
    }

    private final String name;
    private final boolean contentless;

    NodeKind(String name) {
        this(name, false);
    }

    NodeKind(String name, boolean contentless) {
        this.name = name;
        this.contentless = contentless;
    }

    public String getName() {
        return name;
    }

    /**
     * Formatting marks and pure containers. Their range is fully explained by their children
     * or is punctuation that the AST drops, so no text is synthesized for gaps inside them.
     */
    public boolean isContentless() {
        return contentless;
    }

    public static NodeKind fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        return BY_NAME.getOrDefault(name, OTHER);
    }

    public static boolean isContentless(String name) {
        return fromName(name).isContentless();
    }
}
