package org.dxworks.mdast.converter;

import org.dxworks.mdast.citation.CitationExtractor;
import org.dxworks.mdast.citation.CitationPosition;
import org.dxworks.mdast.citation.PandocCitationExtractor;
import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.model.AstNodeType;
import org.dxworks.mdast.model.Citation;
import org.dxworks.mdast.model.Emphasis;
import org.dxworks.mdast.model.FencedCode;
import org.dxworks.mdast.model.Footnote;
import org.dxworks.mdast.model.FootnoteRef;
import org.dxworks.mdast.model.Generic;
import org.dxworks.mdast.model.Heading;
import org.dxworks.mdast.model.Highlight;
import org.dxworks.mdast.model.InlineCode;
import org.dxworks.mdast.model.LinkOrImage;
import org.dxworks.mdast.model.ListBlock;
import org.dxworks.mdast.model.ListItem;
import org.dxworks.mdast.model.ListMarker;
import org.dxworks.mdast.model.Table;
import org.dxworks.mdast.model.TableCell;
import org.dxworks.mdast.model.TableRow;
import org.dxworks.mdast.model.Text;
import org.dxworks.mdast.model.YamlFrontmatter;
import org.dxworks.mdast.model.ZettelkastenLink;
import org.dxworks.mdast.model.ZettelkastenTag;
import org.dxworks.mdast.syntax.NodeKind;
import org.dxworks.mdast.syntax.SyntaxNode;
import org.dxworks.mdast.syntax.SyntaxNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a concrete Markdown syntax tree into the semantic AST of {@link AstNode}s.
 *
 * <p>Syntax trees are concrete: they keep every mark, delimiter and attribute block of the
 * source, and leave plain text unwrapped between their nodes. The converter folds the marks
 * into typed fields, turns the unwrapped text into {@link Text} nodes and maps every node kind
 * it has no dedicated rule for onto {@link Generic}, so that the whole source stays covered.
 *
 * <p>Instances hold no mutable state and can be shared between threads.
 */
public class MarkdownAstConverter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownAstConverter.class);

    private final CitationExtractor citationExtractor;

    public MarkdownAstConverter() {
        this(new PandocCitationExtractor());
    }

    public MarkdownAstConverter(CitationExtractor citationExtractor) {
        this.citationExtractor = Objects.requireNonNull(citationExtractor, "citationExtractor");
    }

    /**
     * Converts {@code node} and everything below it.
     *
     * @param node   root of the (sub)tree to convert, of any kind
     * @param source the text the tree was parsed from; offsets of the tree index into it
     * @return a new tree whose root spans the same range as {@code node}
     * @throws IllegalArgumentException if the node's range lies outside the source
     * @throws ConversionException      if a node lacks a child its grammar guarantees
     */
    public AstNode convert(SyntaxNode node, String source) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(source, "source");
        if (node.getFrom() < 0 || node.getFrom() > node.getTo() || node.getTo() > source.length()) {
            throw new IllegalArgumentException("Node " + node.getKind() + " [" + node.getFrom() + ", "
                    + node.getTo() + ") lies outside of a source of length " + source.length());
        }
        return parseNode(node, source);
    }

    private AstNode parseNode(SyntaxNode node, String source) {
        NodeKind kind = NodeKind.fromName(node.getKind());
        return switch (kind) {
            case LINK, IMAGE -> parseLinkOrImage(node, source, kind == NodeKind.IMAGE);
            case URL -> parseBareUrl(node, source);
            case ATX_HEADING_1, ATX_HEADING_2, ATX_HEADING_3, ATX_HEADING_4, ATX_HEADING_5, ATX_HEADING_6 ->
                    parseAtxHeading(node, source);
            case SETEXT_HEADING_1, SETEXT_HEADING_2 -> parseSetextHeading(node, source);
            case CITATION -> parseCitation(node, source);
            case FOOTNOTE -> parseFootnote(node, source);
            case FOOTNOTE_REF -> parseFootnoteRef(node, source);
            case HIGHLIGHT -> parseHighlight(node, source);
            case ORDERED_LIST, BULLET_LIST -> parseList(node, source, kind == NodeKind.ORDERED_LIST);
            case FENCED_CODE, CODE_BLOCK -> parseCode(node, source);
            case INLINE_CODE -> parseInlineCode(node, source);
            case EMPHASIS, STRONG_EMPHASIS -> parseEmphasis(node, source, kind == NodeKind.EMPHASIS);
            case TABLE -> parseTable(node, source);
            case ZKN_LINK -> parseZettelkastenLink(node, source);
            case ZKN_TAG -> new ZettelkastenTag(node.getKind(), node.getFrom(), node.getTo(),
                    ownAttributes(node, source), text(source, node.getFrom(), node.getTo()));
            default -> parseGeneric(node, source);
        };
    }

    private AstNode parseLinkOrImage(SyntaxNode node, String source, boolean image) {
        SyntaxNode url = SyntaxNodes.findFirstChild(node, NodeKind.URL);
        if (url == null) {
            log.debug("{} at [{}, {}) has no URL, keeping it as plain text",
                    node.getKind(), node.getFrom(), node.getTo());
            return new Generic(node.getKind(), node.getFrom(), node.getTo(), null,
                    List.of(text(source, node.getFrom(), node.getTo())));
        }

        Text urlText = text(source, url.getFrom(), url.getTo());
        Text alt = urlText;
        SyntaxNode label = SyntaxNodes.findFirstChild(node, NodeKind.LINK_LABEL);
        List<SyntaxNode> marks = SyntaxNodes.findAllChildren(node, NodeKind.LINK_MARK);
        if (label != null) {
            alt = text(source, label.getFrom(), label.getTo());
        } else if (marks.size() >= 2) {
            // Plain CommonMark links have no label node; the text sits between "[" and "]"
            alt = text(source, marks.get(0).getTo(), marks.get(1).getFrom());
        }

        return new LinkOrImage(image ? AstNodeType.IMAGE : AstNodeType.LINK, node.getKind(),
                node.getFrom(), node.getTo(), ownAttributes(node, source), urlText, alt, null);
    }

    private AstNode parseBareUrl(SyntaxNode node, String source) {
        Text url = text(source, node.getFrom(), node.getTo());
        return new LinkOrImage(AstNodeType.LINK, node.getKind(), node.getFrom(), node.getTo(), null,
                url, url, null);
    }

    private AstNode parseAtxHeading(SyntaxNode node, String source) {
        SyntaxNode mark = SyntaxNodes.findFirstChild(node, NodeKind.HEADER_MARK);
        int level = mark != null ? mark.getTo() - mark.getFrom() : levelFromKind(node);
        int valueFrom = mark != null ? mark.getTo() : node.getFrom();
        return new Heading(node.getKind(), node.getFrom(), node.getTo(), ownAttributes(node, source),
                trimmedText(source, valueFrom, node.getTo()), level);
    }

    private AstNode parseSetextHeading(SyntaxNode node, String source) {
        SyntaxNode mark = SyntaxNodes.findFirstChild(node, NodeKind.HEADER_MARK);
        int level;
        if (mark != null) {
            level = SyntaxNodes.text(source, mark).contains("-") ? 2 : 1;
        } else {
            level = levelFromKind(node);
        }
        int valueTo = mark != null ? mark.getFrom() : node.getTo();
        return new Heading(node.getKind(), node.getFrom(), node.getTo(), ownAttributes(node, source),
                trimmedText(source, node.getFrom(), valueTo), level);
    }

    private AstNode parseCitation(SyntaxNode node, String source) {
        Text value = text(source, node.getFrom(), node.getTo());
        List<CitationPosition> citations = citationExtractor.extract(value.value);
        // The grammar matches one citation per node; anything after the first is ignored
        CitationPosition parsed = citations == null || citations.isEmpty() ? null : citations.get(0);
        return new Citation(node.getKind(), node.getFrom(), node.getTo(), null, value, parsed);
    }

    private AstNode parseFootnote(SyntaxNode node, String source) {
        // [^1] -> 1, [^some text^] -> "some text" (inline)
        String contents = SyntaxNodes.text(source, node.getFrom() + 2, node.getTo() - 1).trim();
        boolean inline = contents.endsWith("^");
        String label = inline ? contents.substring(0, contents.length() - 1) : contents;
        return new Footnote(node.getKind(), node.getFrom(), node.getTo(), null, label, inline);
    }

    private AstNode parseFootnoteRef(SyntaxNode node, String source) {
        SyntaxNode label = SyntaxNodes.findFirstChild(node, NodeKind.FOOTNOTE_REF_LABEL);
        SyntaxNode body = SyntaxNodes.findFirstChild(node, NodeKind.FOOTNOTE_REF_BODY);
        // [^1]: -> 1
        String labelText = label != null
                ? SyntaxNodes.text(source, label.getFrom() + 2, label.getTo() - 2)
                : "";
        if (body == null) {
            return new FootnoteRef(node.getKind(), node.getFrom(), node.getTo(), null, labelText, List.of());
        }
        Children children = parseChildren(body, source);
        return new FootnoteRef(node.getKind(), node.getFrom(), node.getTo(), children.attributes,
                labelText, children.nodes);
    }

    private AstNode parseHighlight(SyntaxNode node, String source) {
        SyntaxNode content = SyntaxNodes.findFirstChild(node, NodeKind.HIGHLIGHT_CONTENT);
        Children children = parseChildren(content != null ? content : node, source);
        return new Highlight(node.getKind(), node.getFrom(), node.getTo(), children.attributes, children.nodes);
    }

    private AstNode parseList(SyntaxNode node, String source, boolean ordered) {
        List<ListItem> items = new ArrayList<>();
        for (SyntaxNode item : SyntaxNodes.findAllChildren(node, NodeKind.LIST_ITEM)) {
            items.add(parseListItem(item, source, ordered));
        }
        return new ListBlock(node.getKind(), node.getFrom(), node.getTo(), ownAttributes(node, source),
                ordered, items);
    }

    private ListItem parseListItem(SyntaxNode item, String source, boolean ordered) {
        ListMarker marker = new ListMarker(null, item.getFrom(), item.getFrom());
        SyntaxNode listMark = SyntaxNodes.findFirstChild(item, NodeKind.LIST_MARK);
        if (listMark != null) {
            String symbol = null;
            if (!ordered && listMark.getTo() - listMark.getFrom() == 1) {
                String glyph = SyntaxNodes.text(source, listMark);
                if ("*".equals(glyph) || "-".equals(glyph) || "+".equals(glyph)) {
                    symbol = glyph;
                }
            }
            marker = new ListMarker(symbol, listMark.getFrom(), listMark.getTo());
        }

        Boolean checked = null;
        SyntaxNode task = SyntaxNodes.findFirstChild(item, NodeKind.TASK);
        SyntaxNode taskMarker = task != null ? SyntaxNodes.findFirstChild(task, NodeKind.TASK_MARKER) : null;
        if (taskMarker != null) {
            checked = "[x]".equals(SyntaxNodes.text(source, taskMarker));
        }

        Children children = parseChildren(item, source);
        return new ListItem(item.getKind(), item.getFrom(), item.getTo(), children.attributes,
                checked, marker, children.nodes);
    }

    private AstNode parseCode(SyntaxNode node, String source) {
        SyntaxNode info = SyntaxNodes.findFirstChild(node, NodeKind.CODE_INFO);
        SyntaxNode mark = SyntaxNodes.findFirstChild(node, NodeKind.CODE_MARK);
        if (mark != null && "$$".equals(SyntaxNodes.text(source, mark))) {
            // Math fences have no info string; hand the fence itself to renderers instead
            info = mark;
        }
        SyntaxNode code = SyntaxNodes.findFirstChild(node, NodeKind.CODE_TEXT);
        String infoText = info != null ? SyntaxNodes.text(source, info) : "";
        String codeText = code != null ? SyntaxNodes.text(source, code) : "";
        Map<String, String> attributes = ownAttributes(node, source);

        if (SyntaxNodes.findFirstChild(node, NodeKind.YAML_FRONTMATTER_START) != null) {
            return new YamlFrontmatter(node.getKind(), node.getFrom(), node.getTo(), attributes, infoText, codeText);
        }
        return new FencedCode(node.getKind(), node.getFrom(), node.getTo(), attributes, infoText, codeText);
    }

    private AstNode parseInlineCode(SyntaxNode node, String source) {
        List<SyntaxNode> marks = SyntaxNodes.findAllChildren(node, NodeKind.CODE_MARK);
        String code = marks.size() >= 2
                ? SyntaxNodes.text(source, marks.get(0).getTo(), marks.get(1).getFrom())
                : SyntaxNodes.text(source, node);
        return new InlineCode(node.getKind(), node.getFrom(), node.getTo(), null, code);
    }

    private AstNode parseEmphasis(SyntaxNode node, String source, boolean italic) {
        Children children = parseChildren(node, source);
        return new Emphasis(node.getKind(), node.getFrom(), node.getTo(), children.attributes,
                italic ? Emphasis.Which.ITALIC : Emphasis.Which.BOLD, children.nodes);
    }

    private AstNode parseTable(SyntaxNode node, String source) {
        List<SyntaxNode> rowNodes = new ArrayList<>(SyntaxNodes.findAllChildren(node, NodeKind.TABLE_HEADER));
        rowNodes.addAll(SyntaxNodes.findAllChildren(node, NodeKind.TABLE_ROW));

        List<TableRow> rows = new ArrayList<>();
        for (SyntaxNode row : rowNodes) {
            List<TableCell> cells = new ArrayList<>();
            for (SyntaxNode cell : SyntaxNodes.findAllChildren(row, NodeKind.TABLE_CELL)) {
                Children children = parseChildren(cell, source);
                cells.add(new TableCell(cell.getKind(), cell.getFrom(), cell.getTo(), children.attributes,
                        children.nodes));
            }
            rows.add(new TableRow(row.getKind(), row.getFrom(), row.getTo(), null,
                    SyntaxNodes.isKind(row, NodeKind.TABLE_HEADER), cells));
        }
        return new Table(node.getKind(), node.getFrom(), node.getTo(), ownAttributes(node, source), rows);
    }

    private AstNode parseZettelkastenLink(SyntaxNode node, String source) {
        SyntaxNode content = SyntaxNodes.findFirstChild(node, NodeKind.ZKN_LINK_CONTENT);
        if (content == null) {
            throw new ConversionException("No ZknLinkContent child found", node.getKind(),
                    node.getFrom(), node.getTo());
        }
        return new ZettelkastenLink(node.getKind(), node.getFrom(), node.getTo(), null,
                text(source, content.getFrom(), content.getTo()));
    }

    private AstNode parseGeneric(SyntaxNode node, String source) {
        Children children = parseChildren(node, source);
        return new Generic(node.getKind(), node.getFrom(), node.getTo(), children.attributes, children.nodes);
    }

    /**
     * Converts the direct children of {@code node}. Text between and around them that no child
     * covers becomes {@link Text}, unless {@code node} is a contentless kind. Attribute blocks
     * are not kept as children; they are merged into the returned attributes instead.
     */
    private Children parseChildren(SyntaxNode node, String source) {
        boolean fillGaps = !NodeKind.isContentless(node.getKind());
        Children result = new Children();

        SyntaxNode child = node.getFirstChild();
        if (child == null) {
            if (fillGaps) {
                result.nodes.add(text(source, node.getFrom(), node.getTo()));
            }
            return result;
        }

        int current = node.getFrom();
        for (; child != null; child = child.getNextSibling()) {
            if (child.getFrom() > current && fillGaps) {
                result.nodes.add(text(source, current, child.getFrom()));
            }
            if (SyntaxNodes.isKind(child, NodeKind.PANDOC_ATTRIBUTE)) {
                // TODO: Pandoc attaches some blocks to the preceding sibling (e.g. *word*{.cls});
                //  they land on the parent until the intended semantics are settled
                PandocAttributes.merge(result.attributes, SyntaxNodes.text(source, child));
            } else {
                result.nodes.add(parseNode(child, source));
            }
            current = Math.max(current, child.getTo());
        }

        if (current < node.getTo() && fillGaps) {
            result.nodes.add(text(source, current, node.getTo()));
        }
        return result;
    }

    /**
     * Attribute blocks directly below a node whose children are not aggregated.
     */
    private static Map<String, String> ownAttributes(SyntaxNode node, String source) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (SyntaxNode block : SyntaxNodes.findAllChildren(node, NodeKind.PANDOC_ATTRIBUTE)) {
            PandocAttributes.merge(attributes, SyntaxNodes.text(source, block));
        }
        return attributes;
    }

    private static int levelFromKind(SyntaxNode node) {
        String kind = node.getKind();
        char last = kind.charAt(kind.length() - 1);
        return Character.isDigit(last) ? last - '0' : 1;
    }

    private static Text text(String source, int from, int to) {
        return new Text(from, Math.max(from, to), SyntaxNodes.text(source, from, to));
    }

    private static Text trimmedText(String source, int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(source.length(), to);
        while (start < end && Character.isWhitespace(source.charAt(start))) start++;
        while (end > start && Character.isWhitespace(source.charAt(end - 1))) end--;
        return text(source, start, Math.max(start, end));
    }

    private static final class Children {
        final List<AstNode> nodes = new ArrayList<>();
        final Map<String, String> attributes = new LinkedHashMap<>();
    }
}
