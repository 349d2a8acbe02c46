package org.dxworks.mdast.syntax.commonmark;

import org.commonmark.Extension;
import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.mdast.syntax.NodeKind;
import org.dxworks.mdast.syntax.SyntaxTreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.mdast.syntax.SyntaxTreeNode.node;

/**
 * Parses Markdown with commonmark-java and rebuilds the result as a concrete syntax tree in the
 * node vocabulary of {@link NodeKind}: every mark, fence, URL and cell gets its own node, and
 * plain text is left uncovered between them.
 *
 * <p>commonmark only reports where its nodes are. The marks are recovered from the source text
 * around those spans, and the Zettelkasten and Pandoc syntax commonmark does not know about is
 * found by {@link DialectInlineScanner} in the text between inline nodes. {@code ==highlight==}
 * pairs are matched across inline nodes, so a highlight may hold emphasis, code or links.
 *
 * <p>The parser is thread-safe; every call builds its tree independently.
 */
public class CommonmarkSyntaxTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(CommonmarkSyntaxTreeBuilder.class);

    private static final Pattern FOOTNOTE_REF_START = Pattern.compile("\\[\\^[^\\[\\]\\s]+]:");
    private static final Pattern ORDERED_MARK = Pattern.compile("\\d{1,9}[.)]");
    private static final Pattern HIGHLIGHT = Pattern.compile("==(?=[^\\s=])[^\\n]*?[^\\s=]==");

    private final Parser parser;

    public CommonmarkSyntaxTreeBuilder() {
        List<Extension> extensions = List.of(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                TaskListItemsExtension.create(),
                YamlFrontMatterExtension.create());
        this.parser = Parser.builder()
                .extensions(extensions)
                .includeSourceSpans(IncludeSourceSpans.BLOCKS_AND_INLINES)
                .build();
    }

    /**
     * Parses {@code markdown} into a tree whose {@code Document} root spans the whole text.
     */
    public SyntaxTreeNode parse(String markdown) {
        Objects.requireNonNull(markdown, "markdown");
        Node document = parser.parse(markdown);
        SyntaxTreeNode tree = new Builder(markdown).document(document);
        log.debug("Built syntax tree with {} top-level nodes from {} characters",
                tree.getChildren().size(), markdown.length());
        return tree;
    }

    private static final class Span {
        final int from;
        final int to;

        Span(int from, int to) {
            this.from = from;
            this.to = Math.max(from, to);
        }
    }

    /**
     * State of a single parse.
     */
    private static final class Builder {

        private final String source;
        private final SourceLines lines;
        private final DialectInlineScanner scanner;
        private final NavigableSet<Integer> quoteMarks = new TreeSet<>();

        Builder(String source) {
            this.source = source;
            this.lines = new SourceLines(source);
            this.scanner = new DialectInlineScanner(source);
        }

        SyntaxTreeNode document(Node document) {
            List<SyntaxTreeNode> children = new ArrayList<>();
            for (Node child = document.getFirstChild(); child != null; child = child.getNext()) {
                children.addAll(build(child));
            }
            return new SyntaxTreeNode(NodeKind.DOCUMENT.getName(), 0, source.length(), settle(children));
        }

        private List<SyntaxTreeNode> build(Node node) {
            if (node instanceof Text || node instanceof SoftLineBreak || node instanceof TaskListItemMarker) {
                return List.of();
            }
            if (node instanceof YamlFrontMatterBlock) {
                return optional(frontmatter(span(node)));
            }

            Span span = span(node);
            if (span == null) {
                // Nodes without a position contribute their children only
                return childrenOf(node);
            }

            if (node instanceof Paragraph) return List.of(paragraph((Paragraph) node, span));
            if (node instanceof Heading heading) return List.of(heading(heading, span));
            if (node instanceof BlockQuote quote) return List.of(blockquote(quote, span));
            if (node instanceof BulletList) return List.of(container(NodeKind.BULLET_LIST.getName(), span, childrenOf(node)));
            if (node instanceof OrderedList) return List.of(container(NodeKind.ORDERED_LIST.getName(), span, childrenOf(node)));
            if (node instanceof ListItem item) return List.of(listItem(item, span));
            if (node instanceof FencedCodeBlock) return List.of(fencedCode(span));
            if (node instanceof IndentedCodeBlock) {
                return List.of(node(NodeKind.CODE_BLOCK, span.from, span.to,
                        node(NodeKind.CODE_TEXT, span.from, span.to)));
            }
            if (node instanceof ThematicBreak) return List.of(node(NodeKind.HORIZONTAL_RULE, span.from, span.to));
            if (node instanceof HtmlBlock) return List.of(node(NodeKind.HTML_BLOCK, span.from, span.to));
            if (node instanceof LinkReferenceDefinition) return List.of(linkReference(span));
            if (node instanceof TableBlock table) return List.of(table(table, span));

            if (node instanceof Emphasis) return List.of(delimited(node, span, NodeKind.EMPHASIS, NodeKind.EMPHASIS_MARK, 1));
            if (node instanceof StrongEmphasis) return List.of(delimited(node, span, NodeKind.STRONG_EMPHASIS, NodeKind.EMPHASIS_MARK, 2));
            if (node instanceof Strikethrough) {
                int width = run(span.from, span.to, '~');
                return List.of(delimited(node, span, NodeKind.STRIKETHROUGH, NodeKind.STRIKETHROUGH_MARK,
                        Math.max(1, Math.min(2, width))));
            }
            if (node instanceof Code) return List.of(inlineCode(span));
            if (node instanceof Link || node instanceof Image) return List.of(link(node, span, node instanceof Image));
            if (node instanceof HtmlInline) return List.of(node(NodeKind.HTML_TAG, span.from, span.to));
            if (node instanceof HardLineBreak) return List.of(node(NodeKind.HARD_BREAK, span.from, span.to));

            return List.of(container(node.getClass().getSimpleName(), span, childrenOf(node)));
        }

        private List<SyntaxTreeNode> childrenOf(Node node) {
            List<SyntaxTreeNode> children = new ArrayList<>();
            for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                children.addAll(build(child));
            }
            return children;
        }

        // Blocks

        private SyntaxTreeNode paragraph(Paragraph paragraph, Span span) {
            Matcher footnote = FOOTNOTE_REF_START.matcher(source).region(span.from, span.to);
            if (footnote.lookingAt()) {
                return footnoteRef(span, footnote.end(), childrenOf(paragraph));
            }
            SyntaxTreeNode math = mathBlock(span);
            if (math != null) {
                return math;
            }
            return inline(NodeKind.PARAGRAPH.getName(), span, new ArrayList<>(), childrenOf(paragraph));
        }

        /**
         * A {@code $$} math block, which commonmark reads as a paragraph, as a FencedCode whose
         * marks are the {@code $$} lines.
         */
        private SyntaxTreeNode mathBlock(Span span) {
            int firstLine = lines.lineOf(span.from);
            int lastLine = lines.lineOf(Math.max(span.from, span.to - 1));
            if (lastLine <= firstLine) return null;
            int open = lines.skipBlanks(span.from, lines.end(firstLine));
            int openTo = lines.trimEnd(open, lines.end(firstLine));
            int close = lines.skipBlanks(lines.start(lastLine), lines.end(lastLine));
            int closeTo = lines.trimEnd(close, Math.min(span.to, lines.end(lastLine)));
            if (!"$$".equals(source.substring(open, openTo)) || !"$$".equals(source.substring(close, closeTo))) {
                return null;
            }
            List<SyntaxTreeNode> children = new ArrayList<>();
            children.add(node(NodeKind.CODE_MARK, open, openTo));
            if (lastLine > firstLine + 1) {
                children.add(node(NodeKind.CODE_TEXT, lines.start(firstLine + 1), lines.end(lastLine - 1)));
            }
            children.add(node(NodeKind.CODE_MARK, close, closeTo));
            return container(NodeKind.FENCED_CODE.getName(), span, children);
        }

        private SyntaxTreeNode linkReference(Span span) {
            Matcher footnote = FOOTNOTE_REF_START.matcher(source).region(span.from, span.to);
            if (footnote.lookingAt()) {
                return footnoteRef(span, footnote.end(), List.of());
            }
            return node(NodeKind.LINK_REFERENCE, span.from, span.to);
        }

        private SyntaxTreeNode footnoteRef(Span span, int labelEnd, List<SyntaxTreeNode> inlines) {
            List<SyntaxTreeNode> children = new ArrayList<>();
            children.add(node(NodeKind.FOOTNOTE_REF_LABEL, span.from, labelEnd));
            int bodyFrom = lines.skipBlanks(labelEnd, span.to);
            if (bodyFrom < span.to) {
                List<SyntaxTreeNode> inside = new ArrayList<>();
                for (SyntaxTreeNode inline : inlines) {
                    if (inline.getFrom() >= bodyFrom && inline.getTo() <= span.to) {
                        inside.add(inline);
                    }
                }
                children.add(inline(NodeKind.FOOTNOTE_REF_BODY.getName(), new Span(bodyFrom, span.to),
                        new ArrayList<>(), inside));
            }
            return new SyntaxTreeNode(NodeKind.FOOTNOTE_REF.getName(), span.from, span.to, children);
        }

        private SyntaxTreeNode heading(Heading heading, Span span) {
            int start = lines.skipBlanks(span.from, span.to);
            if (start < span.to && source.charAt(start) == '#') {
                return atxHeading(heading, span, start);
            }
            return setextHeading(heading, span);
        }

        private SyntaxTreeNode atxHeading(Heading heading, Span span, int markFrom) {
            int markTo = markFrom + run(markFrom, span.to, '#');
            List<SyntaxTreeNode> fixed = new ArrayList<>();
            fixed.add(node(NodeKind.HEADER_MARK, markFrom, markTo));
            List<SyntaxTreeNode> inlines = childrenOf(heading);
            SyntaxTreeNode attribute = trailingAttribute(markTo, span.to, inlines);
            if (attribute != null) {
                fixed.add(attribute);
            }
            return inline("ATXHeading" + heading.getLevel(), span, fixed, inlines);
        }

        private SyntaxTreeNode setextHeading(Heading heading, Span span) {
            String kind = "SetextHeading" + heading.getLevel();
            int firstLine = lines.lineOf(span.from);
            int lastLine = lines.lineOf(Math.max(span.from, span.to - 1));

            Span underline = null;
            if (lastLine > firstLine) {
                underline = underline(lastLine);
            }
            if (underline == null && lastLine + 1 < lines.count()) {
                underline = underline(lastLine + 1);
            }

            List<SyntaxTreeNode> fixed = new ArrayList<>();
            Span range = span;
            if (underline != null) {
                fixed.add(node(NodeKind.HEADER_MARK, underline.from, underline.to));
                range = new Span(span.from, Math.max(span.to, underline.to));
            }
            return inline(kind, range, fixed, childrenOf(heading));
        }

        /**
         * A line holding nothing but a run of {@code =} or {@code -}, after any container prefix.
         */
        private Span underline(int line) {
            int start = lines.start(line);
            int lineEnd = lines.end(line);
            while (start < lineEnd && " \t>".indexOf(source.charAt(start)) >= 0) start++;
            int end = lines.trimEnd(start, lineEnd);
            if (end == start) return null;
            char c = source.charAt(start);
            if (c != '=' && c != '-') return null;
            if (start + run(start, end, c) != end) return null;
            return new Span(start, end);
        }

        /**
         * A Pandoc attribute block closing a heading line, such as {@code # Title {#id .cls}}.
         */
        private SyntaxTreeNode trailingAttribute(int from, int to, List<SyntaxTreeNode> inlines) {
            int end = lines.trimEnd(from, to);
            if (end == from || source.charAt(end - 1) != '}') return null;
            int open = source.lastIndexOf('{', end - 1);
            if (open < from || source.indexOf('}', open) != end - 1) return null;
            for (SyntaxTreeNode inline : inlines) {
                if (inline.getTo() > open) return null;
            }
            return node(NodeKind.PANDOC_ATTRIBUTE, open, end);
        }

        /**
         * The {@code >} marks of a quote are registered before its content is built, so that the
         * paragraphs spanning several quoted lines take the marks on their continuation lines.
         */
        private SyntaxTreeNode blockquote(BlockQuote quote, Span span) {
            int depth = 0;
            for (Node parent = quote; parent != null; parent = parent.getParent()) {
                if (parent instanceof BlockQuote) depth++;
            }
            List<Integer> marks = new ArrayList<>();
            int firstLine = lines.lineOf(span.from);
            int lastLine = lines.lineOf(Math.max(span.from, span.to - 1));
            for (int line = firstLine; line <= lastLine; line++) {
                int pos = line == firstLine
                        ? quoteMark(span.from, lines.end(line), 1)
                        : quoteMark(lines.start(line), lines.end(line), depth);
                if (pos >= 0 && pos < span.to) marks.add(pos);
            }
            quoteMarks.addAll(marks);

            List<SyntaxTreeNode> children = childrenOf(quote);
            for (int pos : marks) {
                if (quoteMarks.remove(pos) && !covered(children, pos)) {
                    children.add(node(NodeKind.QUOTE_MARK, pos, pos + 1));
                }
            }
            return container(NodeKind.BLOCKQUOTE.getName(), span, children);
        }

        /**
         * Offset of the {@code nth} {@code >} of a quote prefix starting at {@code from}, or -1.
         */
        private int quoteMark(int from, int lineEnd, int nth) {
            int pos = from;
            int found = -1;
            for (int i = 0; i < nth; i++) {
                pos = lines.skipBlanks(pos, lineEnd);
                if (pos >= lineEnd || source.charAt(pos) != '>') return -1;
                found = pos++;
            }
            return found;
        }

        /**
         * Takes the pending quote marks inside {@code span} that no child covers.
         */
        private List<SyntaxTreeNode> takeQuoteMarks(Span span, List<SyntaxTreeNode> children) {
            List<SyntaxTreeNode> marks = new ArrayList<>();
            Iterator<Integer> pending = quoteMarks.subSet(span.from, span.to).iterator();
            while (pending.hasNext()) {
                int pos = pending.next();
                if (!covered(children, pos)) {
                    marks.add(node(NodeKind.QUOTE_MARK, pos, pos + 1));
                    pending.remove();
                }
            }
            return marks;
        }

        private SyntaxTreeNode listItem(ListItem item, Span span) {
            int from = span.from;
            Span mark = listMark(span);
            List<SyntaxTreeNode> children = new ArrayList<>();
            if (mark != null) {
                from = Math.min(from, mark.from);
                children.add(node(NodeKind.LIST_MARK, mark.from, mark.to));
            }

            boolean task = hasTaskMarker(item);
            boolean taskBuilt = false;
            for (Node child = item.getFirstChild(); child != null; child = child.getNext()) {
                if (task && !taskBuilt && child instanceof Paragraph && mark != null) {
                    Span paragraph = span(child);
                    int box = lines.skipBlanks(mark.to, span.to);
                    if (paragraph != null && isTaskBox(box)) {
                        List<SyntaxTreeNode> fixed = new ArrayList<>();
                        fixed.add(node(NodeKind.TASK_MARKER, box, box + 3));
                        children.add(inline(NodeKind.TASK.getName(),
                                new Span(Math.min(box, paragraph.from), paragraph.to), fixed, childrenOf(child)));
                        taskBuilt = true;
                        continue;
                    }
                }
                children.addAll(build(child));
            }
            return container(NodeKind.LIST_ITEM.getName(), new Span(from, span.to), children);
        }

        private boolean hasTaskMarker(ListItem item) {
            for (Node child = item.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TaskListItemMarker) return true;
                if (child instanceof Paragraph && child.getFirstChild() instanceof TaskListItemMarker) return true;
            }
            return false;
        }

        private boolean isTaskBox(int pos) {
            if (pos + 3 > source.length()) return false;
            char state = source.charAt(pos + 1);
            return source.charAt(pos) == '[' && source.charAt(pos + 2) == ']'
                    && (state == ' ' || state == 'x' || state == 'X');
        }

        /**
         * Finds the bullet or number of a list item, at the start of its span or just before it.
         */
        private Span listMark(Span span) {
            int pos = lines.skipBlanks(span.from, span.to);
            Span mark = markAt(pos);
            if (mark != null) return mark;

            int lineStart = lines.start(lines.lineOf(span.from));
            int back = span.from;
            while (back > lineStart && (source.charAt(back - 1) == ' ' || source.charAt(back - 1) == '\t')) back--;
            if (back == lineStart) return null;
            char c = source.charAt(back - 1);
            if (c == '-' || c == '+' || c == '*') return new Span(back - 1, back);
            if (c == '.' || c == ')') {
                int digits = back - 1;
                while (digits > lineStart && Character.isDigit(source.charAt(digits - 1))) digits--;
                if (digits < back - 1) return new Span(digits, back);
            }
            return null;
        }

        private Span markAt(int pos) {
            if (pos >= source.length()) return null;
            char c = source.charAt(pos);
            if (c == '-' || c == '+' || c == '*') return new Span(pos, pos + 1);
            Matcher ordered = ORDERED_MARK.matcher(source).region(pos, source.length());
            if (ordered.lookingAt()) return new Span(pos, ordered.end());
            return null;
        }

        private SyntaxTreeNode fencedCode(Span span) {
            int firstLine = lines.lineOf(span.from);
            int lastLine = lines.lineOf(Math.max(span.from, span.to - 1));
            int open = lines.skipBlanks(span.from, lines.end(firstLine));
            if (open >= lines.end(firstLine)) {
                return node(NodeKind.FENCED_CODE, span.from, span.to);
            }
            char fence = source.charAt(open);
            int openTo = open + run(open, lines.end(firstLine), fence);

            List<SyntaxTreeNode> children = new ArrayList<>();
            children.add(node(NodeKind.CODE_MARK, open, openTo));
            int infoFrom = lines.skipBlanks(openTo, lines.end(firstLine));
            int infoTo = lines.trimEnd(infoFrom, lines.end(firstLine));
            if (infoFrom < infoTo) {
                children.add(node(NodeKind.CODE_INFO, infoFrom, infoTo));
            }

            SyntaxTreeNode closing = null;
            int lastContentLine = lastLine;
            if (lastLine > firstLine) {
                int lineEnd = lines.trimEnd(lines.start(lastLine), lines.end(lastLine));
                int close = lineEnd;
                while (close > lines.start(lastLine) && source.charAt(close - 1) == fence) close--;
                int prefix = lines.skipBlanks(lines.start(lastLine), close);
                if (lineEnd - close >= openTo - open && (prefix == close || source.charAt(close - 1) == ' ')) {
                    closing = node(NodeKind.CODE_MARK, close, lineEnd);
                    lastContentLine = lastLine - 1;
                }
            }
            if (lastContentLine > firstLine) {
                children.add(node(NodeKind.CODE_TEXT, lines.start(firstLine + 1), lines.end(lastContentLine)));
            }
            if (closing != null) {
                children.add(closing);
            }
            return container(NodeKind.FENCED_CODE.getName(), span, children);
        }

        private SyntaxTreeNode frontmatter(Span span) {
            int firstLine = span != null ? lines.lineOf(span.from) : 0;
            int start = lines.start(firstLine);
            int openTo = lines.trimEnd(start, lines.end(firstLine));
            if (!"---".equals(source.substring(start, openTo))) {
                return null;
            }
            int closeLine = -1;
            for (int line = firstLine + 1; line < lines.count(); line++) {
                String content = source.substring(lines.start(line), lines.trimEnd(lines.start(line), lines.end(line)));
                if ("---".equals(content) || "...".equals(content)) {
                    closeLine = line;
                    break;
                }
            }
            if (closeLine < 0) {
                return null;
            }

            List<SyntaxTreeNode> children = new ArrayList<>();
            children.add(node(NodeKind.YAML_FRONTMATTER_START, start, openTo));
            if (closeLine > firstLine + 1) {
                children.add(node(NodeKind.CODE_TEXT, lines.start(firstLine + 1), lines.end(closeLine - 1)));
            }
            int closeTo = lines.trimEnd(lines.start(closeLine), lines.end(closeLine));
            children.add(node(NodeKind.YAML_FRONTMATTER_END, lines.start(closeLine), closeTo));
            return new SyntaxTreeNode(NodeKind.FENCED_CODE.getName(), start, closeTo, children);
        }

        private SyntaxTreeNode table(TableBlock table, Span span) {
            List<TableRow> rows = new ArrayList<>();
            collectRows(table, rows);

            int firstLine = lines.lineOf(span.from);
            int lastLine = lines.lineOf(Math.max(span.from, span.to - 1));
            List<SyntaxTreeNode> children = new ArrayList<>();
            int rowIndex = 0;
            for (int line = firstLine; line <= lastLine; line++) {
                int from = lines.skipBlanks(Math.max(span.from, lines.start(line)), lines.end(line));
                while (quoteMarks.contains(from)) {
                    quoteMarks.remove(from);
                    children.add(node(NodeKind.QUOTE_MARK, from, from + 1));
                    from = lines.skipBlanks(from + 1, lines.end(line));
                }
                int to = lines.trimEnd(from, Math.min(span.to, lines.end(line)));
                if (from >= to) continue;
                if (line == firstLine + 1) {
                    children.add(node(NodeKind.TABLE_DELIMITER, from, to));
                    continue;
                }
                TableRow row = rowIndex < rows.size() ? rows.get(rowIndex) : null;
                rowIndex++;
                String kind = line == firstLine ? NodeKind.TABLE_HEADER.getName() : NodeKind.TABLE_ROW.getName();
                children.add(tableRow(kind, new Span(from, to), row));
            }
            return container(NodeKind.TABLE.getName(), span, children);
        }

        private void collectRows(Node node, List<TableRow> rows) {
            for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TableRow row) {
                    rows.add(row);
                } else {
                    collectRows(child, rows);
                }
            }
        }

        private SyntaxTreeNode tableRow(String kind, Span span, TableRow row) {
            List<SyntaxTreeNode> inlines = new ArrayList<>();
            if (row != null) {
                for (Node cell = row.getFirstChild(); cell != null; cell = cell.getNext()) {
                    if (cell instanceof TableCell) {
                        inlines.addAll(childrenOf(cell));
                    }
                }
            }

            List<SyntaxTreeNode> cells = new ArrayList<>();
            for (Span cell : splitCells(span)) {
                List<SyntaxTreeNode> inside = new ArrayList<>();
                for (SyntaxTreeNode inline : inlines) {
                    if (inline.getFrom() >= cell.from && inline.getTo() <= cell.to) {
                        inside.add(inline);
                    }
                }
                cells.add(inline(NodeKind.TABLE_CELL.getName(), cell, new ArrayList<>(), inside));
            }
            return new SyntaxTreeNode(kind, span.from, span.to, cells);
        }

        /**
         * Non-empty cells of a row, split at pipes that are neither escaped nor inside a code span.
         */
        private List<Span> splitCells(Span row) {
            List<Span> cells = new ArrayList<>();
            int cellStart = row.from;
            int pos = row.from;
            while (pos < row.to) {
                char c = source.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                if (c == '`') {
                    int ticks = run(pos, row.to, '`');
                    int close = closingBackticks(pos + ticks, row.to, ticks);
                    pos = close >= 0 ? close + ticks : pos + ticks;
                    continue;
                }
                if (c == '|') {
                    addCell(cells, cellStart, pos);
                    cellStart = pos + 1;
                }
                pos++;
            }
            addCell(cells, cellStart, row.to);
            return cells;
        }

        private void addCell(List<Span> cells, int from, int to) {
            int start = lines.skipBlanks(from, to);
            int end = lines.trimEnd(start, to);
            if (start < end) {
                cells.add(new Span(start, end));
            }
        }

        // Inlines

        private SyntaxTreeNode delimited(Node node, Span span, NodeKind kind, NodeKind markKind, int width) {
            Span range = span;
            char c = range.from < source.length() ? source.charAt(range.from) : 0;
            if (c != '*' && c != '_' && c != '~' && range.from >= width) {
                // Some spans leave the delimiters out
                range = new Span(range.from - width, Math.min(source.length(), range.to + width));
            }
            List<SyntaxTreeNode> fixed = new ArrayList<>();
            fixed.add(node(markKind, range.from, range.from + width));
            if (range.to - width > range.from + width) {
                fixed.add(node(markKind, range.to - width, range.to));
            }
            return inline(kind.getName(), range, fixed, childrenOf(node));
        }

        private SyntaxTreeNode inlineCode(Span span) {
            int ticks = run(span.from, span.to, '`');
            if (ticks == 0 || span.to - span.from < 2 * ticks) {
                return node(NodeKind.INLINE_CODE, span.from, span.to);
            }
            return node(NodeKind.INLINE_CODE, span.from, span.to,
                    node(NodeKind.CODE_MARK, span.from, span.from + ticks),
                    node(NodeKind.CODE_MARK, span.to - ticks, span.to));
        }

        private SyntaxTreeNode link(Node link, Span span, boolean image) {
            if (span.from < source.length() && source.charAt(span.from) == '<') {
                return autolink(span);
            }
            int open = span.from;
            int textFrom = open + (image ? 2 : 1);
            int close = closingBracket(textFrom, span.to);
            if (close < 0) {
                return container(image ? NodeKind.IMAGE.getName() : NodeKind.LINK.getName(), span, childrenOf(link));
            }

            if (!image && source.startsWith("[^", open) && (close + 1 >= source.length() || source.charAt(close + 1) != '(')) {
                return node(NodeKind.FOOTNOTE, open, close + 1);
            }

            List<SyntaxTreeNode> children = new ArrayList<>();
            children.add(node(NodeKind.LINK_MARK, open, textFrom));
            for (SyntaxTreeNode inline : childrenOf(link)) {
                if (inline.getFrom() >= textFrom && inline.getTo() <= close) {
                    children.add(inline);
                }
            }
            children.add(node(NodeKind.LINK_MARK, close, close + 1));

            int end = Math.max(span.to, close + 1);
            int pos = close + 1;
            if (pos < source.length() && source.charAt(pos) == '(') {
                end = destination(pos, children);
            } else if (pos < source.length() && source.charAt(pos) == '[') {
                int labelClose = closingBracket(pos + 1, source.length());
                if (labelClose > 0) {
                    children.add(node(NodeKind.LINK_LABEL, pos, labelClose + 1));
                    end = Math.max(end, labelClose + 1);
                }
            }

            if (end < source.length() && source.charAt(end) == '{') {
                int attributeEnd = source.indexOf('}', end);
                int nextOpen = source.indexOf('{', end + 1);
                int lineEnd = lines.end(lines.lineOf(end));
                if (attributeEnd > end && attributeEnd < lineEnd && (nextOpen < 0 || nextOpen > attributeEnd)) {
                    children.add(node(NodeKind.PANDOC_ATTRIBUTE, end, attributeEnd + 1));
                    end = attributeEnd + 1;
                }
            }
            return container(image ? NodeKind.IMAGE.getName() : NodeKind.LINK.getName(), new Span(span.from, end), children);
        }

        /**
         * Reads {@code (url "title")} starting at the opening parenthesis and returns the offset
         * after the closing one.
         */
        private int destination(int open, List<SyntaxTreeNode> children) {
            children.add(node(NodeKind.LINK_MARK, open, open + 1));
            int pos = skipWhitespace(open + 1);
            if (pos < source.length() && source.charAt(pos) == '<') {
                int gt = pos + 1;
                while (gt < source.length() && source.charAt(gt) != '>' && source.charAt(gt) != '\n') {
                    gt += source.charAt(gt) == '\\' ? 2 : 1;
                }
                gt = Math.min(gt, source.length());
                if (gt > pos + 1) {
                    children.add(node(NodeKind.URL, pos + 1, gt));
                }
                pos = Math.min(source.length(), gt + 1);
            } else {
                int urlStart = pos;
                int depth = 0;
                while (pos < source.length()) {
                    char c = source.charAt(pos);
                    if (Character.isWhitespace(c)) break;
                    if (c == '\\') {
                        pos = Math.min(source.length(), pos + 2);
                        continue;
                    }
                    if (c == '(') depth++;
                    if (c == ')') {
                        if (depth == 0) break;
                        depth--;
                    }
                    pos++;
                }
                if (pos > urlStart) {
                    children.add(node(NodeKind.URL, urlStart, pos));
                }
            }

            pos = skipWhitespace(pos);
            if (pos < source.length() && "\"'(".indexOf(source.charAt(pos)) >= 0) {
                char closer = source.charAt(pos) == '(' ? ')' : source.charAt(pos);
                int end = pos + 1;
                while (end < source.length() && source.charAt(end) != closer) {
                    end += source.charAt(end) == '\\' ? 2 : 1;
                }
                if (end < source.length()) {
                    children.add(node(NodeKind.LINK_TITLE, pos, end + 1));
                    pos = skipWhitespace(end + 1);
                }
            }
            if (pos < source.length() && source.charAt(pos) == ')') {
                children.add(node(NodeKind.LINK_MARK, pos, pos + 1));
                return pos + 1;
            }
            return pos;
        }

        private SyntaxTreeNode autolink(Span span) {
            if (span.to - span.from < 2 || source.charAt(span.to - 1) != '>') {
                return node(NodeKind.AUTOLINK, span.from, span.to);
            }
            return node(NodeKind.AUTOLINK, span.from, span.to,
                    node(NodeKind.LINK_MARK, span.from, span.from + 1),
                    node(NodeKind.URL, span.from + 1, span.to - 1),
                    node(NodeKind.LINK_MARK, span.to - 1, span.to));
        }

        /**
         * Offset of the {@code ]} closing a bracket whose content starts at {@code from}, or -1.
         */
        private int closingBracket(int from, int limit) {
            int depth = 0;
            int pos = from;
            while (pos < limit) {
                char c = source.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                if (c == '`') {
                    int ticks = run(pos, limit, '`');
                    int close = closingBackticks(pos + ticks, limit, ticks);
                    pos = close >= 0 ? close + ticks : pos + ticks;
                    continue;
                }
                if (c == '[') depth++;
                if (c == ']') {
                    if (depth == 0) return pos;
                    depth--;
                }
                pos++;
            }
            return -1;
        }

        private int closingBackticks(int from, int limit, int ticks) {
            int pos = from;
            while (pos < limit) {
                if (source.charAt(pos) == '`') {
                    int length = run(pos, limit, '`');
                    if (length == ticks) return pos;
                    pos += length;
                } else {
                    pos++;
                }
            }
            return -1;
        }

        /**
         * Builds an inline container: the fixed mark nodes, the converted commonmark inlines, and
         * whatever the dialect scanner finds in the text still uncovered between them.
         */
        private SyntaxTreeNode inline(String kind, Span span, List<SyntaxTreeNode> fixed, List<SyntaxTreeNode> inlines) {
            List<SyntaxTreeNode> children = new ArrayList<>(fixed);
            children.addAll(inlines);
            children = settle(children);
            children.addAll(takeQuoteMarks(span, children));
            children = highlights(span, settle(children));

            List<SyntaxTreeNode> found = new ArrayList<>();
            int cursor = span.from;
            for (SyntaxTreeNode child : children) {
                found.addAll(scanner.scan(cursor, child.getFrom()));
                cursor = Math.max(cursor, child.getTo());
            }
            found.addAll(scanner.scan(cursor, span.to));
            children.addAll(found);
            return container(kind, span, children);
        }

        /**
         * Wraps {@code ==...==} pairs whose marks lie between {@code children} into Highlight
         * nodes, moving the children they enclose into the HighlightContent.
         */
        private List<SyntaxTreeNode> highlights(Span span, List<SyntaxTreeNode> children) {
            List<SyntaxTreeNode> result = new ArrayList<>(children);
            Matcher m = HIGHLIGHT.matcher(source);
            m.useTransparentBounds(true);
            int pos = span.from;
            while (pos < span.to && m.region(pos, span.to).find()) {
                int start = m.start();
                int end = m.end();
                List<SyntaxTreeNode> inside = enclosed(result, start, end);
                if (inside == null) {
                    pos = start + 1;
                    continue;
                }
                result.removeAll(inside);
                SyntaxTreeNode content = inline(NodeKind.HIGHLIGHT_CONTENT.getName(),
                        new Span(start + 2, end - 2), new ArrayList<>(), inside);
                result.add(new SyntaxTreeNode(NodeKind.HIGHLIGHT.getName(), start, end, List.of(
                        node(NodeKind.HIGHLIGHT_MARK, start, start + 2),
                        content,
                        node(NodeKind.HIGHLIGHT_MARK, end - 2, end))));
                pos = end;
            }
            return settle(result);
        }

        /**
         * The children lying within the content of {@code [start, end)}, or null when a child
         * straddles the range or one of its marks.
         */
        private static List<SyntaxTreeNode> enclosed(List<SyntaxTreeNode> children, int start, int end) {
            List<SyntaxTreeNode> inside = new ArrayList<>();
            for (SyntaxTreeNode child : children) {
                if (child.getTo() <= start || child.getFrom() >= end) continue;
                if (child.getFrom() >= start + 2 && child.getTo() <= end - 2) {
                    inside.add(child);
                } else {
                    return null;
                }
            }
            return inside;
        }

        /**
         * A node whose range grows to cover its children.
         */
        private SyntaxTreeNode container(String kind, Span span, List<SyntaxTreeNode> children) {
            List<SyntaxTreeNode> settled = settle(children);
            int from = span.from;
            int to = span.to;
            if (!settled.isEmpty()) {
                from = Math.min(from, settled.get(0).getFrom());
                to = Math.max(to, settled.get(settled.size() - 1).getTo());
            }
            return new SyntaxTreeNode(kind, from, to, settled);
        }

        /**
         * Sorts siblings by position and drops any that overlap an earlier one.
         */
        private static List<SyntaxTreeNode> settle(List<SyntaxTreeNode> nodes) {
            List<SyntaxTreeNode> sorted = new ArrayList<>(nodes);
            sorted.sort(Comparator.comparingInt(SyntaxTreeNode::getFrom).thenComparingInt(SyntaxTreeNode::getTo));
            List<SyntaxTreeNode> result = new ArrayList<>();
            int end = -1;
            for (SyntaxTreeNode node : sorted) {
                if (node.getFrom() < end) {
                    log.trace("Dropping {} overlapping a preceding sibling", node);
                    continue;
                }
                result.add(node);
                end = node.getTo();
            }
            return result;
        }

        // Positions

        private Span span(Node node) {
            List<SourceSpan> spans = node.getSourceSpans();
            if (spans == null || spans.isEmpty()) {
                return null;
            }
            SourceSpan first = spans.get(0);
            SourceSpan last = spans.get(spans.size() - 1);
            int from = lines.offset(first.getLineIndex(), first.getColumnIndex());
            int to = lines.offset(last.getLineIndex(), last.getColumnIndex()) + last.getLength();
            return new Span(from, Math.min(to, source.length()));
        }

        private boolean covered(List<SyntaxTreeNode> nodes, int offset) {
            for (SyntaxTreeNode node : nodes) {
                if (offset >= node.getFrom() && offset < node.getTo()) return true;
            }
            return false;
        }

        private int run(int from, int limit, char c) {
            int pos = from;
            while (pos < limit && source.charAt(pos) == c) pos++;
            return pos - from;
        }

        private int skipWhitespace(int from) {
            int pos = from;
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
            return pos;
        }

        private static List<SyntaxTreeNode> optional(SyntaxTreeNode node) {
            return node == null ? List.of() : List.of(node);
        }
    }
}
