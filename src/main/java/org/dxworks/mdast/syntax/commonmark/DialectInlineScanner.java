package org.dxworks.mdast.syntax.commonmark;

import org.dxworks.mdast.citation.PandocCitationExtractor;
import org.dxworks.mdast.syntax.NodeKind;
import org.dxworks.mdast.syntax.SyntaxTreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.mdast.syntax.SyntaxTreeNode.node;

/**
 * Finds the inline syntax CommonMark does not know about in runs of plain text:
 * {@code [[links]]}, {@code #tags}, {@code [^footnotes]}, {@code ==highlights==} and Pandoc
 * citations.
 */
final class DialectInlineScanner {

    private static final String KEY = PandocCitationExtractor.KEY;

    private static final Pattern INLINE = Pattern.compile(
            "(?<zkn>\\[\\[[^\\[\\]\\n]+]])"
                    + "|(?<footnote>\\[\\^[^\\[\\]\\n]+](?!:))"
                    + "|(?<citation>\\[[^\\[\\]\\n]*-?@" + KEY + "[^\\[\\]\\n]*])"
                    + "|(?<highlight>==(?=[^\\s=])[^=\\n]*[^\\s=]==)"
                    + "|(?<tag>(?<![\\p{L}\\p{N}_#&\\\\])#(?!\\d+(?![\\p{L}_]))[\\p{L}\\p{N}_][\\p{L}\\p{N}_\\-]*)"
                    + "|(?<intext>(?<![\\w@\\[\\\\])-?@" + KEY + "(?:[ \\t]\\[(?!\\^)[^\\[\\]@\\n]*])?)");

    private final String source;

    DialectInlineScanner(String source) {
        this.source = source;
    }

    List<SyntaxTreeNode> scan(int from, int to) {
        List<SyntaxTreeNode> nodes = new ArrayList<>();
        if (from >= to) {
            return nodes;
        }
        Matcher m = INLINE.matcher(source);
        m.region(from, to);
        m.useTransparentBounds(true);
        m.useAnchoringBounds(false);
        while (m.find()) {
            int start = m.start();
            int end = m.end();
            if (m.group("zkn") != null) {
                nodes.add(node(NodeKind.ZKN_LINK, start, end,
                        node(NodeKind.ZKN_LINK_CONTENT, start + 2, end - 2)));
            } else if (m.group("footnote") != null) {
                nodes.add(node(NodeKind.FOOTNOTE, start, end));
            } else if (m.group("citation") != null || m.group("intext") != null) {
                nodes.add(node(NodeKind.CITATION, start, end));
            } else if (m.group("highlight") != null) {
                List<SyntaxTreeNode> inner = scan(start + 2, end - 2);
                nodes.add(node(NodeKind.HIGHLIGHT, start, end,
                        node(NodeKind.HIGHLIGHT_MARK, start, start + 2),
                        new SyntaxTreeNode(NodeKind.HIGHLIGHT_CONTENT.getName(), start + 2, end - 2, inner),
                        node(NodeKind.HIGHLIGHT_MARK, end - 2, end)));
            } else if (m.group("tag") != null) {
                nodes.add(node(NodeKind.ZKN_TAG, start, end));
            }
        }
        return nodes;
    }
}
