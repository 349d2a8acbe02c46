package org.dxworks.mdast.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Small helpers for reading syntax trees.
 */
public final class SyntaxNodes {

    private SyntaxNodes() {
    }

    /**
     * Verbatim source text of a node, or {@code null} for a missing node.
     */
    public static String text(String source, SyntaxNode node) {
        if (node == null) return null;
        return text(source, node.getFrom(), node.getTo());
    }

    /**
     * Source text of {@code [from, to)}, clamped to the source. An empty or inverted range
     * yields an empty string.
     */
    public static String text(String source, int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(source.length(), to);
        if (start >= end) return "";
        return source.substring(start, end);
    }

    public static boolean isKind(SyntaxNode node, NodeKind kind) {
        return node != null && kind.getName().equals(node.getKind());
    }

    public static SyntaxNode findFirstChild(SyntaxNode parent, NodeKind kind) {
        if (parent == null) return null;
        return parent.getChild(kind.getName());
    }

    public static List<SyntaxNode> findAllChildren(SyntaxNode parent, NodeKind kind) {
        if (parent == null) return new ArrayList<>();
        return parent.getChildren(kind.getName());
    }

    public static SyntaxNode findFirstDescendant(SyntaxNode root, String kind) {
        if (root == null) return null;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (kind.equals(node.getKind())) {
                return node;
            }
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return null;
    }

    public static List<SyntaxNode> findAllDescendants(SyntaxNode root, String kind) {
        List<SyntaxNode> result = new ArrayList<>();
        if (root == null) return result;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (kind.equals(node.getKind())) {
                result.add(node);
            }
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Renders a tree as an indented outline, one node per line. Useful in test failures and
     * debug logs.
     */
    public static String outline(SyntaxNode root) {
        StringBuilder out = new StringBuilder();
        outline(root, 0, out);
        return out.toString();
    }

    private static void outline(SyntaxNode node, int depth, StringBuilder out) {
        out.append("  ".repeat(depth))
                .append(node.getKind())
                .append(" [").append(node.getFrom()).append(", ").append(node.getTo()).append(")\n");
        for (SyntaxNode child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            outline(child, depth + 1, out);
        }
    }
}
