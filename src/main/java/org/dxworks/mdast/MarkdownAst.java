package org.dxworks.mdast;

import org.dxworks.mdast.citation.CitationExtractor;
import org.dxworks.mdast.citation.PandocCitationExtractor;
import org.dxworks.mdast.converter.MarkdownAstConverter;
import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.syntax.SyntaxNode;
import org.dxworks.mdast.syntax.commonmark.CommonmarkSyntaxTreeBuilder;

/**
 * Entry point for turning Markdown into an AST, either from text or from a syntax tree some
 * other parser produced.
 */
public class MarkdownAst {

    private final CommonmarkSyntaxTreeBuilder treeBuilder;
    private final MarkdownAstConverter converter;

    public MarkdownAst() {
        this(new PandocCitationExtractor());
    }

    public MarkdownAst(CitationExtractor citationExtractor) {
        this.treeBuilder = new CommonmarkSyntaxTreeBuilder();
        this.converter = new MarkdownAstConverter(citationExtractor);
    }

    public AstNode parse(String markdown) {
        return converter.convert(treeBuilder.parse(markdown), markdown);
    }

    public AstNode convert(SyntaxNode node, String source) {
        return converter.convert(node, source);
    }

    public CommonmarkSyntaxTreeBuilder getTreeBuilder() {
        return treeBuilder;
    }
}
