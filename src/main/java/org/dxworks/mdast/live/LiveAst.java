package org.dxworks.mdast.live;

import org.dxworks.mdast.converter.ConversionException;
import org.dxworks.mdast.converter.MarkdownAstConverter;
import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest AST of a document that keeps changing, such as one open in an editor. Every update
 * converts the whole tree again; a tree that cannot be converted leaves the previous snapshot
 * in place.
 */
public class LiveAst {

    private static final Logger log = LoggerFactory.getLogger(LiveAst.class);

    private final MarkdownAstConverter converter;
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public LiveAst(MarkdownAstConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    /**
     * Converts {@code tree} and publishes it as the new snapshot.
     *
     * @return the snapshot in effect afterwards, which is the previous one (or {@code null})
     * when the conversion failed
     */
    public Snapshot update(SyntaxNode tree, String source) {
        AstNode ast;
        try {
            ast = converter.convert(tree, source);
        } catch (ConversionException e) {
            Snapshot previous = current.get();
            log.warn("Keeping AST version {}: {} at [{}, {}): {}",
                    previous != null ? previous.version : 0, e.getNodeKind(), e.getFrom(), e.getTo(),
                    e.getMessage());
            return previous;
        }
        return current.updateAndGet(previous ->
                new Snapshot(ast, previous != null ? previous.version + 1 : 1));
    }

    /** The latest snapshot, or {@code null} before the first successful update. */
    public Snapshot get() {
        return current.get();
    }

    public static final class Snapshot {
        public final AstNode ast;
        public final long version;

        Snapshot(AstNode ast, long version) {
            this.ast = ast;
            this.version = version;
        }
    }
}
