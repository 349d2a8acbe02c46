package org.dxworks.mdast.live;

import org.dxworks.mdast.converter.MarkdownAstConverter;
import org.dxworks.mdast.model.Generic;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.dxworks.mdast.syntax.SyntaxTreeNode.node;
import static org.junit.jupiter.api.Assertions.*;

class LiveAstTest {

    private final LiveAst live = new LiveAst(new MarkdownAstConverter());

    @Test
    void update_PublishesNewVersions() {
        assertNull(live.get());

        LiveAst.Snapshot first = live.update(node("Paragraph", 0, 3), "one");
        LiveAst.Snapshot second = live.update(node("Paragraph", 0, 3), "two");

        assertEquals(1, first.version);
        assertEquals(2, second.version);
        assertSame(second, live.get());
        assertEquals("Paragraph", ((Generic) second.ast).kind);
    }

    @Test
    void update_BrokenTreeKeepsPreviousSnapshot() {
        LiveAst.Snapshot good = live.update(node("Paragraph", 0, 3), "one");

        LiveAst.Snapshot afterFailure = live.update(node("ZknLink", 0, 4), "[[]]");

        assertSame(good, afterFailure);
        assertSame(good, live.get());
    }

    @Test
    void update_BrokenFirstTreeLeavesNoSnapshot() {
        assertNull(live.update(node("ZknLink", 0, 4), "[[]]"));
        assertNull(live.get());
    }

    @Test
    void update_ConcurrentCallersGetDistinctVersions() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<LiveAst.Snapshot>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(pool.submit(() -> live.update(node("Paragraph", 0, 1), "x")));
            }
            for (Future<LiveAst.Snapshot> future : futures) {
                assertNotNull(future.get());
            }
        } finally {
            pool.shutdown();
        }
        assertEquals(20, live.get().version);
    }
}
