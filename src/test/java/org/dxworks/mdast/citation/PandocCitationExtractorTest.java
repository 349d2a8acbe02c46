package org.dxworks.mdast.citation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PandocCitationExtractorTest {

    private final PandocCitationExtractor extractor = new PandocCitationExtractor();

    @Test
    void extract_BracketedWithSeveralItems() {
        String code = "[see @doe2020, p. 4; -@roe, chap. 2]";
        List<CitationPosition> positions = extractor.extract(code);

        assertEquals(1, positions.size());
        CitationPosition position = positions.get(0);
        assertEquals(0, position.from);
        assertEquals(code.length(), position.to);
        assertFalse(position.composite);
        assertEquals(2, position.citations.size());

        CitationItem first = position.citations.get(0);
        assertEquals("doe2020", first.id);
        assertEquals("see", first.prefix);
        assertEquals("4", first.locator);
        assertEquals("page", first.label);
        assertFalse(first.suppressAuthor);

        CitationItem second = position.citations.get(1);
        assertEquals("roe", second.id);
        assertEquals("2", second.locator);
        assertEquals("chapter", second.label);
        assertTrue(second.suppressAuthor);
    }

    @Test
    void extract_InTextWithLocator() {
        List<CitationPosition> positions = extractor.extract("As @doe2020 [line 5] shows");

        assertEquals(1, positions.size());
        CitationPosition position = positions.get(0);
        assertTrue(position.composite);
        assertEquals(3, position.from);
        assertEquals(20, position.to);
        CitationItem item = position.citations.get(0);
        assertEquals("doe2020", item.id);
        assertEquals("5", item.locator);
        assertEquals("line", item.label);
    }

    @Test
    void extract_BracedKeyIsUnwrapped() {
        CitationItem item = extractor.extract("[@{doe:2020 x}]").get(0).citations.get(0);
        assertEquals("doe:2020 x", item.id);
    }

    @Test
    void extract_BareNumberIsPageAndRestIsSuffix() {
        CitationItem item = extractor.extract("[@doe 33-35 and elsewhere]").get(0).citations.get(0);
        assertEquals("33-35", item.locator);
        assertEquals("page", item.label);
        assertEquals("and elsewhere", item.suffix);
    }

    @Test
    void extract_NoLocator() {
        CitationItem item = extractor.extract("[@doe, emphasis mine]").get(0).citations.get(0);
        assertEquals("", item.locator);
        assertNull(item.label);
        assertEquals("emphasis mine", item.suffix);
    }

    @Test
    void extract_EmailIsNotACitation() {
        assertTrue(extractor.extract("mail me at someone@example.org").isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void extract_ResultsAreSortedByPosition() {
        List<CitationPosition> positions = extractor.extract("@first and [@second]");
        assertEquals(2, positions.size());
        assertEquals("first", positions.get(0).citations.get(0).id);
        assertEquals("second", positions.get(1).citations.get(0).id);
    }
}
