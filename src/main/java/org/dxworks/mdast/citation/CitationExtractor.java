package org.dxworks.mdast.citation;

import java.util.List;

/**
 * Parses the raw code of a citation, e.g. {@code [see @doe2020, p. 4; @roe]}, into structured
 * citations. Returns an empty list when the code holds no citation.
 */
@FunctionalInterface
public interface CitationExtractor {

    List<CitationPosition> extract(String code);
}
