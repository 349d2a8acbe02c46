package org.dxworks.mdast.citation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts citations written in Pandoc syntax.
 *
 * <ul>
 *   <li>Bracketed: {@code [see @doe2020, p. 4; -@roe, chap. 2]}</li>
 *   <li>In-text: {@code @doe2020} or {@code @doe2020 [p. 4]}</li>
 * </ul>
 *
 * Keys may be wrapped in braces ({@code @{doe:2020}}) to allow any characters. Database lookups
 * are left to the consumer; only the syntax is parsed here.
 */
public class PandocCitationExtractor implements CitationExtractor {

    /** A citation key without its {@code @}. Internal punctuation must be followed by a key character. */
    public static final String KEY =
            "(?:\\{[^{}]+}|[\\p{L}\\p{N}_](?:[\\p{L}\\p{N}_]|[:.#$%&\\-+?<>~/](?=[\\p{L}\\p{N}_]))*)";

    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\[\\]]*-?@" + KEY + "[^\\[\\]]*)]");
    private static final Pattern IN_TEXT = Pattern.compile("(?<![\\w@])(-?)@(" + KEY + ")(?:\\s+\\[([^\\[\\]@]*)])?");
    private static final Pattern CITE_KEY = Pattern.compile("(-?)@(" + KEY + ")");

    private static final Pattern LABELLED_LOCATOR = Pattern.compile(
            "^(pages|page|pp|p|chapter|chap|section|sec|figures|figure|figs|fig|volume|vol|line|ll|l|note|n|paragraph|para)\\.?\\s*"
                    + "([0-9ivxlcdm]+(?:\\s*[-–,]\\s*[0-9ivxlcdm]+)*)(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BARE_LOCATOR = Pattern.compile(
            "^([0-9]+(?:\\s*[-–,]\\s*[0-9]+)*)(.*)$", Pattern.DOTALL);

    private static final Map<String, String> LABELS = Map.ofEntries(
            Map.entry("p", "page"), Map.entry("pp", "page"), Map.entry("page", "page"), Map.entry("pages", "page"),
            Map.entry("chap", "chapter"), Map.entry("chapter", "chapter"),
            Map.entry("sec", "section"), Map.entry("section", "section"),
            Map.entry("fig", "figure"), Map.entry("figs", "figure"), Map.entry("figure", "figure"),
            Map.entry("vol", "volume"), Map.entry("volume", "volume"),
            Map.entry("l", "line"), Map.entry("ll", "line"), Map.entry("line", "line"),
            Map.entry("n", "note"), Map.entry("note", "note"),
            Map.entry("para", "paragraph"), Map.entry("paragraph", "paragraph"));

    @Override
    public List<CitationPosition> extract(String code) {
        List<CitationPosition> positions = new ArrayList<>();
        if (code == null || code.isEmpty()) {
            return positions;
        }

        Matcher bracketed = BRACKETED.matcher(code);
        while (bracketed.find()) {
            List<CitationItem> items = new ArrayList<>();
            for (String part : bracketed.group(1).split(";")) {
                CitationItem item = parseBracketedPart(part);
                if (item != null) {
                    items.add(item);
                }
            }
            if (!items.isEmpty()) {
                positions.add(new CitationPosition(bracketed.start(), bracketed.end(), false, items));
            }
        }

        Matcher inText = IN_TEXT.matcher(code);
        while (inText.find()) {
            if (insideAny(positions, inText.start())) {
                continue;
            }
            String locatorPart = inText.group(3) != null ? inText.group(3) : "";
            Locator locator = parseLocator(locatorPart.trim());
            CitationItem item = new CitationItem(unwrapKey(inText.group(2)), "", locator.suffix,
                    locator.locator, locator.label, "-".equals(inText.group(1)));
            positions.add(new CitationPosition(inText.start(), inText.end(), true, List.of(item)));
        }

        positions.sort(Comparator.comparingInt(p -> p.from));
        return positions;
    }

    private CitationItem parseBracketedPart(String part) {
        Matcher key = CITE_KEY.matcher(part);
        if (!key.find()) {
            return null;
        }
        String prefix = part.substring(0, key.start()).trim();
        String rest = part.substring(key.end()).trim();
        if (rest.startsWith(",")) {
            rest = rest.substring(1).trim();
        }
        Locator locator = parseLocator(rest);
        return new CitationItem(unwrapKey(key.group(2)), prefix, locator.suffix, locator.locator,
                locator.label, "-".equals(key.group(1)));
    }

    static Locator parseLocator(String text) {
        if (text.isEmpty()) {
            return new Locator("", null, "");
        }
        Matcher labelled = LABELLED_LOCATOR.matcher(text);
        if (labelled.matches()) {
            String label = LABELS.get(labelled.group(1).toLowerCase(Locale.ROOT));
            return new Locator(labelled.group(2), label, labelled.group(3).trim());
        }
        Matcher bare = BARE_LOCATOR.matcher(text);
        if (bare.matches()) {
            return new Locator(bare.group(1), "page", bare.group(2).trim());
        }
        return new Locator("", null, text);
    }

    private static String unwrapKey(String key) {
        if (key.startsWith("{") && key.endsWith("}")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }

    private static boolean insideAny(List<CitationPosition> positions, int offset) {
        for (CitationPosition position : positions) {
            if (offset >= position.from && offset < position.to) {
                return true;
            }
        }
        return false;
    }

    static final class Locator {
        final String locator;
        final String label;
        final String suffix;

        Locator(String locator, String label, String suffix) {
            this.locator = locator;
            this.label = label;
            this.suffix = suffix;
        }
    }
}
