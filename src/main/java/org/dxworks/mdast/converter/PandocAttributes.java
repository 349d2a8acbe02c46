package org.dxworks.mdast.converter;

import java.util.Map;

/**
 * Parses Pandoc attribute blocks such as {@code {#intro .note .wide lang=en}}.
 * See https://pandoc.org/MANUAL.html#extension-attributes
 */
public final class PandocAttributes {

    public static final String ID = "id";
    public static final String CLASS = "class";

    private PandocAttributes() {
    }

    /**
     * Merges one attribute block into {@code attributes}. Classes accumulate, separated by a
     * space. Only the first id is kept. For any other key the last value wins. Tokens that are
     * none of these (e.g. {@code a=b=c}) are ignored.
     *
     * @param attributes the running attributes of a node, modified in place
     * @param block      the raw block, with or without its curly braces
     * @return the same map, for chaining
     */
    public static Map<String, String> merge(Map<String, String> attributes, String block) {
        String raw = block.trim();
        if (raw.startsWith("{")) raw = raw.substring(1);
        if (raw.endsWith("}")) raw = raw.substring(0, raw.length() - 1);

        for (String token : raw.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.startsWith(".")) {
                String className = token.substring(1);
                attributes.merge(CLASS, className, (previous, added) -> previous + " " + added);
            } else if (token.startsWith("#")) {
                attributes.putIfAbsent(ID, token.substring(1));
            } else if (token.contains("=")) {
                String[] parts = token.split("=", -1);
                if (parts.length == 2) {
                    attributes.put(parts[0], parts[1]);
                }
            }
        }
        return attributes;
    }
}
