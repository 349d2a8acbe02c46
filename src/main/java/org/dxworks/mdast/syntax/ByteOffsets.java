package org.dxworks.mdast.syntax;

import java.nio.charset.StandardCharsets;

/**
 * Translates UTF-8 byte offsets, as reported by tree-sitter, into {@code String} indices.
 * Java strings count UTF-16 code units, so the two only agree for ASCII text.
 */
public final class ByteOffsets {

    private final int[] charIndexByByte;
    private final int byteLength;

    private ByteOffsets(int[] charIndexByByte, int byteLength) {
        this.charIndexByByte = charIndexByByte;
        this.byteLength = byteLength;
    }

    public static ByteOffsets of(String source) {
        int byteLength = source.getBytes(StandardCharsets.UTF_8).length;
        int[] index = new int[byteLength + 1];
        int bytePos = 0;
        int charPos = 0;
        while (charPos < source.length()) {
            int codePoint = source.codePointAt(charPos);
            int charCount = Character.charCount(codePoint);
            // Lone surrogates are encoded as a single replacement byte
            int byteCount = Character.isSurrogate((char) codePoint) && codePoint < 0x10000 ? 1 : utf8Length(codePoint);
            // Offsets pointing into the middle of a multi-byte sequence map to the character start
            for (int b = 0; b < byteCount; b++) {
                index[bytePos + b] = charPos;
            }
            bytePos += byteCount;
            charPos += charCount;
        }
        index[byteLength] = source.length();
        return new ByteOffsets(index, byteLength);
    }

    public int toCharIndex(int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= byteLength) return charIndexByByte[byteLength];
        return charIndexByByte[byteOffset];
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }
}
