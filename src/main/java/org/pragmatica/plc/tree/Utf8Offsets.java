package org.pragmatica.plc.tree;

/**
 * Maps between character indices of a Java string and byte offsets into its UTF-8 encoding.
 * Spans are byte offsets; scanning happens over characters.
 */
public final class Utf8Offsets {
    private final int length;
    // byte offset of each character index, null when the text is ASCII
    private final int[] byteAt;

    private Utf8Offsets(int length, int[] byteAt) {
        this.length = length;
        this.byteAt = byteAt;
    }

    public static Utf8Offsets of(String text) {
        int n = text.length();
        int i = 0;

        while (i < n && text.charAt(i) < 0x80) {
            i++;
        }
        if (i == n) {
            return new Utf8Offsets(n, null);
        }

        var byteAt = new int[n + 1];
        int bytes = 0;

        for (int k = 0; k < n; k++) {
            byteAt[k] = bytes;
            bytes += encodedLength(text, k);
        }
        byteAt[n] = bytes;
        return new Utf8Offsets(n, byteAt);
    }

    /**
     * UTF-8 length of the text, without building the offset table.
     */
    public static int byteLength(String text) {
        int bytes = 0;

        for (int k = 0; k < text.length(); k++) {
            bytes += encodedLength(text, k);
        }
        return bytes;
    }

    public int byteLength() {
        return byteAt == null ? length : byteAt[length];
    }

    /**
     * Byte offset of a character index. Indices past the end map to the total byte length.
     */
    public int byteOffset(int charIndex) {
        int index = Math.min(Math.max(charIndex, 0), length);
        return byteAt == null ? index : byteAt[index];
    }

    /**
     * Character index of a byte offset. An offset inside a multi-byte sequence maps to the character that contains it.
     */
    public int charIndex(int byteOffset) {
        if (byteAt == null) {
            return Math.min(Math.max(byteOffset, 0), length);
        }
        if (byteOffset >= byteAt[length]) {
            return length;
        }
        int low = 0;
        int high = length;

        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (byteAt[mid] <= byteOffset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        // the high half of a surrogate pair shares its offset with the low half
        while (low > 0 && byteAt[low - 1] == byteAt[low]) {
            low--;
        }
        return low;
    }

    private static int encodedLength(String text, int index) {
        char c = text.charAt(index);

        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800) {
            return 2;
        }
        if (Character.isHighSurrogate(c) && index + 1 < text.length() && Character.isLowSurrogate(text.charAt(index + 1))) {
            return 0;
        }
        if (Character.isLowSurrogate(c) && index > 0 && Character.isHighSurrogate(text.charAt(index - 1))) {
            return 4;
        }
        return 3;
    }
}
