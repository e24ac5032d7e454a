package org.pragmatica.plc.ast;

import java.util.OptionalInt;

/**
 * A memory-mapped location such as {@code %IX0.3}, {@code %QW4} or {@code %MD100}.
 *
 * @param area       memory area
 * @param size       access width; {@link Size#BIT} when the size letter is omitted
 * @param byteOffset byte offset within the area
 * @param bit        bit number for bit addresses
 * @param text       original spelling
 */
public record DirectAddress(Area area, Size size, int byteOffset, OptionalInt bit, String text) {

    public enum Area {
        INPUT('I'),
        OUTPUT('Q'),
        MEMORY('M'),
        PERIPHERAL('P');

        private final char letter;

        Area(char letter) {
            this.letter = letter;
        }

        public char letter() {
            return letter;
        }

        public static Area fromLetter(char ch) {
            for (var area : values()) {
                if (area.letter == Character.toUpperCase(ch)) {
                    return area;
                }
            }
            return null;
        }
    }

    public enum Size {
        BIT('X'),
        BYTE('B'),
        WORD('W'),
        DWORD('D'),
        LWORD('L');

        private final char letter;

        Size(char letter) {
            this.letter = letter;
        }

        public char letter() {
            return letter;
        }

        public static Size fromLetter(char ch) {
            for (var size : values()) {
                if (size.letter == Character.toUpperCase(ch)) {
                    return size;
                }
            }
            return null;
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
