package org.pragmatica.plc.tree;

/**
 * Renders a one-line source excerpt with a gutter and an underline below the offending range:
 * <pre>
 * error: unexpected token
 *  --> 3:7
 *   |
 * 3 | x := := 1;
 *   |      ^^
 * </pre>
 */
public final class SourceExcerpt {
    private SourceExcerpt() {}

    public static String render(String header, SourceSpan span, String source) {
        var sb = new StringBuilder();
        var location = span.startLocation(source);
        var lineText = location.lineText(source);
        var gutter = String.valueOf(location.line());
        var pad = " ".repeat(gutter.length());

        sb.append(header).append("\n");
        sb.append(pad).append("--> ").append(location).append("\n");
        sb.append(pad).append(" |\n");
        sb.append(gutter).append(" | ").append(lineText).append("\n");

        int startCol = location.column() - 1;
        int remaining = Math.max(1, lineText.length() - startCol);
        int width = Math.max(1, Math.min(span.extract(source).length(), remaining));

        sb.append(pad).append(" | ")
          .append(" ".repeat(Math.max(0, startCol)))
          .append("^".repeat(width));
        return sb.toString();
    }
}
