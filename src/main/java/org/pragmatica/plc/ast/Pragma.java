package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

/**
 * A brace-delimited annotation, e.g. {@code { S7_Optimized_Access := 'TRUE' }}. Content is kept verbatim.
 */
public record Pragma(SourceSpan span, String content) {}
