package org.pragmatica.plc.model;

import org.pragmatica.plc.ast.CompilationUnit;

/**
 * A parsed source file: its name, text and syntax tree. Bodies in the model are cut from the text.
 */
public record SourceFile(String name, String text, CompilationUnit unit) {}
