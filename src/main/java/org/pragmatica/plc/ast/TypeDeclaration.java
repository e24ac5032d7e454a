package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.Optional;

/**
 * {@code Name : TypeSpec [:= init];} inside a {@code TYPE ... END_TYPE} block.
 */
public record TypeDeclaration(SourceSpan span, String name, TypeSpec type, Optional<Expression> initialValue) {}
