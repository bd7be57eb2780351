package org.pragmatica.structlab.grammar;

import org.pragmatica.structlab.syntax.SourceSpan;

/**
 * A grammar rule: Name <- Expression
 */
public record Rule(
 SourceSpan span,
 String name,
 Expression expression) {}
