package org.stlint.analyzer.common.model;

/*
anything a lint check can be registered for: statements, expressions, and the named units
(function blocks, methods, properties, declarations)
 */
public interface Element {

    // null when the parser could not provide position information
    SourceMeta meta();

    Shape<?> shape();
}
