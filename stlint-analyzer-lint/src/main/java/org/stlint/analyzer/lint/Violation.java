package org.stlint.analyzer.lint;

import org.stlint.analyzer.common.model.Element;
import org.stlint.analyzer.common.model.Routine;
import org.stlint.analyzer.common.model.SourceMeta;

import java.nio.file.Path;

/*
What a check reports. The dispatcher turns it into a Finding: the position comes from meta, or
from the element; the source text from the routine given here, or from the active scope.
 */
public record Violation(String message, Element element, SourceMeta meta, Routine source, Path file) {

    public static Violation of(String message) {
        return new Violation(message, null, null, null, null);
    }

    public static Violation of(String message, Element element) {
        return new Violation(message, element, null, null, null);
    }

    public Violation withSource(Routine source) {
        return new Violation(message, element, meta, source, file);
    }

    public Violation withMeta(SourceMeta meta) {
        return new Violation(message, element, meta, source, file);
    }
}
