package org.stlint.analyzer.common;

import org.stlint.analyzer.common.model.Element;

public class AnalyzerException extends RuntimeException {
    private final Element element;

    public AnalyzerException(Element element, String message) {
        super(message);
        this.element = element;
    }

    public AnalyzerException(Element element, Throwable throwable) {
        super(throwable);
        this.element = element;
    }

    // may be null when the problem is not tied to a single element
    public Element getElement() {
        return element;
    }
}
