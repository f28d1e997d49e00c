package org.stlint.analyzer.common.model;

public interface Expression extends Element {

    // source-like rendering, used in messages and flow-graph labels
    String text();
}
