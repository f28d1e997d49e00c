package org.stlint.analyzer.lint;

// what a check needs from its context, on top of the element it checks
public enum Requirement {
    SCOPE, SETTINGS, FLOW_GRAPHS
}
