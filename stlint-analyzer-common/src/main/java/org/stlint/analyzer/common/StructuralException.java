package org.stlint.analyzer.common;

import org.stlint.analyzer.common.model.Element;

/*
The statement structure cannot be turned into a flow graph: EXIT or CONTINUE outside a loop, JMP.
Points at a gap between parser and analyzer rather than at a problem in the analyzed code;
aborts the analysis.
 */
public class StructuralException extends AnalyzerException {

    public StructuralException(Element element, String message) {
        super(element, message);
    }
}
