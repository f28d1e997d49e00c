package org.stlint.analyzer.common;

import org.stlint.analyzer.common.model.Element;

/*
A name or expression could not be resolved in a way that indicates a problem in the analyzed code
(THIS outside a function block, an unsupported operator). Never fatal for a run: a rule may turn
it into a finding, otherwise the dispatcher logs it.
 */
public class ResolutionException extends AnalyzerException {

    public ResolutionException(Element element, String message) {
        super(element, message);
    }
}
