package org.stlint.analyzer.common.model;

import java.util.ArrayList;
import java.util.List;

public record CaseStatement(Expression expression, List<Case> cases, StatementList elseStatements,
                            SourceMeta meta) implements Statement {

    // one label group: 1, 2, 5..7: or E_Mode.Idle:
    public record Case(List<Expression> matches, StatementList statements) {
        public Case {
            matches = List.copyOf(matches);
        }
    }

    public CaseStatement {
        cases = List.copyOf(cases);
    }

    public boolean hasElse() {
        return elseStatements != null;
    }

    @Override
    public List<StatementList> subBlocks() {
        List<StatementList> list = new ArrayList<>();
        cases.forEach(c -> list.add(c.statements()));
        if (elseStatements != null) list.add(elseStatements);
        return list;
    }

    @Override
    public Shape<?> shape() {
        return Shape.CASE;
    }
}
