package org.ovsm.ast;

import lombok.Getter;

import java.util.List;

@Getter
public final class CatchClause {

    private final String errorType;
    private final String variable;
    private final List<Statement> body;

    private CatchClause(String errorType, String variable, List<Statement> body) {
        this.errorType = errorType;
        this.variable = variable;
        this.body = List.copyOf(body);
    }

    public static CatchClause of(String errorType, String variable, List<Statement> body) {
        return new CatchClause(errorType, variable, body);
    }

    public static CatchClause catchAll(List<Statement> body) {
        return new CatchClause(null, null, body);
    }
}
