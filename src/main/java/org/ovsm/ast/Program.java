package org.ovsm.ast;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 解析后的程序：顶层语句序列。
 */
@Getter
public final class Program {

    private final List<Statement> statements;

    private Program(List<Statement> statements) {
        Objects.requireNonNull(statements, "Program statements cannot be null");
        for (Statement statement : statements) {
            Objects.requireNonNull(statement, "Program statement cannot be null");
        }
        this.statements = List.copyOf(statements);
    }

    public static Program of(List<Statement> statements) {
        return new Program(statements);
    }

    public static Program of(Statement... statements) {
        return new Program(Arrays.asList(statements));
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
