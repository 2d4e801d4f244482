package org.ovsm.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 语句在源文件中的位置 (行、列均从 1 开始)。
 */
@Getter
public final class SourceSpan {

    public static final SourceSpan START = new SourceSpan(1, 1);

    private final int line;
    private final int column;

    private SourceSpan(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public static SourceSpan of(int line, int column) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Source position must be 1-based, got " + line + ":" + column);
        }
        return new SourceSpan(line, column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceSpan that)) {
            return false;
        }
        return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
