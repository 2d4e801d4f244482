package org.ovsm.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 验证条件在源文件中的位置。
 */
@Getter
public final class SourceLocation {

    private final String file;
    private final int line;
    private final int column;

    private final int hashCode;

    private SourceLocation(String file, int line, int column) {
        this.file = Objects.requireNonNull(file, "Source file cannot be null");
        this.line = line;
        this.column = column;
        this.hashCode = Objects.hash(file, line, column);
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceLocation that)) {
            return false;
        }
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
