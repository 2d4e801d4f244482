package org.ovsm.bridge;

import lombok.Getter;

import java.util.Objects;

/**
 * Lean 输出的一条诊断：file:line:col: severity: message。
 */
@Getter
public final class LeanMessage {

    public enum Severity {
        ERROR,
        WARNING,
        INFO;

        public static Severity parse(String text) {
            return switch (text) {
                case "error" -> ERROR;
                case "warning" -> WARNING;
                default -> INFO;
            };
        }
    }

    private final String file;
    private final int line;
    private final int column;
    private final Severity severity;
    private final String message;

    private LeanMessage(String file, int line, int column, Severity severity, String message) {
        this.file = Objects.requireNonNull(file, "File cannot be null");
        this.line = line;
        this.column = column;
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public static LeanMessage of(String file, int line, int column, Severity severity, String message) {
        return new LeanMessage(file, line, column, severity, message);
    }

    /**
     * 无法解析位置的输出整体作为一条错误。
     */
    public static LeanMessage generic(String message) {
        return new LeanMessage("", 0, 0, Severity.ERROR, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LeanMessage that)) {
            return false;
        }
        return line == that.line && column == that.column && severity == that.severity
                && file.equals(that.file) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column, severity, message);
    }

    @Override
    public String toString() {
        return file.isEmpty() ? message : file + ":" + line + ":" + column + ": " + message;
    }
}
