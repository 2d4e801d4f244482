package org.ovsm.bridge;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 一次外部检查的结果。工具缺失和超时都不是异常，而是结果的一种。
 */
@Getter
public final class LeanResult {

    public enum Kind {
        SUCCESS,
        ERRORS,
        TIMEOUT,
        NOT_AVAILABLE
    }

    private static final LeanResult SUCCESS = new LeanResult(Kind.SUCCESS, List.of(), "");
    private static final LeanResult TIMEOUT = new LeanResult(Kind.TIMEOUT, List.of(), "Verification timed out");

    private final Kind kind;
    private final List<LeanMessage> messages;
    private final String reason;

    private LeanResult(Kind kind, List<LeanMessage> messages, String reason) {
        this.kind = kind;
        this.messages = List.copyOf(messages);
        this.reason = reason;
    }

    public static LeanResult success() {
        return SUCCESS;
    }

    public static LeanResult errors(List<LeanMessage> messages) {
        Objects.requireNonNull(messages, "Messages cannot be null");
        return new LeanResult(Kind.ERRORS, messages, "");
    }

    public static LeanResult timeout() {
        return TIMEOUT;
    }

    public static LeanResult notAvailable(String reason) {
        return new LeanResult(Kind.NOT_AVAILABLE, List.of(), Objects.requireNonNull(reason, "Reason cannot be null"));
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public List<LeanMessage> getErrors() {
        return messages.stream().filter(LeanMessage::isError).toList();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "LeanResult{success}";
            case ERRORS -> "LeanResult{errors=" + messages + "}";
            case TIMEOUT -> "LeanResult{timeout}";
            case NOT_AVAILABLE -> "LeanResult{not available: " + reason + "}";
        };
    }
}
