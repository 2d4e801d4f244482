package org.ovsm.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 工具调用的实参，可带关键字名。
 */
@Getter
public final class Argument {

    // 位置参数为 null
    private final String name;
    private final Expression value;

    private Argument(String name, Expression value) {
        this.name = name;
        this.value = Objects.requireNonNull(value, "Argument value cannot be null");
    }

    public static Argument positional(Expression value) {
        return new Argument(null, value);
    }

    public static Argument named(String name, Expression value) {
        Objects.requireNonNull(name, "Argument name cannot be null");
        return new Argument(name, value);
    }

    public boolean isNamed() {
        return name != null;
    }

    @Override
    public String toString() {
        return name == null ? value.toString() : ":" + name + " " + value;
    }
}
