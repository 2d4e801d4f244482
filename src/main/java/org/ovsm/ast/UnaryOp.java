package org.ovsm.ast;

public enum UnaryOp {
    NEG,
    NOT
}
