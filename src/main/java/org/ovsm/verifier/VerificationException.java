package org.ovsm.verifier;

/**
 * 验证门面的致命错误：输入 AST 不合法、输出目录不可写、证书无法序列化，
 * 或在要求验证通过时存在失败的验证条件。
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
