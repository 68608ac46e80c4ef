package com.minipivot.common;

/**
 * 透视计算过程中的非预期异常，由会话层捕获并转为 ERROR 状态。
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
