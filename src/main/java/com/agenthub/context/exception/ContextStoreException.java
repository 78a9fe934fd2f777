package com.agenthub.context.exception;

/**
 * 上下文存储异常基类
 * 鉴权拒绝、冲突拒绝、未找到均不是异常，以普通返回值表达
 */
public class ContextStoreException extends RuntimeException {

    public ContextStoreException(String message) {
        super(message);
    }

    public ContextStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
