package com.agenthub.context.exception;

/**
 * 写超时：写入是否生效未知，调用方必须重新读取确认
 */
public class WriteOutcomeUnknownException extends BackendUnavailableException {

    public WriteOutcomeUnknownException(String backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
