package com.sitescout.core.config;

/** 크롤 시작 전 종료 사유. 이 예외가 나면 크롤을 시도하지 않는다. */
public abstract class StartupException extends Exception {
    protected StartupException(String message) {
        super(message);
    }

    protected StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
