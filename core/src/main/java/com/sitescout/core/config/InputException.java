package com.sitescout.core.config;

/** 병합 후 시드 또는 키워드가 하나도 없음. */
public class InputException extends StartupException {
    public InputException(String message) {
        super(message);
    }
}
