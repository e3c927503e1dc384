package com.sitescout.core.config;

import java.nio.file.Path;

/** 설정 파일 없음/읽기 실패/형식 오류. */
public class ConfigException extends StartupException {
    private final Path source;

    public ConfigException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public ConfigException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path getSource() { return source; }
}
