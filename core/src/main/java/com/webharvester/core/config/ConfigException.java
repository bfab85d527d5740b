package com.webharvester.core.config;

/** 필수 설정 누락/무효. 시작 시점에만 발생하며 fetch 전에 프로세스를 끝낸다. */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
