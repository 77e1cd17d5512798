package com.loadforecast.exception;

import lombok.Getter;

@Getter
public abstract class LoadForecastException extends RuntimeException {
    private final String errorCode;
    protected LoadForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected LoadForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
