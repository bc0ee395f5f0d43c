package com.pagereader.core.correction.engine;

/** Отдельный вызов движка упал или не уложился в таймаут. */
public class CapabilityCallException extends RuntimeException {
    public CapabilityCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
