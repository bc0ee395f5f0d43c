package com.pagereader.core.correction.engine;

/** Движок не поднялся при старте: соответствующий проход отключается до конца жизни конвейера. */
public class CapabilityUnavailableException extends RuntimeException {
    public CapabilityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
