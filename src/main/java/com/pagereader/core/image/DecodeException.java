package com.pagereader.core.image;

/** Изображение не удалось прочитать/декодировать. Повтор для того же файла бессмысленен. */
public class DecodeException extends RuntimeException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
