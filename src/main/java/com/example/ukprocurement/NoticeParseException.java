package com.example.ukprocurement;

/**
 * Документ не разбирается как XML вообще
 */
public class NoticeParseException extends Exception {

    public NoticeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
