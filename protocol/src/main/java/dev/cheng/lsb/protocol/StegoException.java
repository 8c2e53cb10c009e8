package dev.cheng.lsb.protocol;

/**
 * Signals issues while reading, embedding into or extracting from a carrier image.
 */
public class StegoException extends Exception {
    public StegoException(String message) {
        super(message);
    }

    public StegoException(String message, Throwable cause) {
        super(message, cause);
    }
}
