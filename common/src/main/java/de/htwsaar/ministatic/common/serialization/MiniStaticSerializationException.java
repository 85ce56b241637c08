package de.htwsaar.ministatic.common.serialization;

public class MiniStaticSerializationException extends RuntimeException {

    public MiniStaticSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
