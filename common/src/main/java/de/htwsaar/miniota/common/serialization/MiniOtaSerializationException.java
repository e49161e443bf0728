package de.htwsaar.miniota.common.serialization;

public class MiniOtaSerializationException extends RuntimeException {

    public MiniOtaSerializationException(String message) {

        super(message);
    }

    public MiniOtaSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
