package com.helixvision.server.vision;

public class DecodeException extends RuntimeException {

    private final String source;

    public DecodeException(String source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public DecodeException(String source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
