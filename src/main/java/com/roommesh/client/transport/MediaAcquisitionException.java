package com.roommesh.client.transport;

public class MediaAcquisitionException extends RuntimeException {

    public MediaAcquisitionException(String message) {
        super(message);
    }

    public MediaAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
