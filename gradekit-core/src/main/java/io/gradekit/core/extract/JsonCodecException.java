package io.gradekit.core.extract;

import java.io.Serial;

/// Thrown when a response declared as JSON cannot be read as a JSON object.
public class JsonCodecException extends Exception {

    @Serial private static final long serialVersionUID = 4183920175529376014L;

    public JsonCodecException(String message) {
        super(message);
    }

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
