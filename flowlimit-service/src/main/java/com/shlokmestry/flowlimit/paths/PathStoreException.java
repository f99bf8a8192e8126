package com.shlokmestry.flowlimit.paths;

public class PathStoreException extends RuntimeException {

    public PathStoreException(String message) {
        super(message);
    }

    public PathStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
