package org.bindforge.io;

/**
 * Thrown when a library description can not be read or is malformed.
 */
public class LibraryLoadException extends Exception {

    public LibraryLoadException(String message) {
        super(message);
    }

    public LibraryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
