package org.truetranslation.sword.core.reference;

public class ReferenceUnavailableException extends Exception {
    public ReferenceUnavailableException(String message) {
        super(message);
    }
}
