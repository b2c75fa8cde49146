package com.example.connectionmonitor.exception;

/**
 * Encryption or decryption of a stored credential failed.
 * The message never contains the credential itself.
 */
public class CredentialCipherException extends RuntimeException {

    public CredentialCipherException(String message, Throwable cause) {
        super(message, cause);
    }

    public CredentialCipherException(String message) {
        super(message);
    }
}
