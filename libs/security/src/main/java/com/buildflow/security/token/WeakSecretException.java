package com.buildflow.security.token;

/** Thrown at startup when the signing secret is missing, short or a known placeholder. */
public class WeakSecretException extends IllegalStateException {

    public WeakSecretException(String message) {
        super(message);
    }
}
