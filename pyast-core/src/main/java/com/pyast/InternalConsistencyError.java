package com.pyast;

/**
 * Thrown when an upstream pass hands this library something it can never legitimately produce:
 * a node missing a required child, an operator outside the category an operation accepts, or a
 * node kind asked for a property it does not have.
 *
 * <p>These are bugs in the caller, not user errors, so this extends {@link Error} and is never
 * caught inside the library.</p>
 */
public class InternalConsistencyError extends Error {

    public InternalConsistencyError(String message) {
        super(message);
    }

    public InternalConsistencyError(String message, Throwable cause) {
        super(message, cause);
    }
}
