package de.admir.unistore.core.error;

import lombok.ToString;

@ToString(callSuper = true)
public class AuthorizationError extends BaseError<AuthorizationError> {

    public AuthorizationError(Throwable e) {
        super(e);
    }

    public AuthorizationError(String message) {
        super(message);
    }
}
