package de.admir.unistore.core.error;

import lombok.ToString;


@ToString(callSuper = true)
public class IOError extends BaseError<IOError> {

    public IOError(Throwable e) {
        super(e);
    }

    public IOError(String message) {
        super(message);
    }
}
