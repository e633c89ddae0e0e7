package de.admir.unistore.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.ToString;


@ToString
public abstract class BaseError<E extends BaseError<E>> implements CoreError {
    private final String message;
    private List<CoreError> nestedErrors;
    @ToString.Exclude
    private Throwable cause;

    protected BaseError(String message, List<CoreError> nestedErrors) {
        this.message = message;
        this.nestedErrors = nestedErrors == null ? null : new ArrayList<>(nestedErrors);
    }

    protected BaseError(Throwable e) {
        this.message = e.toString();
        this.cause = e;
    }

    protected BaseError(String message, Throwable cause) {
        this.message = message;
        this.cause = cause;
    }

    protected BaseError(String message) {
        this.message = message;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public List<CoreError> getNestedErrors() {
        return nestedErrors == null ? Collections.emptyList() : Collections.unmodifiableList(nestedErrors);
    }

    /**
     * The throwable this error was created from, if any. Only the first level is kept, nested errors carry their own.
     */
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    @SuppressWarnings("unchecked")
    public E addNestedError(CoreError error) {
        if (nestedErrors == null)
            nestedErrors = new ArrayList<>();
        nestedErrors.add(error);
        return (E) this;
    }
}
