/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.common;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or the exception describing why there is no value.
 * Used for failures that are an expected outcome of processing (for example, all the data being out of range)
 * so that callers have to deal with them explicitly instead of catching them.
 *
 * @param <T> Type of the value
 * @param <E> Type of the failure
 */
public final class Result<T, E extends Exception> {
    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E extends Exception> Result<T, E> ok(T value) {
        return new Result<>(Objects.requireNonNull(value), null);
    }

    public static <T, E extends Exception> Result<T, E> failure(E error) {
        return new Result<>(null, Objects.requireNonNull(error));
    }

    /**
     * View a result that fails with a narrower exception type as one that fails with a wider type.
     */
    public static <T, E extends Exception> Result<T, E> widen(Result<T, ? extends E> result) {
        return result.isOk() ? ok(result.value) : failure(result.error);
    }

    public boolean isOk() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value; failed with " + error.getMessage(), error);
        }
        return value;
    }

    public E getError() {
        return error;
    }

    /**
     * Apply fn to the value; failures are passed through unchanged.
     */
    public <U> Result<U, E> map(Function<T, U> fn) {
        return isOk() ? Result.ok(fn.apply(value)) : Result.failure(error);
    }

    /**
     * Chain another step that may itself fail.
     */
    public <U, F extends E> Result<U, E> flatMap(Function<T, Result<U, F>> fn) {
        if (!isOk()) {
            return Result.failure(error);
        }
        Result<U, F> next = fn.apply(value);
        return next.isOk() ? Result.ok(next.value) : Result.failure(next.error);
    }

    public T orElseThrow() throws E {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Failure(" + error.getMessage() + ")";
    }
}
