package com.ivamare.campaign.exception;

import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Runs durable-store calls and converts Spring data access failures into
 * {@link StoreFailureException}.
 */
public final class StoreGuard {

    private StoreGuard() {
    }

    public static <T> T call(String description, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreFailureException("Store failure while trying to " + description, e);
        }
    }

    public static void run(String description, Runnable action) {
        try {
            action.run();
        } catch (DataAccessException e) {
            throw new StoreFailureException("Store failure while trying to " + description, e);
        }
    }
}
