package com.serge.scheduler.store;

import com.serge.scheduler.error.Messages;
import com.serge.scheduler.error.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.util.function.Supplier;

/**
 * Re-signals store faults from write paths as {@link StoreException}, keeping the duplicate-key flag.
 */
final class StoreErrors {
    private StoreErrors() {
    }

    static <T> T write(String action, Supplier<T> op) {
        try {
            return op.get();
        } catch (DuplicateKeyException e) {
            throw new StoreException(Messages.DUPLICATE_KEY, true, e);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to " + action, false, e);
        }
    }
}
