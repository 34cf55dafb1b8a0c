package com.serge.scheduler.service;

import com.serge.scheduler.error.ForbiddenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decides whether a caller may mutate an owned record. Runs after input validation and before the
 * write; the write itself is still conditional on the owner.
 */
@Component
public class OwnershipGuard {
    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);

    public <T> OwnershipCheck check(Optional<T> entity, Function<T, String> owner, String callerId) {
        if (entity.isEmpty()) return OwnershipCheck.NOT_FOUND;
        String ownerId = owner.apply(entity.get());
        if (!Objects.equals(ownerId, callerId)) {
            log.info("ownership.denied ownerId={} callerId={}", ownerId, callerId);
            return OwnershipCheck.FORBIDDEN;
        }
        return OwnershipCheck.OK;
    }

    /** Throws on {@link OwnershipCheck#FORBIDDEN}; otherwise hands the outcome back to the caller. */
    public <T> OwnershipCheck requireNotForbidden(Optional<T> entity, Function<T, String> owner, String callerId) {
        OwnershipCheck outcome = check(entity, owner, callerId);
        if (outcome == OwnershipCheck.FORBIDDEN) throw new ForbiddenException();
        return outcome;
    }
}
