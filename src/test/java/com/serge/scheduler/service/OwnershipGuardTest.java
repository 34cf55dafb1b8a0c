package com.serge.scheduler.service;

import com.serge.scheduler.domain.Meeting;
import com.serge.scheduler.error.ForbiddenException;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnershipGuardTest {
    private final OwnershipGuard guard = new OwnershipGuard();

    private static Optional<Meeting> ownedBy(String owner) {
        return Optional.of(Meeting.builder().id("m1").createdBy(owner).build());
    }

    @Test
    void ownerIsAllowed() {
        assertThat(guard.check(ownedBy("alice"), Meeting::getCreatedBy, "alice")).isEqualTo(OwnershipCheck.OK);
    }

    @Test
    void someoneElseIsForbidden() {
        assertThat(guard.check(ownedBy("alice"), Meeting::getCreatedBy, "bob")).isEqualTo(OwnershipCheck.FORBIDDEN);
        assertThatThrownBy(() -> guard.requireNotForbidden(ownedBy("alice"), Meeting::getCreatedBy, "bob"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void missingRecordIsNotFound() {
        assertThat(guard.requireNotForbidden(Optional.<Meeting>empty(), Meeting::getCreatedBy, "bob"))
                .isEqualTo(OwnershipCheck.NOT_FOUND);
    }
}
