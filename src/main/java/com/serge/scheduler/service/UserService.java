package com.serge.scheduler.service;

import com.serge.scheduler.domain.Role;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.error.*;
import com.serge.scheduler.input.*;
import com.serge.scheduler.store.*;
import com.serge.scheduler.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private static final int DEFAULT_LIMIT = 10;

    private final UserStore userStore;
    private final EventStore eventStore;
    private final PasswordEncoder passwordEncoder;
    private final InputValidator validator;

    public UserAccount profile(String callerId) {
        return userStore.findById(callerId).orElseThrow(() -> new NotFoundException(Messages.USER_NOT_FOUND));
    }

    public Optional<UserAccount> find(String id) {
        return userStore.findById(id);
    }

    /** Every user by name when no argument is given; otherwise the requested page. */
    public List<UserAccount> list(UsersWhere where, UsersOrderBy orderBy, PaginationInput pagination) {
        if (where == null && orderBy == null && pagination == null) {
            return userStore.listAll();
        }
        return page(where, orderBy, pagination).getUsers();
    }

    public UserPage page(UsersWhere where, UsersOrderBy orderBy, PaginationInput pagination) {
        PaginationInput p = pagination == null ? new PaginationInput() : validator.validate("users", pagination);
        UserQuery.UserQueryBuilder query = UserQuery.builder()
                .limit(p.getLimit() == null ? DEFAULT_LIMIT : p.getLimit())
                .offset(p.getOffset() == null ? 0 : p.getOffset());
        if (where != null) {
            query.search(where.getSearch()).role(where.getRole());
        }
        if (orderBy != null) {
            if (orderBy.getField() != null) query.sortField(orderBy.getField());
            if (orderBy.getDirection() != null) query.direction(orderBy.getDirection());
        }
        return userStore.page(query.build());
    }

    public UserAccount updateMyProfile(String callerId, UpdateProfileInput input) {
        validator.validate("updateMyProfile", input);
        log.info("user.profile.update userId={}", callerId);
        return userStore.updateProfile(callerId, input.toPatch())
                .orElseThrow(() -> new NotFoundException(Messages.USER_NOT_FOUND));
    }

    /** Events behind a user's {@code createdEvents} back-references; dangling ids are skipped. */
    public List<PopulatedEvent> createdEvents(List<String> eventIds) {
        return eventStore.findPopulatedByIds(eventIds);
    }

    public UserAccount createUser(String callerId, CreateUserInput input) {
        validator.validate("createUser", input);
        requireAdmin(callerId);
        if (userStore.existsByEmail(input.getEmail())) {
            throw new ConflictException(Messages.EMAIL_IN_USE);
        }
        UserAccount user = UserAccount.builder()
                .name(input.getName().trim())
                .email(input.getEmail())
                // no usable password until the user resets it
                .passwordHash(passwordEncoder.encode(UUID.randomUUID().toString()))
                .imageUrl(input.getImageUrl() == null ? "" : input.getImageUrl())
                .address("")
                .role(input.getRole() == null ? Role.USER : input.getRole())
                .createdEvents(new ArrayList<>())
                .build();
        UserAccount saved = withEmailConflict(() -> userStore.create(user));
        log.info("user.admin.created userId={} by={}", saved.getId(), callerId);
        return saved;
    }

    public UserAccount updateUser(String callerId, String id, UpdateUserInput input) {
        validator.validate("updateUser", input);
        requireAdmin(callerId);
        UserAccount updated = withEmailConflict(() -> userStore.update(id, input.toPatch()))
                .orElseThrow(() -> new NotFoundException(Messages.USER_NOT_FOUND));
        log.info("user.admin.updated userId={} by={}", id, callerId);
        return updated;
    }

    /** False when no such user exists. */
    public boolean deleteUser(String callerId, String id) {
        requireAdmin(callerId);
        if (callerId.equals(id)) throw new BadInputException(Messages.CANNOT_DELETE_SELF);
        boolean deleted = userStore.delete(id);
        log.info("user.admin.deleted userId={} by={} deleted={}", id, callerId, deleted);
        return deleted;
    }

    private void requireAdmin(String callerId) {
        UserAccount caller = userStore.findById(callerId).orElseThrow(UnauthenticatedException::new);
        if (caller.getRole() != Role.ADMIN) {
            log.info("user.admin.denied callerId={}", callerId);
            throw new ForbiddenException();
        }
    }

    private static <T> T withEmailConflict(Supplier<T> write) {
        try {
            return write.get();
        } catch (StoreException e) {
            if (e.isDuplicateKey()) throw new ConflictException(Messages.EMAIL_IN_USE, e);
            throw e;
        }
    }
}
