package com.serge.scheduler.store;

import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.repo.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Sole access path to the {@code users} collection.
 */
@Component
@RequiredArgsConstructor
public class UserStore {
    private static final Logger log = LoggerFactory.getLogger(UserStore.class);

    private final UserAccountRepository users;
    private final MongoTemplate mongo;

    public Optional<UserAccount> findById(String id) {
        return users.findById(id);
    }

    public Optional<UserAccount> findByEmail(String email) {
        return users.findByEmail(normalizeEmail(email));
    }

    public boolean existsByEmail(String email) {
        return users.existsByEmail(normalizeEmail(email));
    }

    public UserAccount create(UserAccount user) {
        user.setEmail(normalizeEmail(user.getEmail()));
        UserAccount saved = StoreErrors.write("create user", () -> users.insert(user));
        log.debug("store.user.created userId={}", saved.getId());
        return saved;
    }

    public Optional<UserAccount> updateProfile(String id, ProfilePatch patch) {
        Update update = new Update();
        if (patch.getName() != null) update.set("name", patch.getName());
        if (patch.getAddress() != null) update.set("address", patch.getAddress());
        if (patch.getDob() != null) update.set("dob", patch.getDob());
        if (patch.getImageUrl() != null) update.set("imageUrl", patch.getImageUrl());
        return modify(id, update);
    }

    public Optional<UserAccount> update(String id, UserPatch patch) {
        Update update = new Update();
        if (patch.getName() != null) update.set("name", patch.getName());
        if (patch.getEmail() != null) update.set("email", normalizeEmail(patch.getEmail()));
        if (patch.getImageUrl() != null) update.set("imageUrl", patch.getImageUrl());
        if (patch.getRole() != null) update.set("role", patch.getRole());
        return modify(id, update);
    }

    public boolean delete(String id) {
        return StoreErrors.write("delete user", () -> {
            if (!users.existsById(id)) return false;
            users.deleteById(id);
            return true;
        });
    }

    public List<UserAccount> listAll() {
        return users.findAll(Sort.by(Sort.Direction.ASC, "name"));
    }

    /**
     * Filtered, sorted page of users. Criteria are added only for the filter fields that are set.
     */
    public UserPage page(UserQuery q) {
        List<Criteria> clauses = new ArrayList<>();
        if (q.getSearch() != null && !q.getSearch().isBlank()) {
            String pattern = Pattern.quote(q.getSearch().trim());
            clauses.add(new Criteria().orOperator(
                    Criteria.where("name").regex(pattern, "i"),
                    Criteria.where("email").regex(pattern, "i")));
        }
        if (q.getRole() != null) {
            clauses.add(Criteria.where("role").is(q.getRole()));
        }
        Criteria criteria = clauses.isEmpty() ? new Criteria() : new Criteria().andOperator(clauses);

        long total = mongo.count(new Query(criteria), UserAccount.class);
        Query pageQuery = new Query(criteria)
                .with(Sort.by(q.getDirection(), q.getSortField().property()))
                .skip(q.getOffset())
                .limit(q.getLimit());
        List<UserAccount> found = mongo.find(pageQuery, UserAccount.class);
        log.debug("store.user.page search={} role={} total={} returned={}", q.getSearch(), q.getRole(), total, found.size());
        return new UserPage(found, total, q.getOffset() + found.size() < total);
    }

    /** Users by id, keyed by id. Unknown ids are absent from the map. */
    public Map<String, UserAccount> findByIds(Collection<String> ids) {
        if (ids.isEmpty()) return Map.of();
        Map<String, UserAccount> out = new HashMap<>();
        users.findAllById(new LinkedHashSet<>(ids)).forEach(u -> out.put(u.getId(), u));
        return out;
    }

    /**
     * Appends an event to the creator's back-reference list. Best effort: a failure is logged and
     * reported as {@code false}, never thrown, so the event write it follows stays in place.
     */
    public boolean linkCreatedEvent(String userId, String eventId) {
        try {
            mongo.updateFirst(byId(userId), new Update().addToSet("createdEvents", eventId), UserAccount.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("store.user.link_event_failed userId={} eventId={} err={}", userId, eventId, e.toString());
            return false;
        }
    }

    /** Inverse of {@link #linkCreatedEvent}, with the same best-effort semantics. */
    public boolean unlinkCreatedEvent(String userId, String eventId) {
        try {
            mongo.updateFirst(byId(userId), new Update().pull("createdEvents", eventId), UserAccount.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("store.user.unlink_event_failed userId={} eventId={} err={}", userId, eventId, e.toString());
            return false;
        }
    }

    private Optional<UserAccount> modify(String id, Update update) {
        update.set("updatedAt", Instant.now());
        UserAccount updated = StoreErrors.write("update user", () -> mongo.findAndModify(
                byId(id), update, FindAndModifyOptions.options().returnNew(true), UserAccount.class));
        return Optional.ofNullable(updated);
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("id").is(id));
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
