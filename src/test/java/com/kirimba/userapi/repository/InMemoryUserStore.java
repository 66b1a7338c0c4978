package com.kirimba.userapi.repository;

import com.kirimba.userapi.model.User;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link UserStore} в памяти для тестов сервиса.
 */
public class InMemoryUserStore implements UserStore {
    private final Map<Integer, User> store = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger(0);
    private final Clock clock;

    public InMemoryUserStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public User create(String name, LocalDate dateOfBirth) {
        User user = new User(name, dateOfBirth, LocalDateTime.now(clock));
        user.setId(sequence.incrementAndGet());
        store.put(user.getId(), copy(user));
        return copy(user);
    }

    @Override
    public Optional<User> getById(Integer id) {
        return Optional.ofNullable(copy(store.get(id)));
    }

    @Override
    public List<User> list(int limit, long offset) {
        return store.values().stream()
                .sorted(Comparator.comparing(User::getId))
                .skip(offset)
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    @Override
    public long count() {
        return store.size();
    }

    @Override
    public Optional<User> update(Integer id, String name, LocalDate dateOfBirth) {
        User existing = store.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        User updated = copy(existing);
        updated.setName(name);
        updated.setDateOfBirth(dateOfBirth);
        updated.setUpdatedAt(LocalDateTime.now(clock));
        store.put(id, updated);
        return getById(id);
    }

    @Override
    public boolean delete(Integer id) {
        return store.remove(id) != null;
    }

    private User copy(User src) {
        if (src == null) {
            return null;
        }
        return new User(src.getId(), src.getName(), src.getDateOfBirth(), src.getCreatedAt(), src.getUpdatedAt());
    }
}
