package com.codeheadsystems.jwtdown.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All accounts are lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<String, UserRecord> users = new ConcurrentHashMap<>();
  private final AtomicInteger nextId = new AtomicInteger(1);

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore: accounts will NOT survive restarts. "
        + "Replace with a persistent UserStore for production.");
  }

  @Override
  public Optional<UserRecord> getUser(String username) {
    if (username == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(users.get(username));
  }

  @Override
  public void createUser(String username, String passwordHash, String email) {
    if (username == null || username.isBlank()) {
      throw new UserStoreException("Username must not be blank");
    }
    // The id is only consumed when the insert wins.
    AtomicReference<UserRecord> inserted = new AtomicReference<>();
    users.computeIfAbsent(username, name -> {
      UserRecord user = new UserRecord(nextId.getAndIncrement(), name, passwordHash, email);
      inserted.set(user);
      return user;
    });
    if (inserted.get() == null) {
      throw new DuplicateUserException(username);
    }
    log.debug("Stored user id={}", inserted.get().id());
  }
}
