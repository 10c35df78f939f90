package containermigrator.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * At most one active migration per container id.
 *
 * <p>{@link #acquire} is acquire-or-reject, and {@link #release} only removes
 * the entry if it still belongs to the releasing handle, so a rejected or
 * cancelled call can never remove someone else's entry.
 */
final class ActiveMigrationRegistry {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, MigrationHandle> active = new HashMap<>();

    /**
     * Registers {@code handle} unless its container already has an active migration.
     *
     * @return true if registered
     */
    boolean acquire(MigrationHandle handle) {
        lock.writeLock().lock();
        try {
            return active.putIfAbsent(handle.containerId(), handle) == null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes {@code handle}'s entry if it is still the registered one.
     *
     * @return true if removed
     */
    boolean release(MigrationHandle handle) {
        lock.writeLock().lock();
        try {
            return active.remove(handle.containerId(), handle);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Optional<MigrationHandle> get(String containerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(active.get(containerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    List<MigrationHandle> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(active.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return active.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
