package hbnb.listing.service.lock;

import hbnb.listing.config.ListingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion boundary around facade calls.
 * One read/write lock covers every repository: mutations hold the write lock
 * for the whole validate, resolve, write sequence; pure reads share the read lock.
 * The lock is reentrant, so a facade call may invoke another one.
 */
@Service
@Slf4j
public class StoreLockService {

    private final ReentrantReadWriteLock lock;

    private final boolean enabled;

    @Autowired
    public StoreLockService(ListingProperties properties) {
        this(properties.getLock().isEnabled(), properties.getLock().isFair());
    }

    public StoreLockService(boolean enabled, boolean fair) {
        this.enabled = enabled;
        this.lock = new ReentrantReadWriteLock(fair);
    }

    /**
     * Default lock for tests and tools: enabled and fair
     */
    public StoreLockService() {
        this(true, true);
    }

    /**
     * Execute a mutating action while holding the exclusive store lock
     *
     * @param operation operation name for log lines
     * @param action the action to execute while holding the lock
     * @param <T> the return type of the action
     * @return the result of the action
     */
    public <T> T executeWithWriteLock(String operation, Supplier<T> action) {
        return execute(operation, lock.writeLock(), action);
    }

    /**
     * Execute a read-only action while holding the shared store lock
     */
    public <T> T executeWithReadLock(String operation, Supplier<T> action) {
        return execute(operation, lock.readLock(), action);
    }

    private <T> T execute(String operation, Lock target, Supplier<T> action) {
        if (!enabled) {
            return action.get();
        }

        target.lock();
        try {
            log.trace("Store lock acquired: {}", operation);
            return action.get();
        } finally {
            target.unlock();
            log.trace("Store lock released: {}", operation);
        }
    }

    boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    /**
     * Get lock configuration information
     */
    public String getLockConfig() {
        return String.format("StoreLock[enabled=%s, fair=%s]", enabled, lock.isFair());
    }
}
