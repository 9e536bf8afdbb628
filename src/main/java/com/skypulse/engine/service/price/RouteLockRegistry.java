package com.skypulse.engine.service.price;

import com.skypulse.engine.model.Route;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per route. Work on the same route is serialized; different routes
 * never contend.
 *
 * The locks are reentrant so a facade holding the route lock can call the
 * store, the analyzers and the alert manager, which lock again.
 *
 * =========
 * -@Component: Singleton shared by every component touching per-route state.
 * --WithoutIT: each component would lock on its own and an append could
 * ---interleave with a classify on the same route.
 */
@Component
public class RouteLockRegistry {

    private final ConcurrentMap<Route, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Route route, Supplier<T> work) {
        ReentrantLock lock = lockFor(route);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Route route, Runnable work) {
        withLock(route, () -> {
            work.run();
            return null;
        });
    }

    boolean isHeldByCurrentThread(Route route) {
        ReentrantLock lock = locks.get(route);
        return lock != null && lock.isHeldByCurrentThread();
    }

    private ReentrantLock lockFor(Route route) {
        return locks.computeIfAbsent(route, r -> new ReentrantLock());
    }
}
