package com.example.guardianservice.support;

import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process lock provider: a name is either held or free.
 */
public class InMemoryLockProvider implements LockProvider {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<SimpleLock> lock(LockConfiguration lockConfiguration) {
        String name = lockConfiguration.getName();
        if (!held.add(name)) {
            return Optional.empty();
        }
        return Optional.of(() -> held.remove(name));
    }

    public boolean isHeld(String name) {
        return held.contains(name);
    }
}
