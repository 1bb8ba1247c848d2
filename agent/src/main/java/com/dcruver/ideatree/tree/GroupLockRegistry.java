package com.dcruver.ideatree.tree;

import com.dcruver.ideatree.domain.IdeaMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes read-modify-write cycles per group name.
 *
 * Group names hash onto a fixed set of lock stripes. Stripes are always taken in
 * ascending index order so two batches naming the same groups cannot deadlock.
 */
@Component
@Slf4j
public class GroupLockRegistry {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public GroupLockRegistry() {
        this(DEFAULT_STRIPES);
    }

    GroupLockRegistry(int stripeCount) {
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLocks(Collection<String> groupNames, Supplier<T> action) {
        List<Integer> indexes = groupNames.stream()
            .filter(Objects::nonNull)
            .map(IdeaMatcher::key)
            .filter(key -> !key.isEmpty())
            .map(this::stripeOf)
            .distinct()
            .sorted()
            .toList();

        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (int index : indexes) {
                ReentrantLock lock = stripes[index];
                lock.lock();
                held.add(lock);
            }
            log.trace("Holding lock stripes {}", indexes);
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    int stripeOf(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    int stripeCount() {
        return stripes.length;
    }
}
