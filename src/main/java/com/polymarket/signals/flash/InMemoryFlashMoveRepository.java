package com.polymarket.signals.flash;

import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-process store for flash move records. Nothing survives a restart.
 */
@Repository
public class InMemoryFlashMoveRepository implements FlashMoveRepository {

    static final int CAPACITY = 500;

    private final Deque<FlashMoveRecord> records = new ArrayDeque<>();

    @Override
    public synchronized void save(FlashMoveRecord record) {
        records.addFirst(record);
        while (records.size() > CAPACITY) {
            records.removeLast();
        }
    }

    @Override
    public synchronized List<FlashMoveRecord> findRecent(int limit) {
        List<FlashMoveRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<FlashMoveRecord> it = records.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }
}
