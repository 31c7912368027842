package com.polymarket.signals.flash;

import java.util.List;

public interface FlashMoveRepository {

    void save(FlashMoveRecord record);

    /**
     * Most recent records first.
     */
    List<FlashMoveRecord> findRecent(int limit);
}
