package com.polymarket.signals.events;

import com.polymarket.signals.domain.ActiveFlashPosition;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.FlashMoveResult;

public record FlashMoveExecutedEvent(
        EnhancedFlashMoveEvent event,
        FlashMoveResult result,
        ActiveFlashPosition position) {
}
