package com.polymarket.signals.events;

import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.FlashMoveResult;
import com.polymarket.signals.domain.RiskAssessment;

public record FlashMoveDetectedEvent(
        EnhancedFlashMoveEvent event,
        RiskAssessment riskAssessment,
        FlashMoveResult result) {
}
