package com.polymarket.signals.events;

import com.polymarket.signals.domain.ArbitrageOpportunity;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default consumer of the signal events: writes each one to the log.
 */
@Slf4j
@Component
public class SignalEventLogger {

    @EventListener
    public void onOpportunity(ArbitrageOpportunityEvent event) {
        ArbitrageOpportunity opp = event.opportunity();
        log.info("[opportunity] {} | cost={} roi={}% legs={}", opp.getQuestion(), opp.getCombinedCost(),
                opp.getRoi(), opp.getLegs().size());
    }

    @EventListener
    public void onFlashMoveDetected(FlashMoveDetectedEvent event) {
        EnhancedFlashMoveEvent move = event.event();
        log.info("[flash_move_detected] {} {} -> {} risk={} executed={}", move.getTokenId(), move.getOldPrice(),
                move.getNewPrice(), String.format("%.1f", event.riskAssessment().getRiskScore()),
                event.result().isSuccess());
    }

    @EventListener
    public void onFlashMoveExecuted(FlashMoveExecutedEvent event) {
        log.info("[flash_move_executed] {} order={} shares={} @ {}", event.event().getTokenId(),
                event.result().getOrderId(), event.result().getSharesFilled(), event.result().getPriceFilled());
    }

    @EventListener
    public void onPositionClosed(PositionClosedEvent event) {
        log.info("[position_closed] {} ({})", event.tokenId(), event.reason());
    }

    @EventListener
    public void onConnectionExhausted(ConnectionExhaustedEvent event) {
        log.error("[connection_exhausted] market socket gave up after {} attempts at {}; restart required",
                event.attempts(), event.timestamp());
    }
}
