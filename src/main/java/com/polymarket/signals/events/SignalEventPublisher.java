package com.polymarket.signals.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed fan-out for signal events. Consumers register {@code @EventListener}
 * methods for the record types in this package; a consumer that throws does
 * not reach back into the publishing pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalEventPublisher {

    private final ApplicationEventPublisher delegate;

    public void publish(Object event) {
        try {
            delegate.publishEvent(event);
        } catch (Exception e) {
            log.error("Listener failed for {}", event.getClass().getSimpleName(), e);
        }
    }
}
