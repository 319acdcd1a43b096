package com.rgp.adapter.out.event;

import com.rgp.application.port.out.GuaranteeEventPublisher;
import com.rgp.domain.event.GuaranteeEvent;
import io.vertx.core.eventbus.EventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes committed guarantee events on the Vert.x event bus.
 * Requires {@link GuaranteeEventCodec} to be registered as default codec.
 */
@Slf4j
@RequiredArgsConstructor
public class EventBusGuaranteeEventPublisher implements GuaranteeEventPublisher {

    public static final String ADDRESS = "guarantee.events";

    private final EventBus eventBus;

    @Override
    public void publish(GuaranteeEvent event) {
        log.debug("Publishing {} for venue {} to {}", event.getType(), event.getVenueId(), ADDRESS);
        eventBus.publish(ADDRESS, event);
    }
}
