package com.rgp.application.port.out;

import com.rgp.domain.event.GuaranteeEvent;

/**
 * Output port for announcing committed state changes
 */
public interface GuaranteeEventPublisher {

    void publish(GuaranteeEvent event);
}
