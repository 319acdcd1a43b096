package com.rgp.adapter.out.event;

import com.rgp.domain.event.GuaranteeEvent;
import com.rgp.domain.event.GuaranteeEventType;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GuaranteeEventCodec and the event bus publisher
 */
class GuaranteeEventCodecTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private Vertx vertx;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        vertx.eventBus().registerDefaultCodec(GuaranteeEvent.class, new GuaranteeEventCodec());
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void wireFormat_shouldKeepLargeAmountsExact() {
        GuaranteeEventCodec codec = new GuaranteeEventCodec();
        BigInteger large = new BigInteger("123456789012345678901234567890");
        GuaranteeEvent event = GuaranteeEvent.forMonth(
                GuaranteeEventType.LIABILITY_PROCESSED, "venue-1", "admin", large, 7, NOW);

        Buffer buffer = Buffer.buffer();
        buffer.appendString("prefix");
        codec.encodeToWire(buffer, event);

        assertEquals(event, codec.decodeFromWire(6, buffer));
    }

    @Test
    void toJson_shouldWriteAmountAsString() {
        JsonObject json = GuaranteeEventCodec.toJson(
                GuaranteeEvent.of(GuaranteeEventType.STAKE_REGISTERED, null, "alice", BigInteger.TEN, NOW));

        assertEquals("STAKE_REGISTERED", json.getString("type"));
        assertNull(json.getString("venueId"));
        assertEquals("10", json.getString("amount"));
        assertEquals(0, json.getInteger("month"));
        assertEquals("2025-06-01T12:00:00Z", json.getString("timestamp"));
    }

    @Test
    void publisher_shouldDeliverEventsOnGuaranteeAddress() throws InterruptedException {
        AtomicReference<GuaranteeEvent> received = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        vertx.eventBus().<GuaranteeEvent>consumer(EventBusGuaranteeEventPublisher.ADDRESS, message -> {
            received.set(message.body());
            latch.countDown();
        });

        GuaranteeEvent event = GuaranteeEvent.of(GuaranteeEventType.FEES_DISTRIBUTED, "venue-1", "admin",
                BigInteger.valueOf(95), NOW);
        new EventBusGuaranteeEventPublisher(vertx.eventBus()).publish(event);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(event, received.get());
    }
}
