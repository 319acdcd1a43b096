package com.rgp.adapter.out.event;

import com.rgp.domain.event.GuaranteeEvent;
import com.rgp.domain.event.GuaranteeEventType;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Message codec for GuaranteeEvent to enable event bus communication
 */
public class GuaranteeEventCodec implements MessageCodec<GuaranteeEvent, GuaranteeEvent> {

    @Override
    public void encodeToWire(Buffer buffer, GuaranteeEvent event) {
        String json = toJson(event).encode();
        Buffer payload = Buffer.buffer(json);
        buffer.appendInt(payload.length());
        buffer.appendBuffer(payload);
    }

    @Override
    public GuaranteeEvent decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        String json = buffer.getString(pos + 4, pos + 4 + length);
        return fromJson(new JsonObject(json));
    }

    @Override
    public GuaranteeEvent transform(GuaranteeEvent event) {
        return event;
    }

    @Override
    public String name() {
        return "GuaranteeEventCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }

    static JsonObject toJson(GuaranteeEvent event) {
        return new JsonObject()
                .put("type", event.getType().name())
                .put("venueId", event.getVenueId())
                .put("party", event.getParty())
                .put("amount", event.getAmount().toString())
                .put("month", event.getMonth())
                .put("timestamp", event.getTimestamp().toString());
    }

    static GuaranteeEvent fromJson(JsonObject json) {
        return new GuaranteeEvent(
                GuaranteeEventType.valueOf(json.getString("type")),
                json.getString("venueId"),
                json.getString("party"),
                new BigInteger(json.getString("amount")),
                json.getInteger("month"),
                Instant.parse(json.getString("timestamp"))
        );
    }
}
