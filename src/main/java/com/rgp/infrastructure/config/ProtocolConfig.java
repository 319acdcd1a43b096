package com.rgp.infrastructure.config;

import com.rgp.domain.exception.ValidationException;
import com.rgp.domain.model.ProtocolSettings;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the "protocol" section of the deployment config.
 * Missing keys fall back to {@link ProtocolSettings#defaults()}.
 */
@Slf4j
public final class ProtocolConfig {

    private ProtocolConfig() {
    }

    public static ProtocolSettings fromConfig(JsonObject protocol) {
        JsonObject section = protocol == null ? new JsonObject() : protocol;
        List<String> errors = new ArrayList<>();

        String poolAccount = section.getString("poolAccount", ProtocolSettings.DEFAULT_POOL_ACCOUNT);
        String treasuryAccount = section.getString("treasuryAccount", ProtocolSettings.DEFAULT_TREASURY_ACCOUNT);
        int feeBps = section.getInteger("protocolFeeBps", ProtocolSettings.DEFAULT_PROTOCOL_FEE_BPS);

        if (poolAccount == null || poolAccount.isBlank()) {
            errors.add("protocol.poolAccount must not be blank");
        }
        if (treasuryAccount == null || treasuryAccount.isBlank()) {
            errors.add("protocol.treasuryAccount must not be blank");
        }
        if (poolAccount != null && poolAccount.equals(treasuryAccount)) {
            errors.add("protocol.poolAccount and protocol.treasuryAccount must differ");
        }
        if (feeBps < 0 || feeBps > 10_000) {
            errors.add("protocol.protocolFeeBps must be between 0 and 10000");
        }

        Duration periodLength = ProtocolSettings.DEFAULT_PERIOD_LENGTH;
        String period = section.getString("periodLength");
        if (period != null) {
            try {
                periodLength = Duration.parse(period);
                if (periodLength.isNegative() || periodLength.isZero()) {
                    errors.add("protocol.periodLength must be positive");
                }
            } catch (DateTimeParseException e) {
                errors.add("protocol.periodLength must be an ISO-8601 duration (e.g. P30D)");
            }
        }

        if (!errors.isEmpty()) {
            log.error("Invalid protocol configuration: {}", errors);
            throw new ValidationException(errors);
        }

        ProtocolSettings settings = ProtocolSettings.builder()
                .poolAccount(poolAccount)
                .treasuryAccount(treasuryAccount)
                .protocolFeeBps(feeBps)
                .periodLength(periodLength)
                .build();
        log.info("Loaded protocol settings: {}", settings);
        return settings;
    }
}
