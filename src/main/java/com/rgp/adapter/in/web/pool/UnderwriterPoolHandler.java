package com.rgp.adapter.in.web.pool;

import com.rgp.application.port.in.UnderwriterPoolUseCase;
import com.rgp.application.port.in.UnderwriterPoolUseCase.AssignUnderwritersCommand;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;

import static com.rgp.adapter.in.web.ApiSupport.body;
import static com.rgp.adapter.in.web.ApiSupport.caller;
import static com.rgp.adapter.in.web.ApiSupport.respond;

/**
 * HTTP handlers for the underwriter pool
 * Handles /api/underwriters and /api/venues/:venueId/assignment
 */
@Slf4j
@RequiredArgsConstructor
public class UnderwriterPoolHandler {

    private final UnderwriterPoolUseCase poolUseCase;

    public void register(RoutingContext context) {
        respond(context, 201, "Stake registered", () -> {
            AmountRequest request = body(context, AmountRequest.class);
            return poolUseCase.register(caller(context), request.amount());
        });
    }

    public void withdraw(RoutingContext context) {
        respond(context, 200, "Stake withdrawn", () -> {
            AmountRequest request = body(context, AmountRequest.class);
            return poolUseCase.withdraw(caller(context), request.amount());
        });
    }

    public void getUnderwriter(RoutingContext context) {
        respond(context, 200, "Underwriter stake", () -> poolUseCase.underwriter(context.pathParam("underwriterId")));
    }

    public void assign(RoutingContext context) {
        respond(context, 201, "Underwriters assigned", () -> {
            AssignmentRequest request = body(context, AssignmentRequest.class);
            String venueId = context.pathParam("venueId");
            log.info("Received assignment request for venue {}: {}", venueId, request.underwriters());
            AssignUnderwritersCommand command = new AssignUnderwritersCommand(
                    venueId,
                    request.underwriters(),
                    request.amounts(),
                    request.fee() == null ? BigInteger.ZERO : request.fee()
            );
            return poolUseCase.assignToVenue(caller(context), command);
        });
    }

    public void getAssignment(RoutingContext context) {
        respond(context, 200, "Venue assignment", () -> poolUseCase.assignment(context.pathParam("venueId")));
    }

    public void getVenueStake(RoutingContext context) {
        respond(context, 200, "Venue stake", () -> {
            String venueId = context.pathParam("venueId");
            String underwriter = context.pathParam("underwriterId");
            return Map.of(
                    "venueId", venueId,
                    "underwriter", underwriter,
                    "stake", poolUseCase.stakeOf(venueId, underwriter)
            );
        });
    }

    public void claimFee(RoutingContext context) {
        respond(context, 200, "Assignment fee claimed",
                () -> poolUseCase.claimFee(caller(context), context.pathParam("venueId")));
    }
}
