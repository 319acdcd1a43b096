package com.rgp.adapter.in.web.guarantee;

import com.rgp.adapter.in.web.pool.AmountRequest;
import com.rgp.application.port.in.VenueGuaranteeUseCase;
import com.rgp.domain.exception.ValidationException;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.rgp.adapter.in.web.ApiSupport.body;
import static com.rgp.adapter.in.web.ApiSupport.caller;
import static com.rgp.adapter.in.web.ApiSupport.intParam;
import static com.rgp.adapter.in.web.ApiSupport.respond;

/**
 * HTTP handlers for a venue's guarantee engine
 * Handles /api/venues/:venueId/guarantee/**
 */
@Slf4j
@RequiredArgsConstructor
public class VenueGuaranteeHandler {

    private final VenueGuaranteeUseCase guaranteeUseCase;

    public void open(RoutingContext context) {
        respond(context, 201, "Guarantee opened", () -> {
            String caller = caller(context);
            String admin = context.body().length() > 0 ? body(context, OpenGuaranteeRequest.class).admin() : null;
            return guaranteeUseCase.openGuarantee(caller, venueId(context), admin == null ? caller : admin);
        });
    }

    public void addOperator(RoutingContext context) {
        respond(context, 200, "Operator added", () -> {
            OperatorRequest request = body(context, OperatorRequest.class);
            guaranteeUseCase.addOperator(caller(context), venueId(context), request.operator());
            return Map.of("operator", request.operator());
        });
    }

    public void removeOperator(RoutingContext context) {
        respond(context, 200, "Operator removed", () -> {
            String operator = context.pathParam("operator");
            guaranteeUseCase.removeOperator(caller(context), venueId(context), operator);
            return Map.of("operator", operator);
        });
    }

    public void setFeeAmount(RoutingContext context) {
        respond(context, 200, "Fee amount set", () -> {
            AmountRequest request = body(context, AmountRequest.class);
            guaranteeUseCase.setFeeAmount(caller(context), venueId(context), request.amount());
            return Map.of("feeAmount", request.amount());
        });
    }

    public void addUnderwriter(RoutingContext context) {
        respond(context, 201, "Underwriter added", () -> {
            AddUnderwriterRequest request = body(context, AddUnderwriterRequest.class);
            guaranteeUseCase.addUnderwriter(caller(context), venueId(context), request.underwriter(), request.stake());
            return Map.of("underwriter", request.underwriter(), "stake", request.stake());
        });
    }

    public void depositFee(RoutingContext context) {
        respond(context, 200, "Fee deposited", () -> {
            String venueId = venueId(context);
            guaranteeUseCase.depositFee(caller(context), venueId);
            return guaranteeUseCase.guarantee(venueId);
        });
    }

    public void submitReport(RoutingContext context) {
        respond(context, 201, "Monthly report submitted", () -> {
            RevenueReportRequest request = body(context, RevenueReportRequest.class);
            return guaranteeUseCase.submitMonthlyReport(caller(context), venueId(context), request.actualRevenue());
        });
    }

    public void getReport(RoutingContext context) {
        respond(context, 200, "Monthly report",
                () -> guaranteeUseCase.report(venueId(context), intParam(context, "month")));
    }

    public void processLiability(RoutingContext context) {
        respond(context, 200, "Liability processed",
                () -> guaranteeUseCase.processLiability(caller(context), venueId(context), intParam(context, "month")));
    }

    public void depositRevenue(RoutingContext context) {
        respond(context, 200, "Revenue deposited", () -> {
            RevenueDepositRequest request = body(context, RevenueDepositRequest.class);
            if (request.month() == null) {
                throw new ValidationException("month is required");
            }
            guaranteeUseCase.ownerDepositRevenue(caller(context), venueId(context), request.month(), request.amount());
            return Map.of("month", request.month(), "amount", request.amount());
        });
    }

    public void distributeFees(RoutingContext context) {
        respond(context, 200, "Fees distributed",
                () -> guaranteeUseCase.distributeFees(caller(context), venueId(context)));
    }

    public void claimFee(RoutingContext context) {
        respond(context, 200, "Fee claimed",
                () -> guaranteeUseCase.claimFee(caller(context), venueId(context)));
    }

    public void getGuarantee(RoutingContext context) {
        respond(context, 200, "Venue guarantee", () -> guaranteeUseCase.guarantee(venueId(context)));
    }

    public void getSummary(RoutingContext context) {
        respond(context, 200, "Performance summary",
                () -> guaranteeUseCase.getPerformanceSummary(venueId(context)));
    }

    private static String venueId(RoutingContext context) {
        return context.pathParam("venueId");
    }
}
