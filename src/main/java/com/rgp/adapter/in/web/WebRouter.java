package com.rgp.adapter.in.web;

import com.rgp.adapter.in.web.guarantee.VenueGuaranteeHandler;
import com.rgp.adapter.in.web.pool.UnderwriterPoolHandler;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for underwriter pool and venue guarantee endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private static final String GUARANTEE = "/api/venues/:venueId/guarantee";

    private final Router router;
    private final UnderwriterPoolHandler poolHandler;
    private final VenueGuaranteeHandler guaranteeHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, " + ApiSupport.CALLER_HEADER)
                    .putHeader("Access-Control-Allow-Credentials", "true");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Underwriter pool
        router.post("/api/underwriters/stake").handler(poolHandler::register);
        router.post("/api/underwriters/withdraw").handler(poolHandler::withdraw);
        router.get("/api/underwriters/:underwriterId").handler(poolHandler::getUnderwriter);
        router.post("/api/venues/:venueId/assignment").handler(poolHandler::assign);
        router.get("/api/venues/:venueId/assignment").handler(poolHandler::getAssignment);
        router.get("/api/venues/:venueId/assignment/stakes/:underwriterId").handler(poolHandler::getVenueStake);
        router.post("/api/venues/:venueId/assignment/fee-claim").handler(poolHandler::claimFee);

        // Guarantee engine
        router.post(GUARANTEE).handler(guaranteeHandler::open);
        router.get(GUARANTEE).handler(guaranteeHandler::getGuarantee);
        router.get(GUARANTEE + "/summary").handler(guaranteeHandler::getSummary);
        router.post(GUARANTEE + "/operators").handler(guaranteeHandler::addOperator);
        router.delete(GUARANTEE + "/operators/:operator").handler(guaranteeHandler::removeOperator);
        router.put(GUARANTEE + "/fee").handler(guaranteeHandler::setFeeAmount);
        router.post(GUARANTEE + "/underwriters").handler(guaranteeHandler::addUnderwriter);
        router.post(GUARANTEE + "/fee-deposit").handler(guaranteeHandler::depositFee);
        router.post(GUARANTEE + "/reports").handler(guaranteeHandler::submitReport);
        router.get(GUARANTEE + "/reports/:month").handler(guaranteeHandler::getReport);
        router.post(GUARANTEE + "/reports/:month/liability").handler(guaranteeHandler::processLiability);
        router.post(GUARANTEE + "/revenue-deposits").handler(guaranteeHandler::depositRevenue);
        router.post(GUARANTEE + "/fee-distribution").handler(guaranteeHandler::distributeFees);
        router.post(GUARANTEE + "/fee-claim").handler(guaranteeHandler::claimFee);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"revenue-guarantee-engine\"}"));

        // Root endpoint
        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"name\":\"Revenue Guarantee Engine\",\"version\":\"1.0.0\"}"));
    }
}
