package com.rgp.adapter.in.web;

import com.rgp.adapter.out.event.GuaranteeEventCodec;
import com.rgp.domain.event.GuaranteeEvent;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration test for the HTTP API
 * Deploys the verticle with an in-memory venue and drives it through a WebClient
 */
class HttpServerVerticleTest {

    private static final int PORT = 18181;
    private static final String OWNER = "venue-owner";
    private static final String GUARANTEE = "/api/venues/venue-1/guarantee";

    private Vertx vertx;
    private WebClient client;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        vertx.eventBus().registerDefaultCodec(GuaranteeEvent.class, new GuaranteeEventCodec());

        JsonObject config = new JsonObject()
                .put("http.port", PORT)
                .put("protocol", new JsonObject().put("protocolFeeBps", 500))
                .put("collateral", new JsonObject().put("balances", new JsonObject()
                        .put("alice", "10000")
                        .put("bob", "10000")
                        .put(OWNER, "1000")))
                .put("venues", new JsonArray().add(new JsonObject()
                        .put("id", "venue-1")
                        .put("owner", OWNER)
                        .put("vault", "vault-1")
                        .put("promisedRevenue", "900")
                        .put("totalMonths", 6)));

        CountDownLatch latch = new CountDownLatch(1);
        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions().setConfig(config))
                .onComplete(ar -> {
                    assertTrue(ar.succeeded(), () -> "deployment failed: " + ar.cause());
                    latch.countDown();
                });
        assertTrue(latch.await(10, TimeUnit.SECONDS));

        client = WebClient.create(vertx, new WebClientOptions().setDefaultPort(PORT).setDefaultHost("localhost"));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) {
            client.close();
        }
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void health_shouldReportUp() throws Exception {
        HttpResponse<Buffer> response = await(client.get("/health").send());

        assertEquals(200, response.statusCode());
        assertEquals("UP", response.bodyAsJsonObject().getString("status"));
    }

    @Test
    void unknownEndpoint_shouldReturn404() throws Exception {
        HttpResponse<Buffer> response = await(client.get("/api/nothing-here").send());

        assertEquals(404, response.statusCode());
    }

    @Test
    void stake_shouldRequireCallerHeader() throws Exception {
        HttpResponse<Buffer> response = await(client.post("/api/underwriters/stake")
                .sendJsonObject(new JsonObject().put("amount", 100)));

        assertEquals(403, response.statusCode());
        assertEquals("AUTHORIZATION", response.bodyAsJsonObject().getString("kind"));
    }

    @Test
    void stake_shouldRejectMalformedBody() throws Exception {
        HttpResponse<Buffer> response = await(client.post("/api/underwriters/stake")
                .putHeader(ApiSupport.CALLER_HEADER, "alice")
                .sendBuffer(Buffer.buffer("not json")));

        assertEquals(400, response.statusCode());
        assertEquals("VALIDATION", response.bodyAsJsonObject().getString("kind"));
    }

    @Test
    void stake_shouldRejectFractionalAmount() throws Exception {
        HttpResponse<Buffer> response = post("alice", "/api/underwriters/stake", new JsonObject().put("amount", 1.9));

        assertEquals(400, response.statusCode());
        assertEquals("VALIDATION", response.bodyAsJsonObject().getString("kind"));
        assertEquals(404, await(client.get("/api/underwriters/alice").send()).statusCode());
    }

    @Test
    void assignment_shouldRejectFractionalAmountsAndFee() throws Exception {
        post("alice", "/api/underwriters/stake", new JsonObject().put("amount", 1000));
        post("bob", "/api/underwriters/stake", new JsonObject().put("amount", 1000));

        HttpResponse<Buffer> fractionalAmounts = post(OWNER, "/api/venues/venue-1/assignment", new JsonObject()
                .put("underwriters", new JsonArray().add("alice").add("bob"))
                .put("amounts", new JsonArray().add(600.99).add(700.5))
                .put("fee", 0));
        assertEquals(400, fractionalAmounts.statusCode());

        HttpResponse<Buffer> fractionalFee = post(OWNER, "/api/venues/venue-1/assignment", new JsonObject()
                .put("underwriters", new JsonArray().add("alice").add("bob"))
                .put("amounts", new JsonArray().add(600).add(700))
                .put("fee", 0.7));
        assertEquals(400, fractionalFee.statusCode());

        assertEquals(404, await(client.get("/api/venues/venue-1/assignment").send()).statusCode());
    }

    @Test
    void guaranteeLifecycle_shouldSettleShortfallOverHttp() throws Exception {
        assertEquals(201, post("alice", "/api/underwriters/stake", new JsonObject().put("amount", "1000")).statusCode());
        assertEquals(201, post("bob", "/api/underwriters/stake", new JsonObject().put("amount", "1000")).statusCode());

        HttpResponse<Buffer> belowPromise = post(OWNER, "/api/venues/venue-1/assignment", new JsonObject()
                .put("underwriters", new JsonArray().add("alice").add("bob"))
                .put("amounts", new JsonArray().add(500).add(300))
                .put("fee", 0));
        assertEquals(422, belowPromise.statusCode());

        HttpResponse<Buffer> assigned = post(OWNER, "/api/venues/venue-1/assignment", new JsonObject()
                .put("underwriters", new JsonArray().add("alice").add("bob"))
                .put("amounts", new JsonArray().add(600).add(300))
                .put("fee", 0));
        assertEquals(201, assigned.statusCode());

        assertEquals(403, post("alice", GUARANTEE, new JsonObject().put("admin", "admin")).statusCode());
        assertEquals(201, post(OWNER, GUARANTEE, new JsonObject().put("admin", "admin")).statusCode());
        assertEquals(409, post(OWNER, GUARANTEE, new JsonObject().put("admin", "admin")).statusCode());

        HttpResponse<Buffer> report = post("admin", GUARANTEE + "/reports", new JsonObject().put("actualRevenue", 810));
        assertEquals(201, report.statusCode());
        assertEquals(1, report.bodyAsJsonObject().getJsonObject("data").getInteger("month"));

        HttpResponse<Buffer> settled = post("admin", GUARANTEE + "/reports/1/liability", new JsonObject());
        assertEquals(200, settled.statusCode());
        assertEquals("90", settled.bodyAsJsonObject().getJsonObject("data").getValue("settled").toString());
        assertEquals(409, post("admin", GUARANTEE + "/reports/1/liability", new JsonObject()).statusCode());
        assertEquals(404, post("admin", GUARANTEE + "/reports/9/liability", new JsonObject()).statusCode());
        assertEquals(400, post("admin", GUARANTEE + "/reports/first/liability", new JsonObject()).statusCode());

        HttpResponse<Buffer> alice = await(client.get("/api/underwriters/alice").send());
        assertEquals(200, alice.statusCode());
        assertEquals("540", alice.bodyAsJsonObject().getJsonObject("data").getValue("lockedStake").toString());

        HttpResponse<Buffer> summary = await(client.get(GUARANTEE + "/summary").send());
        assertEquals("90", summary.bodyAsJsonObject().getJsonObject("data").getValue("totalLiabilityPaid").toString());
    }

    @Test
    void feeDistribution_shouldReturnPayouts() throws Exception {
        post("alice", "/api/underwriters/stake", new JsonObject().put("amount", 1000));
        post("bob", "/api/underwriters/stake", new JsonObject().put("amount", 1000));
        post(OWNER, GUARANTEE, new JsonObject().put("admin", "admin"));
        post("admin", GUARANTEE + "/underwriters", new JsonObject().put("underwriter", "alice").put("stake", 60));
        post("admin", GUARANTEE + "/underwriters", new JsonObject().put("underwriter", "bob").put("stake", 40));

        HttpResponse<Buffer> fee = await(client.put(GUARANTEE + "/fee")
                .putHeader(ApiSupport.CALLER_HEADER, OWNER)
                .sendJsonObject(new JsonObject().put("amount", 100)));
        assertEquals(200, fee.statusCode());
        assertEquals(200, post(OWNER, GUARANTEE + "/fee-deposit", new JsonObject()).statusCode());

        HttpResponse<Buffer> distributed = post("admin", GUARANTEE + "/fee-distribution", new JsonObject());
        assertEquals(200, distributed.statusCode());
        JsonArray payouts = distributed.bodyAsJsonObject().getJsonArray("data");
        assertEquals(2, payouts.size());
        assertEquals("57", payouts.getJsonObject(0).getValue("netShare").toString());
        assertEquals("38", payouts.getJsonObject(1).getValue("netShare").toString());

        assertEquals(409, post("admin", GUARANTEE + "/fee-distribution", new JsonObject()).statusCode());
    }

    private HttpResponse<Buffer> post(String caller, String path, JsonObject body) throws Exception {
        return await(client.post(path)
                .putHeader(ApiSupport.CALLER_HEADER, caller)
                .sendJsonObject(body));
    }

    private static <T> T await(Future<T> future) throws Exception {
        CompletableFuture<T> result = new CompletableFuture<>();
        future.onComplete(ar -> {
            if (ar.succeeded()) {
                result.complete(ar.result());
            } else {
                result.completeExceptionally(ar.cause());
            }
        });
        return result.get(10, TimeUnit.SECONDS);
    }
}
