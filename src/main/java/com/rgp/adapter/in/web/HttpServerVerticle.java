package com.rgp.adapter.in.web;

import com.rgp.adapter.in.web.guarantee.VenueGuaranteeHandler;
import com.rgp.adapter.in.web.pool.UnderwriterPoolHandler;
import com.rgp.adapter.out.event.EventBusGuaranteeEventPublisher;
import com.rgp.adapter.out.persistence.InMemoryUnderwriterPersistenceAdapter;
import com.rgp.adapter.out.persistence.InMemoryVenueAssignmentPersistenceAdapter;
import com.rgp.adapter.out.persistence.InMemoryVenueGuaranteePersistenceAdapter;
import com.rgp.adapter.out.persistence.SnapshotUnitOfWork;
import com.rgp.adapter.out.registry.InMemoryVenueRegistryAdapter;
import com.rgp.adapter.out.token.InMemoryCollateralTokenAdapter;
import com.rgp.application.port.in.UnderwriterPoolUseCase;
import com.rgp.application.port.in.VenueGuaranteeUseCase;
import com.rgp.application.port.out.GuaranteeEventPublisher;
import com.rgp.application.service.CollateralTransfers;
import com.rgp.application.service.GuaranteeValidator;
import com.rgp.application.service.UnderwriterPoolService;
import com.rgp.application.service.VenueGuaranteeService;
import com.rgp.domain.model.ProtocolSettings;
import com.rgp.infrastructure.config.ProtocolConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8080;

    private final Clock clock;

    private UnderwriterPoolHandler poolHandler;
    private VenueGuaranteeHandler guaranteeHandler;

    public HttpServerVerticle() {
        this(Clock.systemUTC());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", getPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeServices() {
        try {
            ProtocolSettings settings = ProtocolConfig.fromConfig(config().getJsonObject("protocol"));

            // Output ports (adapters)
            InMemoryUnderwriterPersistenceAdapter underwriterRepository = new InMemoryUnderwriterPersistenceAdapter();
            InMemoryVenueAssignmentPersistenceAdapter assignmentRepository = new InMemoryVenueAssignmentPersistenceAdapter();
            InMemoryVenueGuaranteePersistenceAdapter guaranteeRepository = new InMemoryVenueGuaranteePersistenceAdapter();
            InMemoryCollateralTokenAdapter token = createToken(config().getJsonObject("collateral"));
            InMemoryVenueRegistryAdapter registry = InMemoryVenueRegistryAdapter.fromConfig(config().getJsonArray("venues"));

            SnapshotUnitOfWork unitOfWork = new SnapshotUnitOfWork()
                    .enlist(underwriterRepository)
                    .enlist(assignmentRepository)
                    .enlist(guaranteeRepository)
                    .enlist(token);
            GuaranteeEventPublisher eventPublisher = new EventBusGuaranteeEventPublisher(vertx.eventBus());
            CollateralTransfers transfers = new CollateralTransfers(token);
            GuaranteeValidator validator = new GuaranteeValidator();

            // Application services (use cases)
            UnderwriterPoolUseCase poolUseCase = new UnderwriterPoolService(
                    underwriterRepository,
                    assignmentRepository,
                    registry,
                    registry,
                    transfers,
                    unitOfWork,
                    eventPublisher,
                    validator,
                    settings,
                    clock
            );
            VenueGuaranteeUseCase guaranteeUseCase = new VenueGuaranteeService(
                    guaranteeRepository,
                    poolUseCase,
                    registry,
                    registry,
                    transfers,
                    unitOfWork,
                    eventPublisher,
                    validator,
                    settings,
                    clock
            );

            // Input adapters (handlers)
            poolHandler = new UnderwriterPoolHandler(poolUseCase);
            guaranteeHandler = new VenueGuaranteeHandler(guaranteeUseCase);

            log.info("Services wired up (Hexagonal Architecture)");
            return Future.succeededFuture();
        } catch (RuntimeException e) {
            log.error("Error initializing services", e);
            return Future.failedFuture(e);
        }
    }

    private InMemoryCollateralTokenAdapter createToken(JsonObject collateral) {
        InMemoryCollateralTokenAdapter token = new InMemoryCollateralTokenAdapter();
        if (collateral == null || collateral.getJsonObject("balances") == null) {
            log.warn("No collateral balances configured, every account starts empty");
            return token;
        }
        JsonObject balances = collateral.getJsonObject("balances");
        for (String account : balances.fieldNames()) {
            token.mint(account, new BigInteger(String.valueOf(balances.getValue(account))));
        }
        log.info("Minted opening collateral balances for {} accounts", balances.size());
        return token;
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        // Setup routes
        WebRouter webRouter = new WebRouter(router, poolHandler, guaranteeHandler);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }

    private int getPort() {
        return config().getInteger("http.port", DEFAULT_PORT);
    }
}
