package com.rgp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.rgp.adapter.in.web.HttpServerVerticle;
import com.rgp.adapter.out.event.GuaranteeEventCodec;
import com.rgp.domain.event.GuaranteeEvent;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String CONFIG_FILE = "application.yml";

    public static void main(String[] args) {
        log.info("Starting Revenue Guarantee Engine...");

        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        vertx.eventBus().registerDefaultCodec(GuaranteeEvent.class, new GuaranteeEventCodec());
        log.info("Registered GuaranteeEvent message codec");

        JsonObject config = loadConfig();
        int port = config.getInteger("http.port", 8080);

        // All state lives in one verticle instance, so requests are serialized on its event loop
        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Revenue Guarantee Engine...");
                        vertx.close();
                    }));

                    log.info("Revenue Guarantee Engine is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/venues", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    static JsonObject loadConfig() {
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is == null) {
                throw new IllegalStateException(CONFIG_FILE + " not found in classpath");
            }
            return toDeploymentConfig(is);
        } catch (IOException e) {
            log.error("Failed to load {}: {}", CONFIG_FILE, e.getMessage());
            throw new IllegalStateException("Configuration error: " + CONFIG_FILE + " required", e);
        }
    }

    /**
     * Parse the YAML document and lift http.port to the flat key the verticle reads
     */
    static JsonObject toDeploymentConfig(InputStream yaml) throws IOException {
        ObjectMapper mapper = new YAMLMapper();
        Map<String, Object> document = mapper.readValue(yaml, new TypeReference<Map<String, Object>>() {});
        JsonObject config = new JsonObject(document);

        JsonObject http = config.getJsonObject("http");
        if (http != null && http.getInteger("port") != null) {
            config.put("http.port", http.getInteger("port"));
        }
        log.info("Loaded configuration from {}", CONFIG_FILE);
        return config;
    }

    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
