package com.gridarena.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Server settings, read from {@code arena-server.json} on the classpath.
 *
 * JSON format (every field optional):
 * {
 *     "port": 8080,
 *     "backlog": 4,
 *     "maxLineLength": 256,
 *     "sendTimeoutMillis": 2000
 * }
 *
 * Game rules (grid size, player count, damage) are fixed and not configurable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String RESOURCE = "arena-server.json";

    @JsonProperty
    private int port = 8080;

    @JsonProperty
    private int backlog = 4;

    @JsonProperty
    private int maxLineLength = 256;

    @JsonProperty
    private long sendTimeoutMillis = 2000;

    // Default constructor for Jackson
    public ServerConfig() {
    }

    /**
     * Loads the bundled configuration, falling back to defaults when the
     * resource is absent.
     *
     * @throws IllegalStateException if the resource exists but cannot be parsed
     */
    public static ServerConfig load() {
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.info("No {} on classpath, using defaults", RESOURCE);
                return new ServerConfig();
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Parses configuration JSON.
     *
     * @throws IllegalStateException if the JSON is malformed or a value is invalid
     */
    public static ServerConfig fromJson(InputStream in) {
        ServerConfig config;
        try {
            config = new ObjectMapper().readValue(in, ServerConfig.class);
        } catch (IOException e) {
            logger.error("Invalid server configuration", e);
            throw new IllegalStateException("Invalid server configuration", e);
        }
        config.validate();
        return config;
    }

    private void validate() {
        if (port <= 0 || port > 65535) {
            throw new IllegalStateException("port out of range: " + port);
        }
        if (backlog <= 0 || maxLineLength <= 0 || sendTimeoutMillis <= 0) {
            throw new IllegalStateException("backlog, maxLineLength and sendTimeoutMillis must be positive");
        }
    }

    /**
     * Returns a copy listening on a different port.
     */
    public ServerConfig withPort(int newPort) {
        ServerConfig copy = new ServerConfig();
        copy.port = newPort;
        copy.backlog = backlog;
        copy.maxLineLength = maxLineLength;
        copy.sendTimeoutMillis = sendTimeoutMillis;
        return copy;
    }

    public int getPort() {
        return port;
    }

    public int getBacklog() {
        return backlog;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public long getSendTimeoutMillis() {
        return sendTimeoutMillis;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", backlog=" + backlog +
                ", maxLineLength=" + maxLineLength +
                ", sendTimeoutMillis=" + sendTimeoutMillis +
                '}';
    }
}
