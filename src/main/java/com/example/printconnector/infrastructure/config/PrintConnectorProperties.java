package com.example.printconnector.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from the {@code print-connector.*} properties.
 *
 * @param serverUri          base URI of the print server
 * @param maxConnections     maximum number of concurrently open sessions
 * @param connectTimeout     timeout for opening a session
 * @param requestTimeout     timeout for reading one response
 * @param maxConnectionAge   sessions older than this are reconnected before use
 * @param idleGraceWindow    how long a released session waits for the next borrower
 * @param ppdCacheDirectory  directory holding the cached PPD files
 */
@ConfigurationProperties(prefix = "print-connector")
public record PrintConnectorProperties(
        @DefaultValue("http://localhost:631") URI serverUri,
        @DefaultValue("50") int maxConnections,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("30s") Duration requestTimeout,
        @DefaultValue("2m") Duration maxConnectionAge,
        @DefaultValue("1s") Duration idleGraceWindow,
        @DefaultValue("${java.io.tmpdir}/print-connector-ppd") Path ppdCacheDirectory
) {
}
