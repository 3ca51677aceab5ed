package com.example.printconnector.infrastructure.config;

import com.example.printconnector.infrastructure.cache.PpdCache;
import com.example.printconnector.infrastructure.cups.ConnectionPool;
import com.example.printconnector.infrastructure.cups.HttpPrintServerConnectionFactory;
import com.example.printconnector.infrastructure.cups.PrintServerClient;
import com.example.printconnector.infrastructure.cups.PrintServerConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the print server connection pool, the request helper and the PPD cache.
 */
@Configuration
@EnableConfigurationProperties(PrintConnectorProperties.class)
public class PrintConnectorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PrintConnectorConfiguration.class);

    @Bean
    public PrintServerConnectionFactory printServerConnectionFactory(PrintConnectorProperties properties) {
        return new HttpPrintServerConnectionFactory(properties.serverUri(), properties.requestTimeout());
    }

    @Bean(destroyMethod = "shutdown")
    public ConnectionPool connectionPool(PrintServerConnectionFactory factory, PrintConnectorProperties properties) {
        log.info("Print server {} with at most {} connections", properties.serverUri(), properties.maxConnections());
        return new ConnectionPool(factory,
                properties.maxConnections(),
                properties.connectTimeout(),
                properties.maxConnectionAge(),
                properties.idleGraceWindow(),
                daemonPool("print-server-release-"),
                Clock.systemUTC());
    }

    @Bean
    public PrintServerClient printServerClient(ConnectionPool connectionPool, PrintConnectorProperties properties) {
        return new PrintServerClient(connectionPool, properties.serverUri());
    }

    @Bean(destroyMethod = "shutdown")
    public PpdCache ppdCache(PrintServerClient printServerClient, PrintConnectorProperties properties) {
        return new PpdCache(printServerClient, properties.ppdCacheDirectory(), daemonPool("ppd-cache-cleanup-"));
    }

    private static ExecutorService daemonPool(String threadNamePrefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix);
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
