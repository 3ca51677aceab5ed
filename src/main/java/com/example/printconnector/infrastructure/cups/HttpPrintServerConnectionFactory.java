package com.example.printconnector.infrastructure.cups;

import java.net.URI;
import java.time.Duration;

/**
 * Opens {@link HttpPrintServerConnection}s against one print server.
 */
public class HttpPrintServerConnectionFactory implements PrintServerConnectionFactory {

    private final URI serverUri;
    private final Duration requestTimeout;

    public HttpPrintServerConnectionFactory(URI serverUri, Duration requestTimeout) {
        this.serverUri = serverUri;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public PrintServerConnection open(Duration connectTimeout) {
        return new HttpPrintServerConnection(serverUri, connectTimeout, requestTimeout);
    }
}
