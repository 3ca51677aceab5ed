package com.example.printconnector.infrastructure.cups;

import java.time.Duration;

@FunctionalInterface
public interface PrintServerConnectionFactory {

    /**
     * Opens a new session.
     *
     * @param connectTimeout how long establishing the session may take
     * @return open connection
     */
    PrintServerConnection open(Duration connectTimeout);
}
