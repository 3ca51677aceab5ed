package com.example.printconnector.infrastructure.cups;

import com.example.printconnector.infrastructure.cups.ipp.IppRequest;
import com.example.printconnector.infrastructure.cups.ipp.IppResponse;

/**
 * One open session with the print server. Implementations are not thread-safe; the pool lends a session to one
 * caller at a time.
 */
public interface PrintServerConnection {

    /**
     * Fetches the PPD of a printer unless it is unchanged since the given marker.
     *
     * @param printerName        printer queue name
     * @param modificationMarker marker returned by the previous fetch, or {@code null} to fetch unconditionally
     * @return not-modified, or the fresh PPD in a temporary file plus its new marker
     * @throws com.example.printconnector.infrastructure.exception.PrintServerTransportException on transport errors
     * @throws com.example.printconnector.infrastructure.exception.PrintServerException          on error statuses
     */
    PpdFetchResult getPpd(String printerName, String modificationMarker);

    /**
     * Sends a generic IPP request.
     *
     * @param request request to send
     * @return decoded response, whatever its IPP status
     */
    IppResponse send(IppRequest request);

    /**
     * Drops the underlying session and opens a new one.
     */
    void reconnect();

    void close();
}
