package com.example.printconnector.infrastructure.cups;

import com.example.printconnector.infrastructure.cups.ipp.IppAttribute;
import com.example.printconnector.infrastructure.cups.ipp.IppAttributeGroup;
import com.example.printconnector.infrastructure.cups.ipp.IppOperation;
import com.example.printconnector.infrastructure.cups.ipp.IppRequest;
import com.example.printconnector.infrastructure.cups.ipp.IppResponse;
import com.example.printconnector.infrastructure.cups.ipp.IppTag;
import com.example.printconnector.infrastructure.exception.PrintServerException;
import com.example.printconnector.infrastructure.exception.PrintServerTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Request helper on top of the {@link ConnectionPool}. Every request borrows a connection for its duration and is
 * retried once on any failure before the error is surfaced.
 */
public class PrintServerClient {

    private static final Logger log = LoggerFactory.getLogger(PrintServerClient.class);

    private static final Set<Integer> SUCCESS = Set.of(
            IppOperation.STATUS_OK,
            IppOperation.STATUS_OK_IGNORED_OR_SUBSTITUTED,
            IppOperation.STATUS_OK_CONFLICTING);
    private static final String PRINTER_NAME = "printer-name";

    private final ConnectionPool pool;
    private final URI serverUri;
    private final AtomicInteger requestIds = new AtomicInteger();

    public PrintServerClient(ConnectionPool pool, URI serverUri) {
        this.pool = pool;
        this.serverUri = serverUri;
    }

    /**
     * Fetches a printer's PPD conditionally.
     *
     * @param printerName        printer queue name
     * @param modificationMarker marker of the cached copy, or {@code null}
     * @return not-modified, or the fresh PPD and its marker
     */
    public PpdFetchResult getPpd(String printerName, String modificationMarker) {
        return executeWithRetry("PPD fetch for printer " + printerName,
                connection -> connection.getPpd(printerName, modificationMarker));
    }

    /**
     * Sends a generic IPP request.
     *
     * @param request            request to send
     * @param acceptableStatuses IPP statuses treated as success
     * @return decoded response
     * @throws PrintServerException when the response carries any other status
     */
    public IppResponse doRequest(IppRequest request, Set<Integer> acceptableStatuses) {
        return executeWithRetry("IPP operation 0x" + Integer.toHexString(request.operationId()), connection -> {
            IppResponse response = connection.send(request);
            if (!acceptableStatuses.contains(response.statusCode())) {
                throw new PrintServerException("IPP operation 0x" + Integer.toHexString(request.operationId())
                        + " rejected", response.statusCode());
            }
            return response;
        });
    }

    /**
     * Lists the printer queues the server knows.
     *
     * @return printer names in server order
     */
    public List<String> getPrinterNames() {
        IppRequest request = IppRequest.of(IppOperation.CUPS_GET_PRINTERS, nextRequestId(),
                IppAttribute.keyword("requested-attributes", PRINTER_NAME));
        Set<Integer> acceptable = Set.of(IppOperation.STATUS_OK, IppOperation.STATUS_OK_IGNORED_OR_SUBSTITUTED,
                IppOperation.STATUS_NOT_FOUND);
        return doRequest(request, acceptable).groups(IppTag.PRINTER_ATTRIBUTES).stream()
                .flatMap(group -> group.find(PRINTER_NAME).stream())
                .map(IppAttribute::firstValue)
                .toList();
    }

    /**
     * Fetches attributes of one printer.
     *
     * @param printerName         printer queue name
     * @param requestedAttributes attribute names, none for the server's default set
     * @return the printer attribute group
     */
    public IppAttributeGroup getPrinterAttributes(String printerName, String... requestedAttributes) {
        String printerUri = UriComponentsBuilder.fromUri(serverUri)
                .scheme("ipp")
                .path("/printers/{printer}")
                .buildAndExpand(printerName)
                .encode()
                .toUriString();
        IppRequest request = requestedAttributes.length == 0
                ? IppRequest.of(IppOperation.GET_PRINTER_ATTRIBUTES, nextRequestId(),
                IppAttribute.uri("printer-uri", printerUri))
                : IppRequest.of(IppOperation.GET_PRINTER_ATTRIBUTES, nextRequestId(),
                IppAttribute.uri("printer-uri", printerUri),
                IppAttribute.keyword("requested-attributes", requestedAttributes));
        List<IppAttributeGroup> printers = doRequest(request, SUCCESS).groups(IppTag.PRINTER_ATTRIBUTES);
        if (printers.isEmpty()) {
            throw new PrintServerException("No attributes returned for printer " + printerName,
                    IppOperation.STATUS_NOT_FOUND);
        }
        return printers.get(0);
    }

    <T> T executeWithRetry(String description, Function<PrintServerConnection, T> operation) {
        try {
            return executeOnce(operation);
        } catch (RuntimeException first) {
            log.warn("{} failed, retrying once: {}", description, first.getMessage());
            try {
                return executeOnce(operation);
            } catch (RuntimeException second) {
                if (second != first) {
                    second.addSuppressed(first);
                }
                throw second;
            }
        }
    }

    private <T> T executeOnce(Function<PrintServerConnection, T> operation) {
        PooledConnection connection = acquire();
        boolean sessionHealthy = false;
        try {
            T result = connection.call(operation);
            sessionHealthy = true;
            return result;
        } catch (PrintServerException ex) {
            sessionHealthy = true;
            throw ex;
        } finally {
            if (sessionHealthy) {
                pool.release(connection);
            } else {
                pool.discard(connection);
            }
        }
    }

    private PooledConnection acquire() {
        try {
            return pool.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PrintServerTransportException("Interrupted while waiting for a print server connection", ex);
        }
    }

    private int nextRequestId() {
        return requestIds.incrementAndGet();
    }
}
