package com.example.printconnector.infrastructure.cups;

import com.example.printconnector.infrastructure.cups.ipp.IppAttribute;
import com.example.printconnector.infrastructure.cups.ipp.IppAttributeGroup;
import com.example.printconnector.infrastructure.cups.ipp.IppOperation;
import com.example.printconnector.infrastructure.cups.ipp.IppRequest;
import com.example.printconnector.infrastructure.cups.ipp.IppResponse;
import com.example.printconnector.infrastructure.cups.ipp.IppTag;
import com.example.printconnector.infrastructure.exception.PrintServerException;
import com.example.printconnector.infrastructure.exception.PrintServerTransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for request execution, retry and session accounting of the print server client.
 */
class PrintServerClientTest {

    private final ExecutorService releaseExecutor = Executors.newCachedThreadPool();
    private final PrintServerConnection connection = mock(PrintServerConnection.class);
    private final AtomicInteger opened = new AtomicInteger();
    private final ConnectionPool pool = new ConnectionPool(timeout -> {
        opened.incrementAndGet();
        return connection;
    }, 1, Duration.ofSeconds(1), Duration.ofMinutes(2), Duration.ofSeconds(5), releaseExecutor, Clock.systemUTC());
    private final PrintServerClient client = new PrintServerClient(pool, URI.create("http://localhost:631"));

    @AfterEach
    void tearDown() {
        releaseExecutor.shutdownNow();
    }

    /**
     * Verifies that a transport failure discards the session and the retry succeeds on a new one.
     */
    @Test
    void transportFailureIsRetriedOnce() {
        PpdFetchResult fetched = PpdFetchResult.modified(Path.of("office.ppd"), "marker");
        given(connection.getPpd("office", null))
                .willThrow(new PrintServerTransportException("reset", new IOException("reset")))
                .willReturn(fetched);

        assertThat(client.getPpd("office", null)).isEqualTo(fetched);
        verify(connection).close();
        assertThat(opened).hasValue(2);
    }

    /**
     * Ensures the second failure surfaces with the first attached as suppressed.
     */
    @Test
    void secondFailureSurfaces() {
        PrintServerTransportException first = new PrintServerTransportException("first", new IOException("a"));
        PrintServerTransportException second = new PrintServerTransportException("second", new IOException("b"));
        given(connection.getPpd("office", "m")).willThrow(first).willThrow(second);

        PrintServerTransportException thrown = assertThrows(PrintServerTransportException.class,
                () -> client.getPpd("office", "m"));

        assertThat(thrown).isSameAs(second);
        assertThat(thrown.getSuppressed()).containsExactly(first);
        verify(connection, times(2)).getPpd("office", "m");
    }

    /**
     * Ensures an error status keeps the session alive for reuse.
     */
    @Test
    void errorStatusKeepsSession() {
        given(connection.getPpd("missing", null)).willThrow(new PrintServerException("not found", 404));

        PrintServerException thrown = assertThrows(PrintServerException.class, () -> client.getPpd("missing", null));

        assertThat(thrown.getStatusCode()).isEqualTo(404);
        assertThat(opened).hasValue(1);
        verify(connection, never()).close();
    }

    /**
     * Verifies printer listing from a CUPS-Get-Printers response.
     */
    @Test
    void getPrinterNamesReadsPrinterGroups() {
        given(connection.send(any())).willReturn(new IppResponse(IppOperation.STATUS_OK, 1, List.of(
                new IppAttributeGroup(IppTag.OPERATION_ATTRIBUTES, List.of(IppAttribute.charset("utf-8"))),
                printerGroup("office"),
                printerGroup("lab"))));

        assertThat(client.getPrinterNames()).containsExactly("office", "lab");

        ArgumentCaptor<IppRequest> request = ArgumentCaptor.forClass(IppRequest.class);
        verify(connection).send(request.capture());
        assertThat(request.getValue().operationId()).isEqualTo(IppOperation.CUPS_GET_PRINTERS);
    }

    /**
     * Ensures a server without printers yields an empty list rather than an error.
     */
    @Test
    void getPrinterNamesAcceptsNotFound() {
        given(connection.send(any())).willReturn(new IppResponse(IppOperation.STATUS_NOT_FOUND, 1, List.of()));

        assertThat(client.getPrinterNames()).isEmpty();
    }

    /**
     * Verifies the printer URI and the rejection of error statuses.
     */
    @Test
    void getPrinterAttributesAddressesPrinterAndChecksStatus() {
        given(connection.send(any()))
                .willReturn(new IppResponse(IppOperation.STATUS_OK, 1, List.of(printerGroup("office"))))
                .willReturn(new IppResponse(0x0400, 2, List.of()));

        IppAttributeGroup printer = client.getPrinterAttributes("office", "printer-name");
        assertThat(printer.find("printer-name").orElseThrow().firstValue()).isEqualTo("office");

        ArgumentCaptor<IppRequest> request = ArgumentCaptor.forClass(IppRequest.class);
        verify(connection).send(request.capture());
        assertThat(request.getValue().operationAttributes())
                .filteredOn(attribute -> attribute.name().equals("printer-uri"))
                .extracting(IppAttribute::firstValue)
                .containsExactly("ipp://localhost:631/printers/office");

        PrintServerException rejected = assertThrows(PrintServerException.class,
                () -> client.getPrinterAttributes("office"));
        assertThat(rejected.getStatusCode()).isEqualTo(0x0400);
    }

    private static IppAttributeGroup printerGroup(String name) {
        return new IppAttributeGroup(IppTag.PRINTER_ATTRIBUTES,
                List.of(new IppAttribute(IppTag.NAME, "printer-name", List.of(name))));
    }
}
