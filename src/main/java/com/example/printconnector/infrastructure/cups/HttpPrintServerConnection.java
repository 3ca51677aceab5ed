package com.example.printconnector.infrastructure.cups;

import com.example.printconnector.infrastructure.cups.ipp.IppCodec;
import com.example.printconnector.infrastructure.cups.ipp.IppRequest;
import com.example.printconnector.infrastructure.cups.ipp.IppResponse;
import com.example.printconnector.infrastructure.exception.PpdCacheException;
import com.example.printconnector.infrastructure.exception.PrintServerException;
import com.example.printconnector.infrastructure.exception.PrintServerTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Print server session over HTTP: PPDs are fetched with conditional GETs and IPP requests are POSTed as
 * {@code application/ipp}. Each session owns its own HTTP client, so reconnecting drops its kept-alive sockets.
 */
public class HttpPrintServerConnection implements PrintServerConnection {

    private static final Logger log = LoggerFactory.getLogger(HttpPrintServerConnection.class);
    static final MediaType IPP_MEDIA_TYPE = MediaType.parseMediaType("application/ipp");

    private final URI serverUri;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final Path downloadDirectory;
    private RestClient restClient;
    private boolean closed;

    /**
     * @param serverUri      base URI of the print server, e.g. {@code http://localhost:631}
     * @param connectTimeout connect timeout of the session
     * @param requestTimeout read timeout of each request
     */
    public HttpPrintServerConnection(URI serverUri, Duration connectTimeout, Duration requestTimeout) {
        this(serverUri, connectTimeout, requestTimeout, Path.of(System.getProperty("java.io.tmpdir")));
    }

    /**
     * @param downloadDirectory directory receiving downloaded PPDs before the cache takes them over
     */
    public HttpPrintServerConnection(URI serverUri, Duration connectTimeout, Duration requestTimeout,
                                     Path downloadDirectory) {
        this.serverUri = serverUri;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.downloadDirectory = downloadDirectory;
        this.restClient = newRestClient();
    }

    private RestClient newRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(requestTimeout);
        return RestClient.builder()
                .baseUrl(serverUri.toString())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public PpdFetchResult getPpd(String printerName, String modificationMarker) {
        ensureOpen();
        try {
            return restClient.get()
                    .uri("/printers/{printer}.ppd", printerName)
                    .headers(headers -> {
                        if (modificationMarker != null) {
                            headers.set(HttpHeaders.IF_MODIFIED_SINCE, modificationMarker);
                        }
                    })
                    .exchange((request, response) -> readPpd(printerName, response));
        } catch (RestClientException ex) {
            throw new PrintServerTransportException("Fetching PPD of printer " + printerName + " failed", ex);
        }
    }

    private PpdFetchResult readPpd(String printerName, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        if (status == HttpStatus.NOT_MODIFIED.value()) {
            log.debug("PPD of printer {} not modified", printerName);
            return PpdFetchResult.notModified();
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new PrintServerException("Fetching PPD of printer " + printerName + " failed", status);
        }

        Path file;
        try {
            file = Files.createTempFile(downloadDirectory, "print-server-ppd-", ".ppd");
        } catch (IOException ex) {
            throw new PpdCacheException("Creating download file for PPD of printer " + printerName + " failed", ex);
        }
        try (InputStream body = response.getBody()) {
            download(printerName, body, file);
        } catch (IOException | RuntimeException ex) {
            Files.deleteIfExists(file);
            throw ex;
        }
        return PpdFetchResult.modified(file, response.getHeaders().getFirst(HttpHeaders.LAST_MODIFIED));
    }

    /**
     * Copies the body into the download file. Read failures stay {@link IOException}s of the transport, write
     * failures are cache failures.
     */
    private static void download(String printerName, InputStream body, Path file) throws IOException {
        OutputStream out;
        try {
            out = Files.newOutputStream(file);
        } catch (IOException ex) {
            throw new PpdCacheException("Opening download file for PPD of printer " + printerName + " failed", ex);
        }
        try {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = body.read(buffer)) != -1) {
                try {
                    out.write(buffer, 0, read);
                } catch (IOException ex) {
                    throw new PpdCacheException("Writing PPD of printer " + printerName + " failed", ex);
                }
            }
        } catch (IOException | RuntimeException ex) {
            try {
                out.close();
            } catch (IOException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw ex;
        }
        try {
            out.close();
        } catch (IOException ex) {
            throw new PpdCacheException("Writing PPD of printer " + printerName + " failed", ex);
        }
    }

    @Override
    public IppResponse send(IppRequest request) {
        ensureOpen();
        try {
            return restClient.post()
                    .uri("/")
                    .contentType(IPP_MEDIA_TYPE)
                    .body(IppCodec.encode(request))
                    .exchange((httpRequest, response) -> {
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new PrintServerException("IPP operation 0x"
                                    + Integer.toHexString(request.operationId()) + " failed",
                                    response.getStatusCode().value());
                        }
                        try (InputStream body = response.getBody()) {
                            return IppCodec.decode(body.readAllBytes());
                        }
                    });
        } catch (RestClientException ex) {
            throw new PrintServerTransportException("IPP operation 0x"
                    + Integer.toHexString(request.operationId()) + " failed", ex);
        }
    }

    @Override
    public void reconnect() {
        ensureOpen();
        log.debug("Reconnecting to print server {}", serverUri);
        restClient = newRestClient();
    }

    @Override
    public void close() {
        closed = true;
        restClient = null;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection to " + serverUri + " is closed");
        }
    }
}
