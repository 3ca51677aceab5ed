package com.example.printconnector.infrastructure.cache;

import com.example.printconnector.domain.model.CachedPpd;
import com.example.printconnector.domain.model.CachedPpdContent;
import com.example.printconnector.infrastructure.cups.PrintServerClient;
import com.example.printconnector.infrastructure.exception.PpdCacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Per-printer cache of PPD files with conditional refresh and content hashing.
 * <p>
 * Entries are created lazily. When two refreshes race to create the first entry of a printer the first one
 * published wins and the other is freed on the cleanup executor.
 */
public class PpdCache {

    private static final Logger log = LoggerFactory.getLogger(PpdCache.class);

    private final PrintServerClient client;
    private final Path directory;
    private final Executor cleanupExecutor;
    private final ConcurrentMap<String, PpdCacheEntry> entries = new ConcurrentHashMap<>();

    /**
     * @param client          print server request helper
     * @param directory       directory for the stable PPD files; created if missing
     * @param cleanupExecutor frees entries that lost a creation race
     */
    public PpdCache(PrintServerClient client, Path directory, Executor cleanupExecutor) {
        this.client = client;
        this.directory = directory;
        this.cleanupExecutor = cleanupExecutor;
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new PpdCacheException("Cannot create PPD cache directory " + directory, ex);
        }
    }

    /**
     * Brings the cached PPD of a printer up to date.
     *
     * @param printerName printer queue name
     * @return stable file and content hash, unchanged if the server reports no modification
     */
    public CachedPpd refresh(String printerName) {
        while (true) {
            PpdCacheEntry entry = entries.get(printerName);
            if (entry == null) {
                return createEntry(printerName);
            }
            Optional<CachedPpd> refreshed = entry.refresh(client);
            if (refreshed.isPresent()) {
                return refreshed.get();
            }
            // entry was invalidated while we waited for its lock
            entries.remove(printerName, entry);
        }
    }

    private CachedPpd createEntry(String printerName) {
        PpdCacheEntry created = PpdCacheEntry.create(printerName, directory);
        CachedPpd snapshot;
        try {
            snapshot = created.refresh(client).orElseThrow();
        } catch (RuntimeException ex) {
            created.free();
            throw ex;
        }

        PpdCacheEntry winner = entries.putIfAbsent(printerName, created);
        if (winner != null) {
            log.warn("Concurrent first fetch of printer {}; discarding duplicate cache entry", printerName);
            cleanupExecutor.execute(created::free);
            return winner.snapshot();
        }
        log.info("Cached PPD of printer {} in {}", printerName, snapshot.filePath());
        return snapshot;
    }

    /**
     * Reads the cached PPD text without contacting the print server.
     *
     * @param printerName printer queue name
     * @return content and the snapshot it belongs to
     * @throws PpdCacheException when the printer has no cache entry
     */
    public CachedPpdContent read(String printerName) {
        PpdCacheEntry entry = entries.get(printerName);
        Optional<CachedPpdContent> content = entry == null ? Optional.empty() : entry.readContent();
        return content.orElseThrow(() -> new PpdCacheException("No cached PPD for printer " + printerName));
    }

    /**
     * @param printerName printer queue name
     * @return last computed content hash, without fetching
     */
    public Optional<String> cachedHash(String printerName) {
        return Optional.ofNullable(entries.get(printerName)).map(entry -> entry.snapshot().contentHash());
    }

    /**
     * Drops the entry of a printer and deletes its file.
     *
     * @param printerName printer queue name
     */
    public void invalidate(String printerName) {
        PpdCacheEntry entry = entries.remove(printerName);
        if (entry != null) {
            entry.free();
            log.info("Dropped cached PPD of printer {}", printerName);
        }
    }

    /**
     * Drops every entry.
     */
    public void shutdown() {
        List.copyOf(entries.keySet()).forEach(this::invalidate);
    }
}
