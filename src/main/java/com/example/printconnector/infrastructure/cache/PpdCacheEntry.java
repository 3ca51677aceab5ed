package com.example.printconnector.infrastructure.cache;

import com.example.printconnector.domain.model.CachedPpd;
import com.example.printconnector.domain.model.CachedPpdContent;
import com.example.printconnector.infrastructure.cups.PpdFetchResult;
import com.example.printconnector.infrastructure.cups.PrintServerClient;
import com.example.printconnector.infrastructure.exception.PpdCacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cached PPD of one printer. All state changes happen under the entry lock, so concurrent refreshes of the same
 * printer run one after the other and readers never see a path paired with the hash of another content.
 */
final class PpdCacheEntry {

    private static final Logger log = LoggerFactory.getLogger(PpdCacheEntry.class);

    private final String printerName;
    private final Path directory;
    private final Path filePath;
    private final ReentrantLock lock = new ReentrantLock();
    private String modificationMarker;
    private String contentHash;
    private boolean freed;

    private PpdCacheEntry(String printerName, Path directory, Path filePath) {
        this.printerName = printerName;
        this.directory = directory;
        this.filePath = filePath;
    }

    /**
     * Creates an entry with an empty stable file and no modification marker.
     */
    static PpdCacheEntry create(String printerName, Path directory) {
        try {
            Path file = Files.createTempFile(directory, "ppd-" + safeFileName(printerName) + "-", ".ppd");
            return new PpdCacheEntry(printerName, directory, file);
        } catch (IOException ex) {
            throw new PpdCacheException("Cannot create cache file for printer " + printerName, ex);
        }
    }

    /**
     * Fetches the PPD unless unchanged and stores it.
     *
     * @param client print server request helper
     * @return current snapshot, or empty when the entry was freed meanwhile
     */
    Optional<CachedPpd> refresh(PrintServerClient client) {
        lock.lock();
        try {
            if (freed) {
                return Optional.empty();
            }
            PpdFetchResult result = client.getPpd(printerName, modificationMarker);
            if (!result.modified()) {
                if (contentHash == null) {
                    throw new PpdCacheException("Print server reported the PPD of printer " + printerName
                            + " unchanged before it was ever fetched");
                }
                return Optional.of(snapshot());
            }
            try {
                String newHash = store(result.file());
                if (!newHash.equals(contentHash)) {
                    log.info("PPD of printer {} changed, hash {}", printerName, newHash);
                }
                contentHash = newHash;
                modificationMarker = result.modificationMarker();
            } finally {
                deleteFetchedFile(result.file());
            }
            return Optional.of(snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies the fetched file into a staging file while hashing it, then moves the staging file over the stable
     * file. The stable file is untouched if anything fails.
     */
    private String store(Path fetched) {
        Path staging = null;
        try {
            staging = Files.createTempFile(directory, "staging-", ".ppd");
            MessageDigest digest = MessageDigest.getInstance("MD5");
            try (InputStream in = new DigestInputStream(Files.newInputStream(fetched), digest)) {
                Files.copy(in, staging, StandardCopyOption.REPLACE_EXISTING);
            }
            moveOver(staging, filePath);
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException ex) {
            deleteStaging(staging);
            throw new PpdCacheException("Cannot store PPD of printer " + printerName, ex);
        } catch (NoSuchAlgorithmException ex) {
            deleteStaging(staging);
            throw new IllegalStateException("MD5 is not available", ex);
        }
    }

    private static void moveOver(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Reads the cached PPD together with the snapshot it belongs to.
     *
     * @return content, or empty when the entry was freed
     */
    Optional<CachedPpdContent> readContent() {
        lock.lock();
        try {
            if (freed) {
                return Optional.empty();
            }
            String text = new String(Files.readAllBytes(filePath), StandardCharsets.UTF_8);
            return Optional.of(new CachedPpdContent(snapshot(), text));
        } catch (IOException ex) {
            throw new PpdCacheException("Cannot read cached PPD of printer " + printerName, ex);
        } finally {
            lock.unlock();
        }
    }

    CachedPpd snapshot() {
        lock.lock();
        try {
            return new CachedPpd(printerName, filePath, contentHash);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes the stable file. Later refreshes and reads report the entry as gone.
     */
    void free() {
        lock.lock();
        try {
            freed = true;
            Files.deleteIfExists(filePath);
        } catch (IOException ex) {
            log.warn("Cannot delete cached PPD {} of printer {}: {}", filePath, printerName, ex.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void deleteFetchedFile(Path fetched) {
        try {
            Files.deleteIfExists(fetched);
        } catch (IOException ex) {
            log.warn("Cannot delete fetched PPD {}: {}", fetched, ex.getMessage());
        }
    }

    private void deleteStaging(Path staging) {
        if (staging == null) {
            return;
        }
        try {
            Files.deleteIfExists(staging);
        } catch (IOException ex) {
            log.warn("Cannot delete staging file {}: {}", staging, ex.getMessage());
        }
    }

    private static String safeFileName(String printerName) {
        return printerName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
