package com.example.printconnector.infrastructure.cups;

import java.nio.file.Path;

/**
 * Outcome of a conditional PPD fetch.
 *
 * @param modified           {@code false} when the server reported the PPD unchanged
 * @param file               temporary file holding the fresh PPD; owned by the caller, {@code null} when unchanged
 * @param modificationMarker marker to send with the next fetch, {@code null} when unchanged or not provided
 */
public record PpdFetchResult(boolean modified, Path file, String modificationMarker) {

    public static PpdFetchResult notModified() {
        return new PpdFetchResult(false, null, null);
    }

    public static PpdFetchResult modified(Path file, String modificationMarker) {
        return new PpdFetchResult(true, file, modificationMarker);
    }
}
