package com.example.printconnector.domain.model;

import java.nio.file.Path;

/**
 * Consistent view of one PPD cache entry.
 *
 * @param printerName printer the PPD describes
 * @param filePath    stable file holding the raw PPD bytes
 * @param contentHash lowercase hex MD5 of the file content
 */
public record CachedPpd(String printerName, Path filePath, String contentHash) {
}
