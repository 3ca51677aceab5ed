package com.example.printconnector.domain.model;

import com.example.printconnector.domain.model.cdd.PrinterDescription;

/**
 * Capabilities of one printer as handed to the synchronization loop.
 *
 * @param printerName  printer name on the print server
 * @param manufacturer normalized manufacturer name
 * @param model        cleaned model name
 * @param contentHash  hash of the PPD the description was derived from
 * @param description  capability sections
 */
public record PrinterCapabilities(
        String printerName,
        String manufacturer,
        String model,
        String contentHash,
        PrinterDescription description
) {

    public static PrinterCapabilities of(String printerName, String contentHash, TranslatedPpd translated) {
        return new PrinterCapabilities(printerName, translated.manufacturer(), translated.model(), contentHash,
                translated.description());
    }
}
