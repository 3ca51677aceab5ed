package com.example.printconnector.application.service;

import com.example.printconnector.domain.exception.PrinterNameRequiredException;
import com.example.printconnector.domain.model.CachedPpd;
import com.example.printconnector.domain.model.CachedPpdContent;
import com.example.printconnector.domain.model.PrinterCapabilities;
import com.example.printconnector.domain.model.TranslatedPpd;
import com.example.printconnector.infrastructure.cache.PpdCache;
import com.example.printconnector.infrastructure.cups.PrintServerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Application service that turns a printer's PPD into its capability description.
 * <p>
 * Translations are kept per printer together with the PPD hash they were built from and only redone when the
 * cache reports a different hash.
 */
@Service
public class PrinterCapabilityService {

    private static final Logger log = LoggerFactory.getLogger(PrinterCapabilityService.class);

    private final PpdCache ppdCache;
    private final PpdTranslationService translationService;
    private final PrintServerClient printServerClient;
    private final Map<String, PrinterCapabilities> translations = new ConcurrentHashMap<>();

    public PrinterCapabilityService(PpdCache ppdCache,
                                    PpdTranslationService translationService,
                                    PrintServerClient printServerClient) {
        this.ppdCache = ppdCache;
        this.translationService = translationService;
        this.printServerClient = printServerClient;
    }

    /**
     * Returns the capabilities of a printer, refreshing its PPD first.
     *
     * @param printerName printer queue name
     * @return translated capabilities with the hash of the PPD they describe
     */
    public PrinterCapabilities getCapabilities(String printerName) {
        requireName(printerName);
        CachedPpd cached = ppdCache.refresh(printerName);
        PrinterCapabilities known = translations.get(printerName);
        if (known != null && known.contentHash().equals(cached.contentHash())) {
            log.debug("PPD of printer {} unchanged, reusing translation", printerName);
            return known;
        }

        CachedPpdContent content = ppdCache.read(printerName);
        TranslatedPpd translated = translationService.translate(printerName, content.text());
        PrinterCapabilities capabilities = PrinterCapabilities.of(printerName, content.ppd().contentHash(), translated);
        translations.put(printerName, capabilities);
        log.info("Translated PPD of printer {} ({} {})", printerName, translated.manufacturer(), translated.model());
        return capabilities;
    }

    /**
     * Forgets the cached PPD and translation of a printer.
     *
     * @param printerName printer queue name
     */
    public void invalidate(String printerName) {
        requireName(printerName);
        translations.remove(printerName);
        ppdCache.invalidate(printerName);
    }

    /**
     * @return printer queue names known to the print server
     */
    public List<String> listPrinters() {
        return printServerClient.getPrinterNames();
    }

    private static void requireName(String printerName) {
        if (printerName == null || printerName.isBlank()) {
            throw new PrinterNameRequiredException();
        }
    }
}
