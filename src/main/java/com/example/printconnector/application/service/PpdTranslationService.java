package com.example.printconnector.application.service;

import com.example.printconnector.application.service.capability.CapabilityMapper;
import com.example.printconnector.application.service.ppd.PpdEntryConverter;
import com.example.printconnector.application.service.ppd.PpdStatementGrouper;
import com.example.printconnector.application.service.ppd.PpdStatementParser;
import com.example.printconnector.domain.exception.UnsupportedPpdFormatException;
import com.example.printconnector.domain.model.TranslatedPpd;
import com.example.printconnector.domain.model.ppd.GroupedStatements;
import com.example.printconnector.domain.model.ppd.PpdEntries;
import com.example.printconnector.domain.model.ppd.PpdStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application service that runs a PPD document through parsing, grouping, constraint filtering, entry conversion
 * and capability mapping. Stateless and safe to call concurrently for different printers.
 */
@Service
public class PpdTranslationService {

    private static final Logger log = LoggerFactory.getLogger(PpdTranslationService.class);

    private final PpdStatementParser parser;
    private final PpdStatementGrouper grouper;
    private final PpdEntryConverter entryConverter;
    private final CapabilityMapper capabilityMapper;

    /**
     * Creates the service with its pipeline stages.
     *
     * @param parser           splits text into statements
     * @param grouper          groups statements and applies installed-option constraints
     * @param entryConverter   builds UI controls
     * @param capabilityMapper maps controls onto capability sections
     */
    public PpdTranslationService(PpdStatementParser parser,
                                 PpdStatementGrouper grouper,
                                 PpdEntryConverter entryConverter,
                                 CapabilityMapper capabilityMapper) {
        this.parser = parser;
        this.grouper = grouper;
        this.entryConverter = entryConverter;
        this.capabilityMapper = capabilityMapper;
    }

    /**
     * Translates one PPD document.
     *
     * @param printerName printer the document belongs to, used for diagnostics
     * @param ppd         document text
     * @return capability description with manufacturer and model
     * @throws UnsupportedPpdFormatException when the text contains no PPD statements
     */
    public TranslatedPpd translate(String printerName, String ppd) {
        List<PpdStatement> statements = parser.parse(ppd);
        if (statements.isEmpty()) {
            throw new UnsupportedPpdFormatException(printerName);
        }

        GroupedStatements grouped = grouper.filterConstraints(grouper.group(statements));
        PpdEntries entries = entryConverter.convert(grouped.openUis());
        TranslatedPpd translated = capabilityMapper.map(entries, grouped.standalones());

        if (translated.manufacturer().isEmpty() || translated.model().isEmpty()) {
            log.warn("PPD of printer {} declares no manufacturer or model", printerName);
        }
        log.debug("Translated PPD of printer {}: {} statements, {} controls",
                printerName, statements.size(), entries.byMainKeyword().size());
        return translated;
    }
}
