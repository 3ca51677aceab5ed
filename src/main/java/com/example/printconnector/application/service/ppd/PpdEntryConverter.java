package com.example.printconnector.application.service.ppd;

import com.example.printconnector.domain.model.ppd.PpdEntries;
import com.example.printconnector.domain.model.ppd.PpdEntry;
import com.example.printconnector.domain.model.ppd.PpdEntryKind;
import com.example.printconnector.domain.model.ppd.PpdStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns regular UI blocks into {@link PpdEntry} controls with a resolved default.
 */
@Service
public class PpdEntryConverter {

    private static final Logger log = LoggerFactory.getLogger(PpdEntryConverter.class);

    /**
     * Converts every convertible block and indexes the results.
     *
     * @param openUis regular UI blocks, each starting with its {@code OpenUI} statement
     * @return entries by main keyword and by translation
     */
    public PpdEntries convert(List<List<PpdStatement>> openUis) {
        Map<String, PpdEntry> byMainKeyword = new LinkedHashMap<>();
        Map<String, PpdEntry> byTranslation = new LinkedHashMap<>();
        for (List<PpdStatement> block : openUis) {
            toEntry(block).ifPresent(entry -> {
                byMainKeyword.put(entry.mainKeyword(), entry);
                byTranslation.put(entry.translation(), entry);
            });
        }
        return new PpdEntries(byMainKeyword, byTranslation);
    }

    /**
     * Converts one UI block.
     *
     * @param block statements of the block
     * @return the entry, or empty when the control kind is unsupported or no choice survived
     */
    Optional<PpdEntry> toEntry(List<PpdStatement> block) {
        if (block.isEmpty()) {
            return Optional.empty();
        }
        PpdStatement header = block.get(0);
        String mainKeyword = header.optionKeyword().startsWith("*")
                ? header.optionKeyword().substring(1)
                : header.optionKeyword();
        if (mainKeyword.isEmpty()) {
            return Optional.empty();
        }
        String translation = header.translation().isEmpty() ? mainKeyword : header.translation();

        PpdEntryKind kind;
        switch (header.value()) {
            case PpdKeywords.PICK_ONE -> kind = PpdEntryKind.PICK_ONE;
            case PpdKeywords.BOOLEAN -> kind = PpdEntryKind.BOOLEAN;
            case PpdKeywords.PICK_MANY -> {
                log.warn("Skipping PickMany control {}; only PickOne and Boolean controls are supported", mainKeyword);
                return Optional.empty();
            }
            default -> {
                log.warn("Skipping control {} of unknown kind {}", mainKeyword, header.value());
                return Optional.empty();
            }
        }

        String defaultKeyword = PpdKeywords.DEFAULT + mainKeyword;
        String defaultValue = "";
        List<PpdStatement> options = new ArrayList<>();
        for (PpdStatement statement : block.subList(1, block.size())) {
            if (statement.mainKeyword().equals(defaultKeyword)) {
                defaultValue = statement.value();
            } else if (statement.mainKeyword().startsWith(mainKeyword)) {
                options.add(statement);
            }
        }
        if (options.isEmpty()) {
            return Optional.empty();
        }

        String declaredDefault = defaultValue;
        if (options.stream().noneMatch(option -> option.optionKeyword().equals(declaredDefault))) {
            defaultValue = options.get(0).optionKeyword();
        }
        return Optional.of(new PpdEntry(mainKeyword, translation, kind, defaultValue, options));
    }
}
