package com.example.printconnector.application.service.ppd;

import com.example.printconnector.domain.model.ppd.GroupedStatements;
import com.example.printconnector.domain.model.ppd.PpdStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups parsed statements into UI blocks and removes choices that the installed hardware rules out.
 */
@Service
public class PpdStatementGrouper {

    private static final Logger log = LoggerFactory.getLogger(PpdStatementGrouper.class);
    private static final Pattern CONSTRAINT = Pattern.compile("\\*([^\\s*]+)\\s+(\\S+)\\s+\\*([^\\s*]+)\\s+(\\S+)");

    /**
     * Sorts statements into regular UI blocks, installable-option blocks, constraints and standalone statements
     * in a single forward pass. Groups and sub-groups other than {@code InstallableOptions} are flattened away.
     *
     * @param statements statements in document order
     * @return grouped statements
     */
    public GroupedStatements group(List<PpdStatement> statements) {
        List<List<PpdStatement>> openUis = new ArrayList<>();
        List<List<PpdStatement>> installables = new ArrayList<>();
        List<PpdStatement> constraints = new ArrayList<>();
        List<PpdStatement> standalones = new ArrayList<>();
        boolean insideOpenUi = false;
        boolean insideInstallable = false;

        for (PpdStatement statement : statements) {
            switch (statement.mainKeyword()) {
                case PpdKeywords.OPEN_UI, PpdKeywords.JCL_OPEN_UI -> {
                    insideOpenUi = true;
                    List<PpdStatement> block = new ArrayList<>();
                    block.add(statement);
                    (insideInstallable ? installables : openUis).add(block);
                }
                case PpdKeywords.CLOSE_UI, PpdKeywords.JCL_CLOSE_UI -> insideOpenUi = false;
                case PpdKeywords.OPEN_GROUP -> {
                    if (statement.value().startsWith(PpdKeywords.INSTALLABLE_OPTIONS)) {
                        insideInstallable = true;
                    }
                }
                case PpdKeywords.CLOSE_GROUP -> {
                    if (statement.value().startsWith(PpdKeywords.INSTALLABLE_OPTIONS)) {
                        insideInstallable = false;
                    }
                }
                case PpdKeywords.OPEN_SUB_GROUP, PpdKeywords.CLOSE_SUB_GROUP -> {
                    // sub-groups carry no capability data
                }
                case PpdKeywords.UI_CONSTRAINTS -> constraints.add(statement);
                default -> {
                    if (insideInstallable) {
                        appendToLast(installables, statement);
                    } else if (insideOpenUi) {
                        appendToLast(openUis, statement);
                    } else {
                        standalones.add(statement);
                    }
                }
            }
        }
        return new GroupedStatements(openUis, installables, constraints, standalones);
    }

    /**
     * Drops regular UI choices forbidden by a constraint whose left-hand side is an installed-option default.
     *
     * @param grouped grouped statements of one document
     * @return grouped statements with filtered regular UI blocks
     */
    public GroupedStatements filterConstraints(GroupedStatements grouped) {
        Set<KeywordPair> installedDefaults = new HashSet<>();
        for (List<PpdStatement> installable : grouped.installables()) {
            for (PpdStatement statement : installable) {
                if (statement.mainKeyword().startsWith(PpdKeywords.DEFAULT)) {
                    String uiKeyword = statement.mainKeyword().substring(PpdKeywords.DEFAULT.length());
                    installedDefaults.add(new KeywordPair(uiKeyword, statement.value()));
                }
            }
        }

        Set<KeywordPair> forbidden = new HashSet<>();
        for (PpdStatement statement : grouped.constraints()) {
            Matcher matcher = CONSTRAINT.matcher(statement.value());
            if (!matcher.matches()) {
                log.warn("Ignoring malformed UIConstraints value: {}", statement.value());
                continue;
            }
            if (installedDefaults.contains(new KeywordPair(matcher.group(1), matcher.group(2)))) {
                forbidden.add(new KeywordPair(matcher.group(3), matcher.group(4)));
            }
        }
        if (forbidden.isEmpty()) {
            return grouped;
        }

        List<List<PpdStatement>> filtered = grouped.openUis().stream()
                .map(block -> block.stream()
                        .filter(statement -> !forbidden.contains(
                                new KeywordPair(statement.mainKeyword(), statement.optionKeyword())))
                        .toList())
                .toList();
        return grouped.withOpenUis(filtered);
    }

    private static void appendToLast(List<List<PpdStatement>> blocks, PpdStatement statement) {
        if (!blocks.isEmpty()) {
            blocks.get(blocks.size() - 1).add(statement);
        }
    }

    /**
     * Keyword and value that together name one choice of one control.
     */
    record KeywordPair(String keyword, String value) {
    }
}
