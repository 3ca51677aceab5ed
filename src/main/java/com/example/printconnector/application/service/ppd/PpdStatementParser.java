package com.example.printconnector.application.service.ppd;

import com.example.printconnector.domain.model.ppd.PpdStatement;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits PPD text into {@link PpdStatement}s.
 * Multi-line quoted values stay inside one statement because lines are only split where a new directive starts.
 */
@Service
public class PpdStatementParser {

    private static final Pattern DIRECTIVE_START = Pattern.compile("(?:\r\n|\r|\n)\\*");
    private static final Pattern STATEMENT = Pattern.compile(
            "([^\\s:/]+)"                          // main keyword
                    + "(?:\\s+([^/:]+))?"          // option keyword
                    + "(?:/([^:]*))?"              // translation
                    + "(?::\\s*(?:\"([^\"]*)\"|(.*)))?\\s*");

    /**
     * Parses a whole PPD document.
     *
     * @param ppd document text
     * @return statements in document order, comments, queries and {@code End} markers removed
     */
    public List<PpdStatement> parse(String ppd) {
        if (ppd == null || ppd.isEmpty()) {
            return List.of();
        }
        String body = ppd.startsWith("*") ? ppd.substring(1) : ppd;

        List<PpdStatement> statements = new ArrayList<>();
        for (String line : DIRECTIVE_START.split(body)) {
            if (line.startsWith("%") || line.startsWith("?")) {
                continue;
            }
            Matcher matcher = STATEMENT.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String mainKeyword = matcher.group(1);
            if (PpdKeywords.END.equals(mainKeyword)) {
                continue;
            }
            statements.add(new PpdStatement(mainKeyword, matcher.group(2), matcher.group(3), value(matcher)));
        }
        return statements;
    }

    /**
     * Picks the quoted value when it has content, otherwise the unquoted remainder.
     */
    private static String value(Matcher matcher) {
        String quoted = trim(matcher.group(4));
        if (!quoted.isEmpty()) {
            return quoted;
        }
        return trim(matcher.group(5));
    }

    private static String trim(String text) {
        return text == null ? "" : text.strip();
    }
}
