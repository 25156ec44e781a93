package com.rightsparser.service.extraction;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the licensor, licensee and title in agreement text with plain pattern matching.
 *
 * Agreements usually open with numbered parties ("1. Sony Pictures Entertainment, a company ...
 * And 2. Star India, ...") and name the work in an "Assigned Film(s)" or quoted "Picture" clause.
 * The engine is told to use these values as found.
 */
@Slf4j
public class AgreementHintExtractor {

    private static final int MIN_PARTY_LENGTH = 6;
    private static final int MAX_TITLE_LENGTH = 100;

    private static final Set<String> ROLE_WORDS = Set.of("assignor", "assignee", "licensor", "licensee");

    private static final Pattern LICENSOR_LABEL =
            Pattern.compile("(?im)^\\s*(?:licensor|assignor)\\s*[:\\-]\\s*([^,\\n]+)");
    private static final Pattern LICENSEE_LABEL =
            Pattern.compile("(?im)^\\s*(?:licensee|assignee)\\s*[:\\-]\\s*([^,\\n]+)");
    private static final Pattern FIRST_PARTY = Pattern.compile("(?<![\\d.])1\\.\\s+([^,\\n]+),");
    private static final Pattern SECOND_PARTY = Pattern.compile("(?s)\\bAnd\\b.*?(?<![\\d.])2\\.\\s+([^,\\n]+),");

    private static final List<Pattern> TITLE_PATTERNS = List.of(
            Pattern.compile("Assigned Film\\(s\\)[:\\s]*([^\\n]+)"),
            Pattern.compile("Picture[:\\s]+\"([^\"]+)\""),
            Pattern.compile("Film[:\\s]+\"([^\"]+)\""),
            Pattern.compile("(?im)^\\s*title\\s*:\\s*([^\\n]+)")
    );

    private AgreementHintExtractor() {
    }

    public static AgreementHints extract(String text) {
        AgreementHints hints = AgreementHints.builder()
                .licensor(party(text, LICENSOR_LABEL, FIRST_PARTY))
                .licensee(party(text, LICENSEE_LABEL, SECOND_PARTY))
                .title(title(text))
                .build();
        log.debug("Agreement hints: licensor={}, licensee={}, title={}",
                hints.getLicensor(), hints.getLicensee(), hints.getTitle());
        return hints;
    }

    private static String party(String text, Pattern... patterns) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String name = matcher.group(1).trim();
                if (name.length() >= MIN_PARTY_LENGTH
                        && !name.contains("Page")
                        && !ROLE_WORDS.contains(name.toLowerCase(Locale.ROOT))) {
                    return name;
                }
            }
        }
        return null;
    }

    private static String title(String text) {
        for (Pattern pattern : TITLE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String title = matcher.group(1).trim();
                if (!title.isEmpty() && title.length() < MAX_TITLE_LENGTH) {
                    return title;
                }
            }
        }
        return null;
    }
}
