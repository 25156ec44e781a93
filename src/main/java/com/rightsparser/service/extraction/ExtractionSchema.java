package com.rightsparser.service.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level keys every extracted payload carries, in prompt order.
 */
public final class ExtractionSchema {

    private static final Map<String, String> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put("parties", "licensor and licensee with names, roles and addresses");
        FIELDS.put("content", "title, type (film or series), language, genre and other identifying details");
        FIELDS.put("territory", "countries or regions where the rights apply");
        FIELDS.put("media_rights", "licensed media and platforms, exclusivity, holdbacks");
        FIELDS.put("term", "duration, start date and end date of the license");
        FIELDS.put("financial_terms", "license fee or deal value, currency, payment schedule and royalties");
        FIELDS.put("deliverables", "materials the licensor must deliver");
        FIELDS.put("technical_specifications", "format, resolution, audio and subtitle requirements");
        FIELDS.put("governing_law", "applicable law and jurisdiction for disputes");
        FIELDS.put("signatories", "people who signed, with titles and signature dates");
    }

    public static final List<String> REQUIRED_KEYS = List.copyOf(FIELDS.keySet());

    private ExtractionSchema() {
    }

    public static Map<String, String> descriptions() {
        return Collections.unmodifiableMap(FIELDS);
    }
}
