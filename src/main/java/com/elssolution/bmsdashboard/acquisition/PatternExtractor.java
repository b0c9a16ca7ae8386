package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.MalformedDocumentException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the quoted payload of {@code key = "..."} out of a controller page.
 *
 * The pages are made for browsers; the telemetry sits in a single JavaScript
 * assignment. Payloads never contain escaped quotes.
 */
public class PatternExtractor {

    // compiled once per key, shared by all legs
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public String extract(String document, String key) throws MalformedDocumentException {
        if (document == null || document.isEmpty()) {
            throw new MalformedDocumentException(key, "empty document, expected '" + key + "'");
        }
        Matcher m = patternFor(key).matcher(document);
        if (!m.find()) {
            throw new MalformedDocumentException(key, "key '" + key + "' not found in document ("
                    + document.length() + " chars)");
        }
        String payload = m.group(1);
        if (m.find()) {
            throw new MalformedDocumentException(key, "key '" + key + "' assigned more than once");
        }
        return payload;
    }

    private Pattern patternFor(String key) {
        // identifier boundaries keep "PSet" from matching inside "PSet0" or "xPSet"
        return patterns.computeIfAbsent(key, k ->
                Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(k) + "\\s*=\\s*\"([^\"]*)\""));
    }
}
