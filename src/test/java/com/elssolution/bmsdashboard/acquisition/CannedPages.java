package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.TransportException;

import java.util.HashMap;
import java.util.Map;
import java.util.StringJoiner;

/** Serves fixed page bodies keyed by resource name; unknown pages fail like a dead host. */
class CannedPages implements EndpointFetcher {

    private final Map<String, String> pages = new HashMap<>();

    CannedPages put(String resource, String body) {
        pages.put(resource, body);
        return this;
    }

    @Override
    public String fetch(String address, String resource) throws TransportException {
        String body = pages.get(resource);
        if (body == null) throw new TransportException("connection refused: " + address + "/" + resource, 0);
        return body;
    }

    static String page(String... assignments) {
        StringBuilder sb = new StringBuilder("<html><head><script type=\"text/javascript\">\n");
        for (String a : assignments) sb.append("var ").append(a).append(";\n");
        return sb.append("</script></head><body></body></html>").toString();
    }

    static String assign(String key, String payload) {
        return key + " = \"" + payload + "\"";
    }

    /** Joins a header and samples into one payload. */
    static String csv(String header, int... values) {
        StringJoiner j = new StringJoiner(",");
        if (!header.isEmpty()) j.add(header);
        for (int v : values) j.add(Integer.toString(v));
        return j.toString();
    }
}
