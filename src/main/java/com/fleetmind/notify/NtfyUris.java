package com.fleetmind.notify;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

final class NtfyUris {

    private NtfyUris() {}

    static URI topic(String server, String topic) {
        return URI.create(trimSlash(server) + "/" + URLEncoder.encode(topic, StandardCharsets.UTF_8));
    }

    /** JSON stream endpoint, resuming after {@code since} when given. */
    static URI stream(String server, String topic, String since) {
        String base = topic(server, topic) + "/json";
        if (since == null || since.isBlank()) {
            return URI.create(base);
        }
        return URI.create(base + "?since=" + URLEncoder.encode(since, StandardCharsets.UTF_8));
    }

    private static String trimSlash(String server) {
        String s = server == null ? "" : server.trim();
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
