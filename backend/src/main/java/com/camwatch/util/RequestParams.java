package com.camwatch.util;

import jakarta.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import ru.tinkoff.kora.http.server.common.HttpServerRequest;

public final class RequestParams {
    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final Map<String, String> values;

    private RequestParams(Map<String, String> values) {
        this.values = values;
    }

    public static RequestParams from(HttpServerRequest request) throws IOException {
        String contentType = request.headers().getFirst("Content-Type");
        byte[] body = new byte[0];
        if (isForm(contentType)) {
            try (InputStream in = request.body().asInputStream()) {
                body = in.readAllBytes();
            }
        }
        return of(request.queryParams(), contentType, body);
    }

    public static RequestParams of(Map<String, ? extends Collection<String>> query,
                                   @Nullable String contentType,
                                   byte[] body) {
        Map<String, String> values = new HashMap<>();
        if (isForm(contentType) && body.length > 0) {
            values.putAll(parseForm(new String(body, StandardCharsets.UTF_8)));
        }
        for (var entry : query.entrySet()) {
            Collection<String> params = entry.getValue();
            if (params == null || params.isEmpty()) {
                continue;
            }
            String value = params.iterator().next();
            if (value != null && !value.isBlank()) {
                values.put(entry.getKey(), value);
            }
        }
        return new RequestParams(values);
    }

    @Nullable
    public String get(String name) {
        return values.get(name);
    }

    private static boolean isForm(@Nullable String contentType) {
        return contentType != null
            && contentType.toLowerCase(Locale.ROOT).startsWith(FORM_CONTENT_TYPE);
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> form = new HashMap<>();
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            form.putIfAbsent(
                URLDecoder.decode(key, StandardCharsets.UTF_8),
                URLDecoder.decode(value, StandardCharsets.UTF_8)
            );
        }
        return form;
    }
}
