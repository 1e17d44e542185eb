package com.xedledom.civitai;

import java.net.URI;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CivitaiUrls {

    private static final Pattern MODEL_ID = Pattern.compile("/models/(\\d+)");
    private static final Pattern VERSION_ID = Pattern.compile("[?&]modelVersionId=(\\d+)");

    private CivitaiUrls() {}

    public static Optional<String> modelId(String url) {
        return firstGroup(MODEL_ID, url);
    }

    public static Optional<String> versionId(String url) {
        return firstGroup(VERSION_ID, url);
    }

    /** Canonical page link for a model, never version-qualified. */
    public static String modelLink(String webBase, String modelId) {
        return stripTrailingSlash(webBase) + "/models/" + modelId;
    }

    public static String stripTrailingSlash(String base) {
        String b = base == null ? "" : base.trim();
        while (b.endsWith("/")) {
            b = b.substring(0, b.length() - 1);
        }
        return b;
    }

    /** Resolves a possibly relative URL against the page it was found on. Without a base it is returned as is. */
    public static String joinAbsolute(String base, String maybeRelative) {
        if (maybeRelative == null || maybeRelative.isBlank()) {
            return "";
        }
        String candidate = maybeRelative.trim();
        try {
            URI uri = URI.create(candidate);
            if (uri.getScheme() != null || base == null || base.isBlank()) {
                return candidate;
            }
            return URI.create(base.trim()).resolve(uri).toString();
        } catch (IllegalArgumentException e) {
            return candidate;
        }
    }

    private static Optional<String> firstGroup(Pattern pattern, String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(url);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
