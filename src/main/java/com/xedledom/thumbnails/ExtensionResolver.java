package com.xedledom.thumbnails;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the file extension for a downloaded asset from its URL and response content type.
 */
public final class ExtensionResolver {

    static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".webp");
    static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".webm");
    static final String FALLBACK = ".dat";

    private ExtensionResolver() {}

    public static String resolve(String url, String contentType) {
        String ext = urlExtension(url);
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (type.contains("image")) {
            return IMAGE_EXTENSIONS.contains(ext) ? ext : ".jpg";
        }
        if (type.contains("video")) {
            return VIDEO_EXTENSIONS.contains(ext) ? ext : ".mp4";
        }
        return ext.isEmpty() ? FALLBACK : ext;
    }

    static String urlExtension(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
            int cut = path.indexOf('?');
            if (cut >= 0) path = path.substring(0, cut);
        }
        if (path == null) {
            return "";
        }
        String last = path.substring(path.lastIndexOf('/') + 1);
        int dot = last.lastIndexOf('.');
        if (dot < 0 || dot == last.length() - 1) {
            return "";
        }
        return last.substring(dot).toLowerCase(Locale.ROOT);
    }
}
