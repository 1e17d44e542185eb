package com.xedledom.links;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the link file: a JSON object mapping a model filename to one URL, a
 * comma-separated string of URLs, or an array of URLs.
 *
 * <p>Blank keys derive the name from the last path segment of each URL. Values with
 * no usable URL are skipped without error. Order of the file is the processing order.
 */
public class LinkLoader {

    private static final Logger log = LoggerFactory.getLogger(LinkLoader.class);
    static final String UNNAMED = "unnamed";

    private final ObjectMapper mapper;

    public LinkLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<LinkEntry> load(Path file) throws LinkLoadException {
        if (file == null || !Files.exists(file)) {
            throw new LinkLoadException("Link file not found: " + file);
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LinkLoadException("Could not read link file " + file + ": " + e.getMessage(), e);
        }
        return parse(json);
    }

    public List<LinkEntry> parse(String json) throws LinkLoadException {
        JsonNode root;
        try {
            root = mapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new LinkLoadException("Invalid JSON format: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new LinkLoadException("Link file must contain a JSON object of name -> url(s)");
        }

        List<LinkEntry> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey() == null ? "" : field.getKey().trim();
            List<String> urls = extractUrls(field.getValue());
            if (urls.isEmpty()) {
                log.debug("Skipping '{}': no usable URL", name);
                continue;
            }
            for (String url : urls) {
                entries.add(new LinkEntry(name.isEmpty() ? nameFromUrl(url) : name, url));
            }
        }
        return entries;
    }

    static List<String> extractUrls(JsonNode value) {
        List<String> candidates = new ArrayList<>();
        if (value == null || value.isNull()) {
            return candidates;
        }
        if (value.isTextual()) {
            for (String part : value.asText().split(",")) {
                candidates.add(part.trim());
            }
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                if (item != null && item.isValueNode() && !item.isNull()) {
                    candidates.add(item.asText().trim());
                }
            }
        }

        List<String> urls = new ArrayList<>();
        for (String candidate : candidates) {
            if (isUrl(candidate)) {
                urls.add(candidate);
            }
        }
        return urls;
    }

    private static boolean isUrl(String candidate) {
        return candidate != null
                && !candidate.isEmpty()
                && !candidate.startsWith("#")
                && candidate.contains("http");
    }

    static String nameFromUrl(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = stripSchemeAndQuery(url);
        }
        if (path == null) {
            return UNNAMED;
        }
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isBlank()) {
                return segments[i].trim();
            }
        }
        return UNNAMED;
    }

    private static String stripSchemeAndQuery(String url) {
        String s = url;
        int scheme = s.indexOf("://");
        if (scheme >= 0) {
            s = s.substring(scheme + 3);
            int slash = s.indexOf('/');
            s = slash >= 0 ? s.substring(slash) : "";
        }
        int cut = s.indexOf('?');
        if (cut >= 0) s = s.substring(0, cut);
        cut = s.indexOf('#');
        if (cut >= 0) s = s.substring(0, cut);
        return s;
    }
}
