package com.xedledom.civitai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.xedledom.civitai.model.ModelRecord;
import com.xedledom.civitai.model.RecordMetadata;
import com.xedledom.fetch.FetchException;
import com.xedledom.fetch.FetchResult;
import com.xedledom.fetch.HttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a model page link through the public REST API.
 *
 * <p>The model id comes from the link path. Without a {@code modelVersionId} query
 * parameter the newest version of the model is used. The version record is the only
 * source for the fields of the result.
 */
public class CivitaiApiResolver implements MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(CivitaiApiResolver.class);
    public static final String DEFAULT_API_BASE = "https://civitai.com/api/v1";
    public static final String DEFAULT_WEB_BASE = "https://civitai.com";

    private final HttpFetcher fetcher;
    private final ObjectMapper mapper;
    private final String apiBase;
    private final String webBase;
    private final Duration timeout;
    private final int maxImages;

    public CivitaiApiResolver(HttpFetcher fetcher, ObjectMapper mapper, String apiBase, String webBase,
                              Duration timeout, int maxImages) {
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.apiBase = CivitaiUrls.stripTrailingSlash((apiBase == null || apiBase.isBlank()) ? DEFAULT_API_BASE : apiBase);
        this.webBase = CivitaiUrls.stripTrailingSlash((webBase == null || webBase.isBlank()) ? DEFAULT_WEB_BASE : webBase);
        this.timeout = timeout;
        this.maxImages = Math.max(0, maxImages);
    }

    @Override
    public ModelRecord resolve(String name, String url) throws ResolutionException, InterruptedException {
        String modelId = CivitaiUrls.modelId(url)
                .orElseThrow(() -> new ResolutionException("No model ID found in URL: " + url));

        String versionId = CivitaiUrls.versionId(url).orElse(null);
        if (versionId == null) {
            versionId = latestVersionId(modelId);
        }

        JsonNode version = getJson(apiBase + "/model-versions/" + versionId, "version " + versionId);
        if (version == null || !version.isObject() || version.isEmpty()) {
            throw new ResolutionException("Failed to fetch version " + versionId);
        }
        return toRecord(name, url, modelId, version);
    }

    private String latestVersionId(String modelId) throws ResolutionException, InterruptedException {
        JsonNode model = getJson(apiBase + "/models/" + modelId, "model " + modelId);
        JsonNode versions = model == null ? null : model.get("modelVersions");
        if (versions == null || !versions.isArray() || versions.isEmpty()) {
            throw new ResolutionException("Could not determine version ID for model " + modelId);
        }
        JsonNode id = versions.get(0).get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw new ResolutionException("Latest version of model " + modelId + " has no ID");
        }
        log.debug("Model {} resolved to latest version {}", modelId, id.asText());
        return id.asText();
    }

    ModelRecord toRecord(String name, String url, String urlModelId, JsonNode v) {
        JsonNode model = v.path("model");
        JsonNode file = firstElement(v.get("files"));

        String modelName = optText(model, "name");
        String versionName = optText(v, "name");
        String title = trimDashes(modelName + " - " + versionName);

        String trainedWords = joinTexts(v.get("trainedWords"));
        String size = file.has("sizeKB") ? SizeFormatter.fromKilobytes(file.path("sizeKB").asDouble(0)) : "";
        String downloadUrl = optText(file, "downloadUrl");
        String createdAt = optText(v, "createdAt");
        String publishedOn = createdAt.contains("T") ? createdAt.substring(0, createdAt.indexOf('T')) : createdAt;

        String modelId = optText(model, "id");
        if (modelId.isEmpty()) {
            modelId = urlModelId;
        }

        List<String> images = new ArrayList<>();
        JsonNode imageNodes = v.get("images");
        if (imageNodes != null && imageNodes.isArray()) {
            for (JsonNode img : imageNodes) {
                if (images.size() >= maxImages) break;
                images.add(optText(img, "url"));
            }
        }
        String firstImage = images.stream().filter(s -> !s.isEmpty()).findFirst().orElse("");

        RecordMetadata metadata = new RecordMetadata(
                trainedWords,
                hashes(file.get("hashes")),
                optText(v, "description"),
                "",
                downloadUrl.isEmpty() ? url : downloadUrl,
                publishedOn,
                ""
        );
        return new ModelRecord(
                name,
                title,
                optText(model, "type").toLowerCase(Locale.ROOT),
                versionName,
                optText(v, "baseModel"),
                optText(v, "baseModelType"),
                size,
                firstImage,
                "",
                images.stream().filter(s -> !s.isEmpty()).toList(),
                List.of(),
                CivitaiUrls.modelLink(webBase, modelId),
                metadata
        );
    }

    private JsonNode getJson(String apiUrl, String what) throws ResolutionException, InterruptedException {
        try {
            FetchResult result = fetcher.fetch(apiUrl, timeout);
            return mapper.readTree(result.body());
        } catch (FetchException e) {
            throw new ResolutionException("API request for " + what + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ResolutionException("API response for " + what + " is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static JsonNode firstElement(JsonNode array) {
        if (array != null && array.isArray() && !array.isEmpty() && array.get(0).isObject()) {
            return array.get(0);
        }
        return MissingNode.getInstance();
    }

    private static Map<String, String> hashes(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                if (e.getValue() != null && !e.getValue().isNull()) {
                    out.put(e.getKey(), e.getValue().asText());
                }
            }
        }
        return out;
    }

    private static String joinTexts(JsonNode array) {
        if (array == null || !array.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode n : array) {
            if (n != null && !n.isNull()) {
                parts.add(n.asText());
            }
        }
        return String.join(", ", parts);
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == ' ' || s.charAt(start) == '-')) start++;
        while (end > start && (s.charAt(end - 1) == ' ' || s.charAt(end - 1) == '-')) end--;
        return s.substring(start, end);
    }

    static String optText(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) {
            return "";
        }
        return v.asText();
    }
}
