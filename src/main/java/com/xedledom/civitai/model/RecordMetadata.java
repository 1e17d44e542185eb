package com.xedledom.civitai.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nested {@code metadata} block of a {@link ModelRecord}. Missing values are empty, never null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"trained_words", "hashes", "description", "about_version", "download_link", "published_on", "video_url"})
public record RecordMetadata(
        @JsonProperty("trained_words") String trainedWords,
        @JsonProperty("hashes") Map<String, String> hashes,
        @JsonProperty("description") String description,
        @JsonProperty("about_version") String aboutVersion,
        @JsonProperty("download_link") String downloadLink,
        @JsonProperty("published_on") String publishedOn,
        @JsonProperty("video_url") String videoUrl
) {

    public static final RecordMetadata EMPTY = new RecordMetadata(null, null, null, null, null, null, null);

    public RecordMetadata {
        trainedWords = nz(trainedWords);
        hashes = copyOf(hashes);
        description = nz(description);
        aboutVersion = nz(aboutVersion);
        downloadLink = nz(downloadLink);
        publishedOn = nz(publishedOn);
        videoUrl = nz(videoUrl);
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    static String nz(String s) {
        return s == null ? "" : s;
    }
}
