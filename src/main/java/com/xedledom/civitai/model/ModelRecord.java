package com.xedledom.civitai.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * One resolved model, stored in the registry under its allocated identifier.
 *
 * <p>Every field is present: absent strings become {@code ""}, absent lists and the
 * metadata block become empty. Lists are copied, so a record never changes after
 * construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"filename", "title", "type", "version", "base_model", "base_model_type", "size",
        "thumbnail", "thumbnail_local", "thumbnails_all", "thumbnails_local", "model_link", "metadata"})
public record ModelRecord(
        @JsonProperty("filename") String filename,
        @JsonProperty("title") String title,
        @JsonProperty("type") String type,
        @JsonProperty("version") String version,
        @JsonProperty("base_model") String baseModel,
        @JsonProperty("base_model_type") String baseModelType,
        @JsonProperty("size") String size,
        @JsonProperty("thumbnail") String thumbnail,
        @JsonProperty("thumbnail_local") String thumbnailLocal,
        @JsonProperty("thumbnails_all") List<String> thumbnailsAll,
        @JsonProperty("thumbnails_local") List<String> thumbnailsLocal,
        @JsonProperty("model_link") String modelLink,
        @JsonProperty("metadata") RecordMetadata metadata
) {

    public ModelRecord {
        filename = RecordMetadata.nz(filename);
        title = RecordMetadata.nz(title);
        type = RecordMetadata.nz(type);
        version = RecordMetadata.nz(version);
        baseModel = RecordMetadata.nz(baseModel);
        baseModelType = RecordMetadata.nz(baseModelType);
        size = RecordMetadata.nz(size);
        thumbnail = RecordMetadata.nz(thumbnail);
        thumbnailLocal = RecordMetadata.nz(thumbnailLocal);
        thumbnailsAll = copyOf(thumbnailsAll);
        thumbnailsLocal = copyOf(thumbnailsLocal);
        modelLink = RecordMetadata.nz(modelLink);
        metadata = metadata == null ? RecordMetadata.EMPTY : metadata;
    }

    /**
     * Same record with the downloaded preview assets filled in.
     */
    public ModelRecord withThumbnails(String primaryRemote, String primaryLocal, List<String> remote, List<String> local) {
        return new ModelRecord(filename, title, type, version, baseModel, baseModelType, size,
                primaryRemote, primaryLocal, remote, local, modelLink, metadata);
    }

    private static List<String> copyOf(List<String> source) {
        return source == null ? List.of() : source.stream().filter(Objects::nonNull).toList();
    }
}
