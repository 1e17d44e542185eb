package com.xedledom.civitai.model;

/**
 * Fields scraped from a model page's markup by the HTML fallback. All values are
 * best effort and default to {@code ""}.
 */
public record PageMetadata(
        String title,
        String type,
        String baseModel,
        String publishedOn,
        String version,
        String aboutVersionHtml,
        String descriptionHtml,
        String triggerWords,
        String size,
        String thumbnailUrl,
        String videoUrl,
        String downloadLink
) {

    public PageMetadata {
        title = RecordMetadata.nz(title);
        type = RecordMetadata.nz(type);
        baseModel = RecordMetadata.nz(baseModel);
        publishedOn = RecordMetadata.nz(publishedOn);
        version = RecordMetadata.nz(version);
        aboutVersionHtml = RecordMetadata.nz(aboutVersionHtml);
        descriptionHtml = RecordMetadata.nz(descriptionHtml);
        triggerWords = RecordMetadata.nz(triggerWords);
        size = RecordMetadata.nz(size);
        thumbnailUrl = RecordMetadata.nz(thumbnailUrl);
        videoUrl = RecordMetadata.nz(videoUrl);
        downloadLink = RecordMetadata.nz(downloadLink);
    }
}
