package com.xedledom.thumbnails;

import com.xedledom.fetch.FetchedStream;
import com.xedledom.fetch.HttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Downloads preview images and videos into a flat directory as {@code <id>[_T<n>].<ext>}.
 * A failed download never throws: the asset keeps its remote URL and gets an empty local path.
 */
public class ThumbnailDownloader {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailDownloader.class);
    public static final int DEFAULT_MAX_PER_RECORD = 5;

    private final HttpFetcher fetcher;
    private final Path directory;
    private final Duration timeout;
    private final int maxPerRecord;

    public ThumbnailDownloader(HttpFetcher fetcher, Path directory, Duration timeout, int maxPerRecord) {
        this.fetcher = fetcher;
        this.directory = directory;
        this.timeout = timeout;
        this.maxPerRecord = Math.max(0, maxPerRecord);
    }

    public ThumbnailDownloader(HttpFetcher fetcher, Path directory, Duration timeout) {
        this(fetcher, directory, timeout, DEFAULT_MAX_PER_RECORD);
    }

    public ThumbnailAsset acquire(String assetUrl, String idBase) {
        if (assetUrl == null || assetUrl.isBlank()) {
            return new ThumbnailAsset("", "");
        }
        String url = assetUrl.trim();
        try (FetchedStream stream = fetcher.open(url, timeout)) {
            if (!stream.isSuccess()) {
                log.warn("Thumbnail HTTP {} for {}", stream.statusCode(), url);
                return new ThumbnailAsset(url, "");
            }
            String ext = ExtensionResolver.resolve(url, stream.contentType());
            Files.createDirectories(directory);
            Path target = directory.resolve(idBase + ext);
            Files.copy(stream.body(), target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved thumbnail {}", target.getFileName());
            return new ThumbnailAsset(url, target.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Thumbnail download interrupted: {}", url);
            return new ThumbnailAsset(url, "");
        } catch (IOException | RuntimeException e) {
            log.warn("Thumbnail download failed for {}: {}", url, e.getMessage());
            return new ThumbnailAsset(url, "");
        }
    }

    /**
     * Acquires up to the per-record cap, naming each {@code <id>_T<n>} with n starting at 1.
     */
    public ThumbnailSet acquireAll(List<String> assetUrls, String id) {
        if (assetUrls == null || assetUrls.isEmpty() || maxPerRecord == 0) {
            return ThumbnailSet.EMPTY;
        }
        List<ThumbnailAsset> assets = new ArrayList<>();
        int index = 0;
        for (String url : assetUrls) {
            if (index >= maxPerRecord || Thread.currentThread().isInterrupted()) {
                break;
            }
            index++;
            if (url == null || url.isBlank()) {
                continue;
            }
            assets.add(acquire(url, id + "_T" + index));
        }
        return new ThumbnailSet(assets);
    }
}
