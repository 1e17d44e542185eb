package com.xedledom.thumbnails;

import java.util.List;

/**
 * The assets attempted for one record, in image-list order.
 */
public record ThumbnailSet(List<ThumbnailAsset> assets) {

    public static final ThumbnailSet EMPTY = new ThumbnailSet(List.of());

    public ThumbnailSet {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    /** Remote URL of the first attempted asset, downloaded or not. */
    public String primaryRemote() {
        List<String> remote = remoteUrls();
        return remote.isEmpty() ? "" : remote.get(0);
    }

    public String primaryLocal() {
        List<String> local = localPaths();
        return local.isEmpty() ? "" : local.get(0);
    }

    public List<String> remoteUrls() {
        return assets.stream()
                .map(ThumbnailAsset::remoteUrl)
                .filter(url -> !url.isEmpty())
                .toList();
    }

    public List<String> localPaths() {
        return assets.stream()
                .filter(ThumbnailAsset::isDownloaded)
                .map(ThumbnailAsset::localPath)
                .toList();
    }
}
