package com.xedledom.thumbnails;

/**
 * A preview asset: where it came from and where it was saved. {@code localPath} is
 * empty when the download failed.
 */
public record ThumbnailAsset(String remoteUrl, String localPath) {

    public ThumbnailAsset {
        remoteUrl = remoteUrl == null ? "" : remoteUrl;
        localPath = localPath == null ? "" : localPath;
    }

    public boolean isDownloaded() {
        return !localPath.isEmpty();
    }
}
