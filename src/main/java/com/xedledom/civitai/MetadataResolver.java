package com.xedledom.civitai;

import com.xedledom.civitai.model.ModelRecord;

/**
 * Turns one (name, url) pair into a record. The returned record lists the remote preview
 * URLs in {@code thumbnails_all}; downloading them is left to the caller, which knows the
 * identifier the files are named after.
 */
public interface MetadataResolver {

    ModelRecord resolve(String name, String url) throws ResolutionException, InterruptedException;
}
