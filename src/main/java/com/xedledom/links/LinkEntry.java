package com.xedledom.links;

/**
 * One (name, url) pair to resolve. The name is the origin filename the record is filed under.
 */
public record LinkEntry(String name, String url) {}
