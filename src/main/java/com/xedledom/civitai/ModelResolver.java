package com.xedledom.civitai;

import com.xedledom.civitai.model.ModelRecord;
import com.xedledom.civitai.model.PageMetadata;
import com.xedledom.civitai.model.RecordMetadata;
import com.xedledom.fetch.FetchException;
import com.xedledom.fetch.FetchResult;
import com.xedledom.fetch.HttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * API first; when that fails and the page fallback is enabled, the model page itself is
 * fetched and scraped. If both fail the API error is thrown with the page error suppressed.
 */
public class ModelResolver implements MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private final MetadataResolver api;
    private final HttpFetcher fetcher;
    private final CivitaiPageParser pageParser;
    private final String webBase;
    private final Duration timeout;
    private final boolean htmlFallback;

    public ModelResolver(MetadataResolver api, HttpFetcher fetcher, CivitaiPageParser pageParser,
                         String webBase, Duration timeout, boolean htmlFallback) {
        this.api = api;
        this.fetcher = fetcher;
        this.pageParser = pageParser;
        this.webBase = (webBase == null || webBase.isBlank()) ? CivitaiApiResolver.DEFAULT_WEB_BASE : webBase;
        this.timeout = timeout;
        this.htmlFallback = htmlFallback;
    }

    @Override
    public ModelRecord resolve(String name, String url) throws ResolutionException, InterruptedException {
        try {
            return api.resolve(name, url);
        } catch (ResolutionException apiError) {
            if (!htmlFallback) {
                throw apiError;
            }
            log.info("API resolution failed for {} ({}), scraping the page instead", url, apiError.getMessage());
            try {
                return fromPage(name, url);
            } catch (ResolutionException pageError) {
                apiError.addSuppressed(pageError);
                throw apiError;
            }
        }
    }

    ModelRecord fromPage(String name, String url) throws ResolutionException, InterruptedException {
        String html;
        try {
            FetchResult result = fetcher.fetch(url, timeout);
            html = result.bodyAsString();
        } catch (FetchException e) {
            throw new ResolutionException("Page request failed: " + e.getMessage(), e);
        }
        PageMetadata page = pageParser.parse(url, html);
        if (page.title().isEmpty()) {
            throw new ResolutionException("Page at " + url + " has no recognizable model title");
        }
        return toRecord(name, url, page);
    }

    ModelRecord toRecord(String name, String url, PageMetadata page) {
        String modelLink = CivitaiUrls.modelId(url)
                .map(id -> CivitaiUrls.modelLink(webBase, id))
                .orElse(url.trim());
        List<String> thumbnails = page.thumbnailUrl().isEmpty() ? List.of() : List.of(page.thumbnailUrl());
        RecordMetadata metadata = new RecordMetadata(
                page.triggerWords(),
                Map.of(),
                page.descriptionHtml(),
                page.aboutVersionHtml(),
                page.downloadLink(),
                page.publishedOn(),
                page.videoUrl()
        );
        return new ModelRecord(
                name,
                page.title(),
                page.type().toLowerCase(Locale.ROOT),
                page.version(),
                page.baseModel(),
                "",
                page.size(),
                page.thumbnailUrl(),
                "",
                thumbnails,
                List.of(),
                modelLink,
                metadata
        );
    }
}
