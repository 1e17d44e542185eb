package com.xedledom;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xedledom.batch.BatchOptions;
import com.xedledom.batch.BatchScraper;
import com.xedledom.batch.BatchSummary;
import com.xedledom.civitai.CivitaiApiResolver;
import com.xedledom.civitai.CivitaiPageParser;
import com.xedledom.civitai.ModelResolver;
import com.xedledom.fetch.FetchPolicy;
import com.xedledom.fetch.HostThrottle;
import com.xedledom.fetch.HttpFetcher;
import com.xedledom.ids.IdAllocator;
import com.xedledom.ids.RandomIdAllocator;
import com.xedledom.ids.SequentialIdAllocator;
import com.xedledom.links.LinkLoadException;
import com.xedledom.links.LinkLoader;
import com.xedledom.registry.RegistryWriter;
import com.xedledom.thumbnails.ThumbnailDownloader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Set;

/**
 * Usage: {@code modeldex [links.json] [registry.json] [thumbnailDir]}.
 * Arguments override the configured paths.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_LINKS_UNREADABLE = 2;
    static final int EXIT_REGISTRY_NOT_WRITTEN = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length > 0) Config.override(Config.LINKS_FILE, args[0]);
        if (args.length > 1) Config.override(Config.OUTPUT_REGISTRY, args[1]);
        if (args.length > 2) Config.override(Config.OUTPUT_THUMBNAILS, args[2]);
        Config.printStatus();

        ObjectMapper mapper = new ObjectMapper();
        Duration fetchTimeout = Duration.ofSeconds(Config.getFetchTimeoutSeconds());

        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(fetchTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        HostThrottle throttle = new HostThrottle(
                Duration.ofMillis(Config.getHostMinIntervalMs()),
                Duration.ofSeconds(Config.getCooldownSeconds()));
        FetchPolicy policy = new FetchPolicy(
                Config.getFetchRetries(),
                Duration.ofMillis(Config.getBackoffMinMs()),
                Duration.ofMillis(Config.getBackoffMaxMs()));
        HttpFetcher fetcher = new HttpFetcher(http, Config.getUserAgent(), throttle, policy);

        CivitaiApiResolver api = new CivitaiApiResolver(fetcher, mapper, Config.getApiBase(), Config.getWebBase(),
                fetchTimeout, Config.getThumbnailMaxPerRecord());
        ModelResolver resolver = new ModelResolver(api, fetcher, new CivitaiPageParser(mapper), Config.getWebBase(),
                fetchTimeout, Config.isHtmlFallbackEnabled());

        Path registryFile = Config.getRegistryFile();
        RegistryWriter registryWriter = new RegistryWriter(mapper);
        ThumbnailDownloader thumbnails = new ThumbnailDownloader(fetcher, Config.getThumbnailDir(),
                Duration.ofSeconds(Config.getThumbnailTimeoutSeconds()), Config.getThumbnailMaxPerRecord());
        BatchOptions options = new BatchOptions(
                Config.getBatchLimit(),
                Config.getBatchWorkers(),
                Duration.ofMillis(Config.getBatchDelayMinMs()),
                Duration.ofMillis(Config.getBatchDelayMaxMs()));

        BatchScraper scraper = new BatchScraper(new LinkLoader(mapper), resolver, thumbnails,
                idAllocator(registryWriter, registryFile), registryWriter, registryFile, options, null);
        try {
            BatchSummary summary = scraper.run(Config.getLinksFile());
            return summary.registryWritten() ? EXIT_OK : EXIT_REGISTRY_NOT_WRITTEN;
        } catch (LinkLoadException e) {
            log.error("Cannot load links: {}", e.getMessage());
            return EXIT_LINKS_UNREADABLE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted, registry not written");
            return EXIT_REGISTRY_NOT_WRITTEN;
        }
    }

    static IdAllocator idAllocator(RegistryWriter registryWriter, Path registryFile) {
        if (!"random".equals(Config.getIdStrategy())) {
            return new SequentialIdAllocator();
        }
        Set<String> known = Set.of();
        try {
            known = registryWriter.read(registryFile).keySet();
        } catch (IOException e) {
            log.warn("Could not read existing ids from {}: {}", registryFile, e.getMessage());
        }
        return RandomIdAllocator.numeric(SequentialIdAllocator.DEFAULT_PREFIX, Config.getRandomIdLength(),
                new SecureRandom(), known);
    }
}
