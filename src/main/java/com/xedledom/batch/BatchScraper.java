package com.xedledom.batch;

import com.xedledom.civitai.MetadataResolver;
import com.xedledom.civitai.ResolutionException;
import com.xedledom.civitai.model.ModelRecord;
import com.xedledom.fetch.Sleeper;
import com.xedledom.ids.IdAllocator;
import com.xedledom.links.LinkEntry;
import com.xedledom.links.LinkLoadException;
import com.xedledom.links.LinkLoader;
import com.xedledom.registry.RegistryWriteException;
import com.xedledom.registry.RegistryWriter;
import com.xedledom.thumbnails.ThumbnailDownloader;
import com.xedledom.thumbnails.ThumbnailSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs the whole pipeline over a link list: resolve each entry, download its thumbnails,
 * file it under a fresh identifier, then write the registry once at the end.
 *
 * <p>A failing entry is counted and skipped, whichever step fails. A failing registry write is reported in the
 * summary; thumbnails already on disk stay there.
 */
public class BatchScraper {

    private static final Logger log = LoggerFactory.getLogger(BatchScraper.class);

    private final LinkLoader linkLoader;
    private final MetadataResolver resolver;
    private final ThumbnailDownloader thumbnails;
    private final IdAllocator ids;
    private final RegistryWriter registryWriter;
    private final Path registryFile;
    private final BatchOptions options;
    private final Sleeper sleeper;

    private volatile BatchState state = BatchState.IDLE;

    public BatchScraper(LinkLoader linkLoader,
                        MetadataResolver resolver,
                        ThumbnailDownloader thumbnails,
                        IdAllocator ids,
                        RegistryWriter registryWriter,
                        Path registryFile,
                        BatchOptions options,
                        Sleeper sleeper) {
        this.linkLoader = linkLoader;
        this.resolver = resolver;
        this.thumbnails = thumbnails;
        this.ids = ids;
        this.registryWriter = registryWriter;
        this.registryFile = registryFile;
        this.options = options == null ? BatchOptions.DEFAULT : options;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public BatchState getState() {
        return state;
    }

    public BatchSummary run(Path linksFile) throws LinkLoadException, InterruptedException {
        state = BatchState.LOADING;
        List<LinkEntry> links = linkLoader.load(linksFile);
        log.info("Loaded {} links from {}", links.size(), linksFile);
        return run(links);
    }

    public BatchSummary run(List<LinkEntry> links) throws InterruptedException {
        List<LinkEntry> entries = links;
        if (options.limit() > 0 && entries.size() > options.limit()) {
            log.info("Limiting run to the first {} of {} entries", options.limit(), entries.size());
            entries = entries.subList(0, options.limit());
        }

        state = BatchState.PROCESSING;
        RecordCollector collector = new RecordCollector();
        log.info("=== Starting scrape: {} models ===", entries.size());
        try {
            if (options.workers() <= 1 || entries.size() <= 1) {
                for (int i = 0; i < entries.size(); i++) {
                    process(i + 1, entries.size(), entries.get(i), collector);
                }
            } else {
                processPooled(entries, collector);
            }
        } catch (InterruptedException e) {
            log.warn("Run interrupted after {} entries; registry not written", collector.succeeded() + collector.failedCount());
            throw e;
        }

        state = BatchState.SAVING;
        Map<String, ModelRecord> registry = collector.snapshot();
        boolean written = save(registry);

        state = BatchState.DONE;
        BatchSummary summary = new BatchSummary(collector.succeeded(), collector.failedCount(), entries.size(),
                registry, written, registryFile);
        log.info("=== Summary === succeeded: {}, failed: {}, entries: {}, registry: {}",
                summary.succeeded(), summary.failed(), summary.total(), written ? registryFile : "NOT written");
        return summary;
    }

    private void processPooled(List<LinkEntry> entries, RecordCollector collector) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(options.workers());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < entries.size(); i++) {
                int index = i + 1;
                LinkEntry entry = entries.get(i);
                futures.add(pool.submit(() -> {
                    process(index, entries.size(), entry, collector);
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    collector.failed();
                    log.error("Worker failed unexpectedly: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void process(int index, int total, LinkEntry entry, RecordCollector collector) throws InterruptedException {
        log.info("-> [{}/{}] Fetching: {}", index, total, entry.name());
        long start = System.nanoTime();

        ModelRecord resolved;
        try {
            resolved = resolver.resolve(entry.name(), entry.url());
        } catch (ResolutionException | RuntimeException e) {
            log.warn("  Failed: {} ({})", entry.url(), e.getMessage());
            collector.failed();
            return;
        }

        String id;
        ModelRecord record;
        try {
            id = ids.next();
            ThumbnailSet thumbs = thumbnails.acquireAll(resolved.thumbnailsAll(), id);
            record = thumbs.assets().isEmpty()
                    ? resolved
                    : resolved.withThumbnails(thumbs.primaryRemote(), thumbs.primaryLocal(), thumbs.remoteUrls(), thumbs.localPaths());
            collector.add(id, record);
        } catch (RuntimeException e) {
            log.warn("  Failed to file {}: {}", entry.url(), e.getMessage());
            collector.failed();
            return;
        }

        double seconds = (System.nanoTime() - start) / 1_000_000_000d;
        log.info("  {} parsed in {}s: {} / {} / {}", id, String.format("%.1f", seconds),
                record.type(), record.baseModel(), record.size());
        politenessPause();
    }

    private boolean save(Map<String, ModelRecord> registry) {
        try {
            registryWriter.write(registryFile, registry);
            return true;
        } catch (RegistryWriteException e) {
            log.error("Failed to save output JSON: {}", e.getMessage());
            return false;
        }
    }

    private void politenessPause() throws InterruptedException {
        long min = options.delayMin().toMillis();
        long max = options.delayMax().toMillis();
        long millis = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
        if (millis > 0) {
            sleeper.sleep(Duration.ofMillis(millis));
        }
    }
}
