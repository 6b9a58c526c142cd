package com.phillippitts.catalogintel.service.ingest;

import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.IngestException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.util.Deadline;
import com.phillippitts.catalogintel.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Downloads remote images into a local cache and validates local image paths.
 *
 * <p>{@code http(s)} references are fetched once and reused from
 * {@code <cacheDir>/<slug>_<digest><ext>}. {@code file:} URIs and bare paths are checked in
 * place. Each download is bounded by the smaller of the ingest timeout and the time left on
 * the record deadline.
 */
public class CachingImageIngestor implements ImageIngestor {

    private static final Logger LOG = LogManager.getLogger(CachingImageIngestor.class);

    private final Path cacheDir;
    private final Duration ingestTimeout;
    private final HttpClient httpClient;

    public CachingImageIngestor(Path cacheDir, Duration ingestTimeout) {
        this(cacheDir, ingestTimeout, HttpClient.newBuilder()
                .connectTimeout(ingestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public CachingImageIngestor(Path cacheDir, Duration ingestTimeout, HttpClient httpClient) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir must not be null");
        this.ingestTimeout = Objects.requireNonNull(ingestTimeout, "ingestTimeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public IngestedRecord ingest(ProductRecord record, Deadline deadline) {
        if (!record.hasImage()) {
            return IngestedRecord.withoutImage(record);
        }
        String reference = record.imageUrl();
        String ext = ImageFormats.extensionOf(reference);
        String scheme = schemeOf(reference);
        if ("http".equals(scheme) || "https".equals(scheme)) {
            return new IngestedRecord(record, download(record.productId(), reference, ext, deadline));
        }
        return new IngestedRecord(record, validateLocal(reference, scheme));
    }

    private Path download(String productId, String url, String ext, Deadline deadline) {
        Path destination = cacheDir.resolve(ImageFormats.cachedFileName(productId, url, ext));
        if (Files.isRegularFile(destination)) {
            LOG.debug("Image cache hit for {}: {}", productId, destination.getFileName());
            return destination;
        }

        Duration timeout = deadline.cap(ingestTimeout);
        if (timeout.isZero()) {
            throw new IngestException(StageErrorType.TIMEOUT, "No time left to download " + url);
        }

        long start = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new IngestException(StageErrorType.TIMEOUT,
                    "Timed out after " + timeout.toMillis() + "ms downloading " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestException(StageErrorType.TIMEOUT, "Download interrupted: " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new IngestException(StageErrorType.FETCH_FAILED, "Failed to download " + url + ": " + e.getMessage(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IngestException(StageErrorType.FETCH_FAILED,
                    "Failed to download " + url + ": HTTP " + response.statusCode());
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new IngestException(StageErrorType.UNSUPPORTED_FORMAT, "Empty image body from " + url);
        }

        store(destination, body);
        LOG.debug("Downloaded image for {} ({} bytes, {}ms)", productId, body.length, TimeUtils.elapsedMillis(start));
        return destination;
    }

    private void store(Path destination, byte[] body) {
        try {
            Files.createDirectories(cacheDir);
            Path tmp = Files.createTempFile(cacheDir, destination.getFileName().toString(), ".part");
            Files.write(tmp, body);
            Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IngestException(StageErrorType.FETCH_FAILED, "Failed to cache image at " + destination, e);
        }
    }

    private static Path validateLocal(String reference, String scheme) {
        Path path;
        try {
            path = "file".equals(scheme) ? Paths.get(new URI(reference)) : Paths.get(reference);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IngestException(StageErrorType.FETCH_FAILED, "Invalid image reference: " + reference, e);
        }
        if (!Files.isRegularFile(path)) {
            throw new IngestException(StageErrorType.FETCH_FAILED, "Local image not found: " + path);
        }
        try {
            if (Files.size(path) == 0) {
                throw new IngestException(StageErrorType.UNSUPPORTED_FORMAT, "Local image is empty: " + path);
            }
        } catch (IOException e) {
            throw new IngestException(StageErrorType.FETCH_FAILED, "Cannot read local image: " + path, e);
        }
        return path;
    }

    private static String schemeOf(String reference) {
        int colon = reference.indexOf("://");
        if (colon <= 0) {
            return reference.regionMatches(true, 0, "file:", 0, 5) ? "file" : "";
        }
        return reference.substring(0, colon).toLowerCase(Locale.ROOT);
    }
}
