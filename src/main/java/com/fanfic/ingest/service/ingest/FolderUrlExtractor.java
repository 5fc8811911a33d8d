package com.fanfic.ingest.service.ingest;

import com.fanfic.ingest.service.config.FolderWatcherConfig;
import com.fanfic.ingest.service.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts URLs from *.url files in the watched folder.
 *
 * Each file holds a single URL, optionally surrounded by whitespace. A file is
 * deleted only once its URL has been read; empty or unreadable files stay in
 * place and are retried on the next cycle.
 */
@Slf4j
@Component
public class FolderUrlExtractor implements UrlExtractor {

    static final String URL_FILE_EXTENSION = ".url";

    private final Path folder;
    private final MetricsConfig metricsConfig;

    public FolderUrlExtractor(FolderWatcherConfig config, MetricsConfig metricsConfig) {
        String folderPath = config.getFolderPath();
        if (folderPath == null || folderPath.isBlank()) {
            throw new IllegalArgumentException("folderPath must be specified in configuration");
        }
        this.folder = Paths.get(folderPath);
        this.metricsConfig = metricsConfig;
        createFolder();
    }

    public Path getFolder() {
        return folder;
    }

    @Override
    public List<UrlItem> extract() {
        List<UrlItem> items = new ArrayList<>();
        for (Path file : listUrlFiles()) {
            extractFrom(file).ifPresent(items::add);
        }
        return items;
    }

    // ==================== Folder ====================

    private void createFolder() {
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new IngestionException(
                    "Cannot create watched folder: " + folder,
                    folder.toString(),
                    IngestionException.FOLDER_UNAVAILABLE,
                    e
            );
        }
    }

    private List<Path> listUrlFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, this::isUrlFile)) {
            stream.forEach(files::add);
        } catch (IOException | RuntimeException e) {
            throw new IngestionException(
                    "Cannot scan watched folder: " + folder,
                    folder.toString(),
                    IngestionException.FOLDER_SCAN_FAILED,
                    e
            );
        }
        return files;
    }

    private boolean isUrlFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(URL_FILE_EXTENSION)
                && Files.isRegularFile(path);
    }

    // ==================== Single File ====================

    private Optional<UrlItem> extractFrom(Path file) {
        String fileName = file.getFileName().toString();
        try {
            String url = Files.readString(file, StandardCharsets.UTF_8).strip();
            if (url.isEmpty()) {
                log.debug("Skipping empty URL file: {}", fileName);
                metricsConfig.getFilesSkipped().increment();
                return Optional.empty();
            }
            log.debug("Found URL in {}: {}", fileName, url);

            deleteFile(file);
            log.debug("Removed processed file: {}", fileName);

            metricsConfig.getFilesConsumed().increment();
            return Optional.of(new UrlItem(url, fileName));
        } catch (IOException | RuntimeException e) {
            log.debug("Error processing {}: {}", fileName, e.toString());
            metricsConfig.getFilesFailed().increment();
            return Optional.empty();
        }
    }

    void deleteFile(Path file) throws IOException {
        Files.delete(file);
    }
}
