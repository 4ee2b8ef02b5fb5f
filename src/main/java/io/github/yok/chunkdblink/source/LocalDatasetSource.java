package io.github.yok.chunkdblink.source;

import io.github.yok.chunkdblink.config.PathsConfig;
import io.github.yok.chunkdblink.exception.DatasetReadException;
import io.github.yok.chunkdblink.util.LogPathUtil;
import java.io.File;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

/**
 * {@link DatasetSource} over datasets already present under the configured {@code data-path}.
 *
 * <p>
 * Nothing is downloaded: {@link #downloadDataset(String)} only resolves and checks the dataset
 * directory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalDatasetSource implements DatasetSource {

    private static final String[] EXTENSIONS = {"csv", "CSV"};

    private final PathsConfig pathsConfig;

    @Override
    public Path downloadDataset(String name) {
        Path dir = pathsConfig.getDatasetDir(name);
        if (!Files.isDirectory(dir)) {
            String msg = "Dataset directory not found: " + LogPathUtil.renderPathForLog(dir);
            log.error(msg);
            throw new DatasetReadException(msg);
        }
        log.info("Dataset [{}] resolved to {}", name, LogPathUtil.renderPathForLog(dir));
        return dir;
    }

    @Override
    public List<Path> listFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            String msg = "Not a directory: " + LogPathUtil.renderPathForLog(dir);
            log.error(msg);
            throw new DatasetReadException(msg);
        }
        try {
            List<Path> files = FileUtils.listFiles(dir.toFile(), EXTENSIONS, false).stream()
                    .map(File::toPath).sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
            log.info("Found {} data file(s) in {}", files.size(), LogPathUtil.renderPathForLog(dir));
            return files;
        } catch (UncheckedIOException e) {
            log.error("Failed to list {}: {}", dir, e.getMessage(), e);
            throw new DatasetReadException("Failed to list dataset directory: " + dir, e);
        }
    }
}
