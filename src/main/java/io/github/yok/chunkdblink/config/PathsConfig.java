package io.github.yok.chunkdblink.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration. Datasets are resolved as subdirectories of this base directory.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base directory holding one subdirectory per dataset
    private String dataPath;

    /**
     * Returns the directory of the named dataset.
     *
     * <p>
     * For owner-qualified names such as {@code owner/dataset}, only the last segment is used.
     * </p>
     *
     * @param datasetName dataset name, optionally qualified with its owner
     * @return dataset directory path
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public Path getDatasetDir(String datasetName) {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        String simpleName = StringUtils.substringAfterLast(datasetName, "/");
        if (simpleName.isEmpty()) {
            simpleName = datasetName;
        }
        return Paths.get(dataPath, simpleName);
    }
}
