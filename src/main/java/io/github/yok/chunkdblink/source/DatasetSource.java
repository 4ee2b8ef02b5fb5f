package io.github.yok.chunkdblink.source;

import java.nio.file.Path;
import java.util.List;

/**
 * Locates dataset files for ingestion.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DatasetSource {

    /**
     * Makes the named dataset available locally and returns its directory.
     *
     * @param name dataset name, optionally qualified as {@code owner/dataset}
     * @return local directory holding the dataset's files
     * @throws io.github.yok.chunkdblink.exception.DatasetReadException if the dataset is not
     *         available
     */
    Path downloadDataset(String name);

    /**
     * Lists the delimited text files of a dataset directory in name order.
     *
     * @param dir dataset directory
     * @return data files, possibly empty
     * @throws io.github.yok.chunkdblink.exception.DatasetReadException if {@code dir} is not a
     *         readable directory
     */
    List<Path> listFiles(Path dir);
}
