package io.github.yok.chunkdblink.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.chunkdblink.config.PathsConfig;
import io.github.yok.chunkdblink.exception.DatasetReadException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalDatasetSourceTest {

    @TempDir
    Path tempDir;

    private LocalDatasetSource source;

    @BeforeEach
    void setup() {
        PathsConfig pathsConfig = new PathsConfig();
        pathsConfig.setDataPath(tempDir.toString());
        source = new LocalDatasetSource(pathsConfig);
    }

    @Test
    void downloadDataset_正常ケース_既存のディレクトリ_パスが返ること() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("sp500"));
        assertEquals(dir, source.downloadDataset("owner/sp500"));
    }

    @Test
    void downloadDataset_異常ケース_存在しないデータセット_DatasetReadExceptionが送出されること() {
        assertThrows(DatasetReadException.class, () -> source.downloadDataset("missing"));
    }

    @Test
    void listFiles_正常ケース_CSVのみ名前順で返ること() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("stocks"));
        Files.writeString(dir.resolve("b_prices.csv"), "a\n");
        Files.writeString(dir.resolve("a_companies.csv"), "a\n");
        Files.writeString(dir.resolve("readme.txt"), "x");
        Files.createDirectory(dir.resolve("nested"));

        List<Path> files = source.listFiles(dir);

        assertEquals(2, files.size());
        assertEquals("a_companies.csv", files.get(0).getFileName().toString());
        assertEquals("b_prices.csv", files.get(1).getFileName().toString());
    }

    @Test
    void listFiles_正常ケース_CSVなし_空のリストが返ること() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("empty"));
        assertTrue(source.listFiles(dir).isEmpty());
    }

    @Test
    void listFiles_異常ケース_ディレクトリではない_DatasetReadExceptionが送出されること()
            throws Exception {
        Path file = Files.writeString(tempDir.resolve("single.csv"), "a\n");
        assertThrows(DatasetReadException.class, () -> source.listFiles(file));
    }
}
