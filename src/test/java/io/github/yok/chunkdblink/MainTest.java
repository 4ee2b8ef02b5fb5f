package io.github.yok.chunkdblink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.chunkdblink.config.IngestConfig;
import io.github.yok.chunkdblink.core.ChunkedTableLoader;
import io.github.yok.chunkdblink.core.PagedQueryResult;
import io.github.yok.chunkdblink.core.QueryExecutor;
import io.github.yok.chunkdblink.core.ResultTable;
import io.github.yok.chunkdblink.core.SampleProfile;
import io.github.yok.chunkdblink.core.SampleProfiler;
import io.github.yok.chunkdblink.db.StoreConnectionProvider;
import io.github.yok.chunkdblink.exception.TableWriteException;
import io.github.yok.chunkdblink.source.DatasetSource;
import io.github.yok.chunkdblink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private IngestConfig ingestConfig;
    private DatasetSource datasetSource;

    private Main main;

    @BeforeEach
    void setup() {
        ingestConfig = new IngestConfig();
        ingestConfig.setChunkSize(500);
        datasetSource = mock(DatasetSource.class);
        main = new Main(ingestConfig, mock(StoreConnectionProvider.class), datasetSource);
    }

    private static SampleProfile emptyProfile() {
        return new SampleProfile(0, 0, List.of(), List.of());
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class)))
                            .thenReturn(mock(ConfigurableApplicationContext.class));

                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--load", "prices.csv"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--load"), eq("prices.csv"));
        }
    }

    @Test
    void run_異常ケース_アクション未指定_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run();

            mocked.verify(() -> ErrorHandler.errorAndExit(
                    eq("No action specified. Use --analyze, --load, --query or --dataset.")));
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_loadとtableとchunkSize指定_指定値で書き込まれること() {
        try (MockedConstruction<ChunkedTableLoader> mocked =
                mockConstruction(ChunkedTableLoader.class)) {
            main.run("--load", "data/prices.csv", "--table", "PRICES", "--chunk-size", "100");

            ChunkedTableLoader loader = mocked.constructed().get(0);
            verify(loader).load(eq(Paths.get("data/prices.csv")), eq("PRICES"), eq(100));
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_短縮オプションでtable省略_ファイル名と設定のチャンクサイズが使われること() {
        try (MockedConstruction<ChunkedTableLoader> mocked =
                mockConstruction(ChunkedTableLoader.class)) {
            main.run("-l", "data/prices.csv");

            ChunkedTableLoader loader = mocked.constructed().get(0);
            verify(loader).load(eq(Paths.get("data/prices.csv")), eq("prices"), eq(500));
        }
    }

    @Test
    void run_正常ケース_analyze指定_サンプル分析が実行されること() {
        try (MockedConstruction<SampleProfiler> mocked = mockConstruction(SampleProfiler.class,
                (mock, ctx) -> when(mock.analyzeSample(any(Path.class)))
                        .thenReturn(emptyProfile()))) {
            main.run("-a", "data/prices.csv");

            verify(mocked.constructed().get(0)).analyzeSample(eq(Paths.get("data/prices.csv")));
        }
    }

    @Test
    void run_正常ケース_query指定_全件取得で実行されること() {
        try (MockedConstruction<QueryExecutor> mocked = mockConstruction(QueryExecutor.class,
                (mock, ctx) -> when(mock.query(anyString()))
                        .thenReturn(new ResultTable(List.of("CNT"), List.of(List.of(3L)))))) {
            main.run("--query", "SELECT COUNT(*) AS CNT FROM PRICES");

            verify(mocked.constructed().get(0)).query(eq("SELECT COUNT(*) AS CNT FROM PRICES"));
        }
    }

    @Test
    void run_正常ケース_queryとpageSize指定_ページ分割で実行され結果が閉じられること() {
        PagedQueryResult paged = mock(PagedQueryResult.class);
        try (MockedConstruction<QueryExecutor> mocked = mockConstruction(QueryExecutor.class,
                (mock, ctx) -> when(mock.query(anyString(), anyInt())).thenReturn(paged))) {
            main.run("-q", "SELECT * FROM PRICES", "-p", "20");

            verify(mocked.constructed().get(0)).query(eq("SELECT * FROM PRICES"), eq(20));
            verify(paged).close();
        }
    }

    @Test
    void run_正常ケース_dataset指定_先頭のCSVが分析され書き込まれること() {
        Path dir = Paths.get("datasets", "sp500");
        Path first = dir.resolve("companies.csv");
        when(datasetSource.downloadDataset("owner/sp500")).thenReturn(dir);
        when(datasetSource.listFiles(dir)).thenReturn(List.of(first, dir.resolve("prices.csv")));

        try (MockedConstruction<SampleProfiler> profilers = mockConstruction(SampleProfiler.class,
                (mock, ctx) -> when(mock.analyzeSample(any(Path.class)))
                        .thenReturn(emptyProfile()));
                MockedConstruction<ChunkedTableLoader> loaders =
                        mockConstruction(ChunkedTableLoader.class)) {
            main.run("--dataset", "owner/sp500");

            verify(profilers.constructed().get(0)).analyzeSample(eq(first));
            verify(loaders.constructed().get(0)).load(eq(first), eq("companies"), eq(500));
        }
    }

    @Test
    void run_異常ケース_書き込み失敗_ErrorHandlerに原因付きで委譲されること() {
        TableWriteException failure =
                new TableWriteException("Failed to write chunk 2", new RuntimeException("boom"));
        ErrorHandler.disableExitForCurrentThread();
        try (MockedConstruction<ChunkedTableLoader> mocked = mockConstruction(
                ChunkedTableLoader.class,
                (mock, ctx) -> when(mock.load(any(Path.class), anyString(), anyInt()))
                        .thenThrow(failure))) {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> main.run("--load", "prices.csv"));

            assertEquals("Fatal error: Failed to write chunk 2", ex.getMessage());
            assertEquals(failure, ex.getCause());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void run_異常ケース_chunkSizeが数値でない_ErrorHandlerが呼ばれ書き込まれないこと() {
        try (MockedStatic<ErrorHandler> errors = mockStatic(ErrorHandler.class);
                MockedConstruction<ChunkedTableLoader> loaders =
                        mockConstruction(ChunkedTableLoader.class)) {
            main.run("--load", "prices.csv", "-c", "abc");

            errors.verify(() -> ErrorHandler.errorAndExit(contains("Invalid number for --chunk-size"),
                    any(IllegalArgumentException.class)));
            assertTrue(loaders.constructed().isEmpty());
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_未知の引数はwarnされても処理継続すること() {
        try (MockedConstruction<ChunkedTableLoader> mocked =
                mockConstruction(ChunkedTableLoader.class)) {
            main.run("--unknown", "--load", "prices.csv");

            verify(mocked.constructed().get(0)).load(eq(Paths.get("prices.csv")), eq("prices"),
                    eq(500));
        }
    }
}
