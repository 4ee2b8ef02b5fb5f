package io.github.yok.chunkdblink;

import io.github.yok.chunkdblink.config.IngestConfig;
import io.github.yok.chunkdblink.core.ChunkedTableLoader;
import io.github.yok.chunkdblink.core.ColumnProfile;
import io.github.yok.chunkdblink.core.PagedQueryResult;
import io.github.yok.chunkdblink.core.QueryExecutor;
import io.github.yok.chunkdblink.core.ResultTable;
import io.github.yok.chunkdblink.core.SampleProfile;
import io.github.yok.chunkdblink.core.SampleProfiler;
import io.github.yok.chunkdblink.db.StoreConnectionProvider;
import io.github.yok.chunkdblink.source.DatasetSource;
import io.github.yok.chunkdblink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Command-line arguments:
 * </p>
 * <ul>
 * <li>{@code --analyze <file>} or {@code -a <file>} profiles a leading sample of the file.</li>
 * <li>{@code --load <file>} or {@code -l <file>} loads the file chunk by chunk into a table.</li>
 * <li>{@code --table <name>} or {@code -t <name>} names the target table. If omitted, the file's
 * base name is used.</li>
 * <li>{@code --chunk-size <n>} or {@code -c <n>} overrides {@code ingest.chunk-size}.</li>
 * <li>{@code --query <sql>} or {@code -q <sql>} runs a query after any load.</li>
 * <li>{@code --page-size <n>} or {@code -p <n>} fetches the query result in batches of
 * {@code n}.</li>
 * <li>{@code --dataset <name>} or {@code -d <name>} analyzes and loads the first CSV file of the
 * dataset directory under {@code data-path}.</li>
 * </ul>
 *
 * <p>
 * Actions run in the order analyze, load, query. Results are written to the log. The process
 * exits with status 1 when no action is given or an action fails.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see IngestConfig
 * @see StoreConnectionProvider
 * @see DatasetSource
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final IngestConfig ingestConfig;
    private final StoreConnectionProvider connectionProvider;
    private final DatasetSource datasetSource;

    // Process exit status, set to 1 once a fatal error has been reported
    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        int status = SpringApplication.exit(app.run(args));
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        Path analyzeFile = null;
        Path loadFile = null;
        String table = null;
        String chunkSizeArg = null;
        String query = null;
        String pageSizeArg = null;
        String dataset = null;
        for (int i = 0; i < args.length; i++) {
            String next = i + 1 < args.length ? args[i + 1] : null;
            switch (args[i]) {
                case "--analyze":
                case "-a":
                    analyzeFile = next == null ? null : Paths.get(next);
                    i++;
                    break;
                case "--load":
                case "-l":
                    loadFile = next == null ? null : Paths.get(next);
                    i++;
                    break;
                case "--table":
                case "-t":
                    table = next;
                    i++;
                    break;
                case "--chunk-size":
                case "-c":
                    chunkSizeArg = next;
                    i++;
                    break;
                case "--query":
                case "-q":
                    query = next;
                    i++;
                    break;
                case "--page-size":
                case "-p":
                    pageSizeArg = next;
                    i++;
                    break;
                case "--dataset":
                case "-d":
                    dataset = next;
                    i++;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (analyzeFile == null && loadFile == null && query == null && dataset == null) {
            exitCode = 1;
            ErrorHandler.errorAndExit(
                    "No action specified. Use --analyze, --load, --query or --dataset.");
            return;
        }

        try {
            int chunkSize = parsePositive("--chunk-size", chunkSizeArg,
                    ingestConfig.getChunkSize());
            int pageSize = parsePositive("--page-size", pageSizeArg, 0);

            if (dataset != null) {
                Path first = firstDatasetFile(dataset);
                analyzeFile = analyzeFile == null ? first : analyzeFile;
                loadFile = loadFile == null ? first : loadFile;
            }
            log.info("Analyze: {}, Load: {}, Table: {}, Chunk size: {}, Query: {}", analyzeFile,
                    loadFile, table, chunkSize, query);

            if (analyzeFile != null) {
                logProfile(new SampleProfiler(ingestConfig).analyzeSample(analyzeFile));
            }
            if (loadFile != null) {
                String target = table != null ? table : FilenameUtils.getBaseName(
                        loadFile.getFileName().toString());
                log.info("Starting load. File [{}], Table [{}]", loadFile, target);
                long rows = new ChunkedTableLoader(connectionProvider, ingestConfig)
                        .load(loadFile, target, chunkSize);
                log.info("Load completed. Table [{}], {} rows", target, rows);
            }
            if (query != null) {
                runQuery(new QueryExecutor(connectionProvider), query, pageSize);
            }
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            exitCode = 1;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the process exit status: {@code 0} on success, {@code 1} after a fatal error.
     *
     * @return exit status
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Path firstDatasetFile(String dataset) {
        List<Path> files = datasetSource.listFiles(datasetSource.downloadDataset(dataset));
        if (files.isEmpty()) {
            throw new IllegalStateException("No CSV files found in dataset: " + dataset);
        }
        log.info("Dataset [{}]: using {} of {} file(s)", dataset, files.get(0).getFileName(),
                files.size());
        return files.get(0);
    }

    private static int parsePositive(String option, String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(option + " must be positive: " + value);
        }
        return parsed;
    }

    private static void logProfile(SampleProfile profile) {
        log.info("Sample size: {}, estimated total rows: {}, estimated memory usage: {} MB",
                profile.getSampleSize(), profile.getEstimatedTotalRows(),
                String.format("%.2f", profile.getEstimatedMemoryUsage()));
        for (ColumnProfile column : profile.getColumns()) {
            log.info("  Column[{}] type={}, missing={}, sampleBytes={}", column.getName(),
                    column.getType(), column.getMissingCount(), column.getMemoryBytes());
        }
        for (Map<String, Object> row : profile.getSamplePreview()) {
            log.info("  Preview {}", row);
        }
    }

    private static void runQuery(QueryExecutor executor, String sql, int pageSize) {
        if (pageSize <= 0) {
            ResultTable result = executor.query(sql);
            log.info("Columns: {}", result.getColumnNames());
            result.getRows().forEach(row -> log.info("  {}", row));
            return;
        }
        try (PagedQueryResult batches = executor.query(sql, pageSize)) {
            int batchNo = 0;
            while (batches.hasNext()) {
                ResultTable batch = batches.next();
                batchNo++;
                log.info("Batch {} ({} rows), columns: {}", batchNo, batch.getRowCount(),
                        batch.getColumnNames());
                batch.getRows().forEach(row -> log.info("  {}", row));
            }
            log.info("Query returned {} rows in {} batch(es)", batches.getRowsRead(), batchNo);
        }
    }
}
