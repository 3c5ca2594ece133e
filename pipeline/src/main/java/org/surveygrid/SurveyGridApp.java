package org.surveygrid;

import org.surveygrid.models.RunSummary;
import org.surveygrid.models.YearRange;
import org.surveygrid.pipeline.FetchOrchestrator;
import org.surveygrid.pipeline.FixedDelayPacer;
import org.surveygrid.pipeline.Pacer;
import org.surveygrid.sinks.JdbcAggregateSink;
import org.surveygrid.sinks.PersistenceException;
import org.surveygrid.sinks.StoreConnector;
import org.surveygrid.source.FossApiSource;
import org.surveygrid.source.ObservationSource;
import org.surveygrid.utils.CommandArgs;
import org.surveygrid.utils.ConfigLoader;
import org.surveygrid.utils.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * SurveyGrid command-line entry point.
 *
 * <pre>
 *   create-table [store]
 *   download [year range] [store] [geohash size]
 * </pre>
 * The store is a SQLite file path or a full JDBC URL.
 */
public class SurveyGridApp {

    private static final Logger LOG = LoggerFactory.getLogger(SurveyGridApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INCOMPLETE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE_BASE = "surveygrid ";
    static final String USAGE_COMMANDS = "[create-table | download]";
    static final String USAGE_CREATE_TABLE = "create-table [store]";
    static final String USAGE_DOWNLOAD = "download [year range] [store] [geohash size]";

    private static final String CREATE_TABLE_COMMAND = "create-table";
    private static final String DOWNLOAD_COMMAND = "download";

    private final PrintStream out;
    private final StoreConnector connector;
    private final Supplier<ObservationSource> sourceFactory;
    private final Supplier<Pacer> pacerFactory;
    private final Supplier<List<String>> surveys;

    public SurveyGridApp(PrintStream out, StoreConnector connector, Supplier<ObservationSource> sourceFactory,
                         Supplier<Pacer> pacerFactory, Supplier<List<String>> surveys) {
        this.out = out;
        this.connector = connector;
        this.sourceFactory = sourceFactory;
        this.pacerFactory = pacerFactory;
        this.surveys = surveys;
    }

    public static void main(String[] args) {
        SurveyGridApp app = new SurveyGridApp(
                System.out,
                StoreConnector.jdbc(),
                FossApiSource::fromConfig,
                () -> new FixedDelayPacer(Duration.ofSeconds(ConfigLoader.fetchPauseSeconds())),
                ConfigLoader::surveys);
        int status = app.run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    public int run(String[] args) {
        if (args.length < 1) {
            out.println(USAGE_BASE + USAGE_COMMANDS);
            return EXIT_USAGE;
        }

        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (args[0]) {
                case CREATE_TABLE_COMMAND:
                    return createTable(rest);
                case DOWNLOAD_COMMAND:
                    return download(rest);
                default:
                    out.println(USAGE_BASE + USAGE_COMMANDS);
                    return EXIT_USAGE;
            }
        } catch (ConfigurationException e) {
            out.println(e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int createTable(String[] args) {
        if (args.length != 1) {
            out.println(USAGE_BASE + USAGE_CREATE_TABLE);
            return EXIT_USAGE;
        }

        try (JdbcAggregateSink sink = new JdbcAggregateSink(connector.connect(args[0]))) {
            sink.createTable();
            out.println("Table ready at " + args[0] + ".");
            return EXIT_OK;
        } catch (SQLException | PersistenceException e) {
            LOG.error("create-table failed for {}", args[0], e);
            out.println("Failed to create table: " + e.getMessage());
            return EXIT_INCOMPLETE;
        }
    }

    private int download(String[] args) {
        if (args.length != 3) {
            out.println(USAGE_BASE + USAGE_DOWNLOAD);
            return EXIT_USAGE;
        }

        // Validate everything before any connection or request is made.
        YearRange years = CommandArgs.parseYearRange(args[0]);
        String store = args[1];
        int precision = CommandArgs.parsePrecision(args[2]);
        List<String> surveyCodes = surveys.get();
        ObservationSource source = sourceFactory.get();
        Pacer pacer = pacerFactory.get();

        RunSummary summary;
        try (JdbcAggregateSink sink = new JdbcAggregateSink(connector.connect(store))) {
            FetchOrchestrator orchestrator = new FetchOrchestrator(source, sink, pacer, precision);
            summary = orchestrator.run(surveyCodes, years);
        } catch (SQLException e) {
            LOG.error("Store error for {}", store, e);
            out.println("Store error: " + e.getMessage());
            return EXIT_INCOMPLETE;
        }

        summary.getResults().forEach(result -> out.println(result));
        if (!summary.getFailedPairs().isEmpty()) {
            out.println("Failed pairs: " + summary.getFailedPairs());
        }
        if (summary.isCancelled()) {
            out.println("Cancelled before all pairs were processed.");
        }
        if (summary.isAborted()) {
            out.println("Aborted: " + summary.getAbortReason());
        }
        return summary.isSuccessful() ? EXIT_OK : EXIT_INCOMPLETE;
    }
}
