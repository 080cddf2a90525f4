package com.conveyal.transitperf;

import com.conveyal.transitperf.loader.JdbcPositionReader;
import com.conveyal.transitperf.loader.JdbcScheduleReader;
import com.conveyal.transitperf.pipeline.AggregationConfig;
import com.conveyal.transitperf.pipeline.JobResult;
import com.conveyal.transitperf.pipeline.JobState;
import com.conveyal.transitperf.pipeline.MetricsAggregator;
import com.conveyal.transitperf.pipeline.RunParameters;
import com.conveyal.transitperf.pipeline.RunResult;
import com.conveyal.transitperf.storage.MetricsStore;
import com.conveyal.transitperf.storage.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Files;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.dbcp2.ConnectionFactory;
import org.apache.commons.dbcp2.DriverManagerConnectionFactory;
import org.apache.commons.dbcp2.PoolableConnection;
import org.apache.commons.dbcp2.PoolableConnectionFactory;
import org.apache.commons.dbcp2.PoolingDataSource;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * This is the public interface to the metrics computation. Other projects (the scheduler that triggers nightly runs,
 * backfill scripts) should only use the methods in this class, the run parameters and results, and the rows written
 * to the metrics tables.
 */
public abstract class TransitPerf {

    private static final Logger LOG = LoggerFactory.getLogger(TransitPerf.class);

    private static final String DEFAULT_DATABASE_URL = "jdbc:postgresql://localhost/gtfs";

    /** Exit status for unusable command line arguments. */
    static final int EXIT_USAGE = 2;

    /**
     * Compute and store the metrics for the requested days and routes.
     *
     * @param scheduleNamespace database schema of the feed version to measure against.
     * @param metricsNamespace  database schema holding the metrics tables, or null for the default schema.
     */
    public static RunResult computeMetrics (DataSource dataSource, String scheduleNamespace, String metricsNamespace,
                                            AggregationConfig config, RunParameters parameters) {
        MetricsAggregator aggregator = new MetricsAggregator(
            new JdbcScheduleReader(dataSource, scheduleNamespace),
            new JdbcPositionReader(dataSource, config.positionTable, config.vendorTable),
            new MetricsStore(dataSource, metricsNamespace),
            config
        );
        return aggregator.run(parameters);
    }

    /**
     * Create an automatically managed pool of database connections to the supplied JDBC database URL.
     *
     * Sample database URLs:
     * POSTGRES_LOCAL_URL = "jdbc:postgresql://localhost/gtfs";
     * H2_MEMORY_URL = "jdbc:h2:mem:metrics;DB_CLOSE_DELAY=-1";
     *
     * For local Postgres connections, you can supply a null username and password to use host-based authentication.
     * Connections have auto-commit switched off: every write goes through an explicit commit.
     */
    public static DataSource createDataSource (String url, String username, String password) {
        String characterEncoding = Charset.defaultCharset().toString();
        LOG.debug("Default character encoding: {}", characterEncoding);
        if (!Charset.defaultCharset().equals(StandardCharsets.UTF_8)) {
            throw new RuntimeException("Your system's default encoding (" + characterEncoding + ") is not supported. " +
                    "Please set it to UTF-8. Example: java -Dfile.encoding=UTF-8 application.jar");
        }
        // ConnectionFactory can handle null username and password (for local host-based authentication)
        ConnectionFactory connectionFactory = new DriverManagerConnectionFactory(url, username, password);
        PoolableConnectionFactory poolableConnectionFactory = new PoolableConnectionFactory(connectionFactory, null);
        GenericObjectPool<PoolableConnection> connectionPool = new GenericObjectPool<>(poolableConnectionFactory);
        // One connection per worker plus the coordinating thread is enough. The rest is headroom.
        connectionPool.setMaxTotal(50);
        connectionPool.setMaxIdle(4);
        connectionPool.setMinIdle(2);
        poolableConnectionFactory.setPool(connectionPool);
        poolableConnectionFactory.setDefaultAutoCommit(false);
        return new PoolingDataSource<>(connectionPool);
    }

    /**
     * A command-line interface that computes the metrics of one or more days, typically run nightly for yesterday.
     */
    public static void main (String[] args) {
        System.exit(run(args));
    }

    /** @return the process exit status: 0 if the run succeeded (possibly partially), 1 if not, 2 on bad arguments. */
    static int run (String[] args) {
        Options options = getOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            LOG.error("Error parsing command line", e);
            printHelp(options);
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return 0;
        }

        if (!cmd.getArgList().isEmpty()) {
            LOG.error("Extraneous arguments present: {}", cmd.getArgList());
            printHelp(options);
            return EXIT_USAGE;
        }

        if (!cmd.hasOption("namespace")) {
            LOG.error("Must specify the schedule feed namespace with --namespace.");
            printHelp(options);
            return EXIT_USAGE;
        }

        AggregationConfig config;
        RunParameters parameters;
        try {
            config = cmd.hasOption("config")
                    ? AggregationConfig.fromFile(new File(cmd.getOptionValue("config")))
                    : new AggregationConfig();
            parameters = getRunParameters(cmd, config);
        } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        String databaseUrl = cmd.getOptionValue("database", DEFAULT_DATABASE_URL);
        String databaseUser = cmd.getOptionValue("user");
        String databasePassword = cmd.getOptionValue("password");
        LOG.info("Connecting to {} as user {}", databaseUrl, databaseUser);
        // Missing (null) username and password will fall back on host-based authentication.
        DataSource dataSource = createDataSource(databaseUrl, databaseUser, databasePassword);

        RunResult result;
        try {
            result = computeMetrics(dataSource, cmd.getOptionValue("namespace"), null, config, parameters);
        } catch (StorageException e) {
            // Only the planning steps shared by all routes get here. Route/day failures are in the result.
            LOG.error("Metrics run could not start", e);
            return 1;
        }
        for (JobResult job : result.jobs) {
            if (job.status == JobState.FAILED) LOG.warn("{}", job);
        }

        if (cmd.hasOption("json")) {
            File directory = cmd.getOptionValue("json") != null ? new File(cmd.getOptionValue("json")) : Files.createTempDir();
            File resultFile = new File(directory, String.format("metrics-%s-%s.json", result.firstDay, result.lastDay));
            LOG.info("Storing run result at {}", resultFile.getAbsolutePath());
            try {
                new ObjectMapper().writerWithDefaultPrettyPrinter().writeValue(resultFile, result);
            } catch (IOException e) {
                LOG.error("Could not write run result", e);
            }
        }
        return result.isSuccess() ? 0 : 1;
    }

    /**
     * The run covers --days days ending on --day, which defaults to yesterday in the agency time zone.
     */
    static RunParameters getRunParameters (CommandLine cmd, AggregationConfig config) {
        LocalDate lastDay = cmd.hasOption("day")
                ? LocalDate.parse(cmd.getOptionValue("day"))
                : LocalDate.now(config.getZoneId()).minusDays(1);
        int days;
        try {
            days = Integer.parseInt(cmd.getOptionValue("days", "1"));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--days must be a whole number: " + cmd.getOptionValue("days"));
        }
        if (days < 1) throw new IllegalArgumentException("--days must be at least 1");
        return new RunParameters(lastDay.minusDays(days - 1), lastDay, cmd.getOptionValue("route"),
                cmd.hasOption("recalculate"));
    }

    /**
     * The parameter to Option.builder is the short option. Use the no-arg builder constructor with .longOpt() to
     * specify an option that has no short form.
     */
    static Options getOptions () {
        Options options = new Options();
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());
        options.addOption(Option.builder("d")
                .longOpt("database").hasArg()
                .argName("url")
                .desc("JDBC URL for the database. Defaults to " + DEFAULT_DATABASE_URL).build());
        options.addOption(Option.builder("u").longOpt("user").hasArg()
                .argName("username")
                .desc("database username").build());
        options.addOption(Option.builder("p")
                .longOpt("password").hasArg()
                .argName("password")
                .desc("database password").build());
        options.addOption(Option.builder()
                .longOpt("namespace").hasArg()
                .argName("namespace")
                .desc("database namespace of the schedule feed to measure against").build());
        options.addOption(Option.builder()
                .longOpt("day").hasArg()
                .argName("yyyy-MM-dd")
                .desc("last service day to compute. Defaults to yesterday").build());
        options.addOption(Option.builder()
                .longOpt("days").hasArg()
                .argName("n")
                .desc("number of days to compute, ending on --day. Defaults to 1").build());
        options.addOption(Option.builder()
                .longOpt("route").hasArg()
                .argName("route_id")
                .desc("only compute this route. Defaults to every route with positions").build());
        options.addOption(Option.builder()
                .longOpt("recalculate")
                .desc("overwrite metrics that were already computed instead of skipping them").build());
        options.addOption(Option.builder()
                .longOpt("config").hasArg()
                .argName("file")
                .desc("JSON file overriding the default tuning parameters").build());
        options.addOption(Option.builder()
                .longOpt("json").hasArg().optionalArg(true)
                .argName("directory")
                .desc("optionally store the run result in specified directory (defaults to system temp)").build());
        return options;
    }

    private static void printHelp (Options options) {
        final String HELP = String.join("\n",
                "java -jar transit-perf.jar --namespace <feed> [options]",
                // blank lines for legibility
                "",
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        System.out.println(); // blank line for legibility
        formatter.printHelp(HELP, options);
        System.out.println(); // blank line for legibility
    }

}
