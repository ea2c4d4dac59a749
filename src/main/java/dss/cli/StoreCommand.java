package dss.cli;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.config.Dependencies;
import dss.coordinator.exception.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base for subcommands that open the job store.
 * Store and validation failures are printed to stderr and exit with 1.
 */
abstract class StoreCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StoreCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--db"},
            description = "JDBC URL or path of the H2 database file")
    String db;

    @CommandLine.Option(names = {"--config"},
            description = "INI configuration file")
    File configFile;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (IllegalArgumentException | JobStoreException | IOException e) {
            log.debug("{} failed", spec.name(), e);
            err().println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    protected abstract int execute() throws IOException;

    protected CoordinatorConfig config() throws IOException {
        CoordinatorConfig config = configFile != null
                ? CoordinatorConfig.fromIni(configFile)
                : CoordinatorConfig.fromEnv();
        if (db != null && !db.isBlank()) {
            config.withDatabaseUrl(toJdbcUrl(db));
        }
        return config;
    }

    protected Dependencies open() throws IOException {
        return Dependencies.create(config());
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * A bare path names an H2 file database; H2 appends its own extension.
     */
    static String toJdbcUrl(String db) {
        if (db.startsWith("jdbc:")) {
            return db;
        }
        String path = Path.of(db).toAbsolutePath().normalize().toString();
        if (path.endsWith(".mv.db")) {
            path = path.substring(0, path.length() - ".mv.db".length());
        }
        return "jdbc:h2:file:" + path + ";AUTO_SERVER=TRUE;DATABASE_TO_UPPER=FALSE";
    }
}
