package dss.cli;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * Run the HTTP coordinator and the liveness reaper until interrupted.
 */
@Command(name = "serve", header = "Start the coordinator HTTP server")
public class ServeCommand extends StoreCommand {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @CommandLine.Option(names = {"--port"}, description = "Listen port (overrides configuration)")
    Integer port;

    @Override
    protected int execute() throws IOException {
        CoordinatorConfig config = config();
        if (port != null) {
            config.withServerPort(port);
        }

        Dependencies deps = Dependencies.create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "dss-shutdown"));

        try {
            deps.startScheduler();
            deps.server().start(config.serverPort());
            out().printf("Coordinator listening on port %d%n", config.serverPort());
            out().flush();
            deps.server().awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down");
        } finally {
            deps.close();
        }
        return EXIT_OK;
    }
}
