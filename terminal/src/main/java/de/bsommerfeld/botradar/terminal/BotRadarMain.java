package de.bsommerfeld.botradar.terminal;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.botradar.core.BotRadarException;
import de.bsommerfeld.botradar.core.config.BotRadarConfig;
import de.bsommerfeld.botradar.core.config.ConfigurationLoader;
import de.bsommerfeld.botradar.core.domain.ActivityDataset;
import de.bsommerfeld.botradar.core.event.ApplicationEventBus;
import de.bsommerfeld.botradar.detector.SuspicionReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <pre>
 * bot-radar [dataset.json] [config.yml]
 * </pre>
 *
 * Without a dataset the bundled sample is analyzed. The configuration path
 * falls back to the {@code botradar.config} system property, the
 * {@code BOTRADAR_CONFIG} environment variable and finally
 * {@code botradar.yml} in the working directory; a missing file means
 * defaults.
 */
public final class BotRadarMain {

    private static final Logger LOG = LoggerFactory.getLogger(BotRadarMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private BotRadarMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        try {
            BotRadarConfig config = ConfigurationLoader.load(resolveConfigPath(args));
            ActivityDataset dataset = args.length > 0
                    ? DatasetLoader.load(Path.of(args[0]))
                    : DatasetLoader.loadSample();

            Injector injector = Guice.createInjector(new BotRadarModule(config));
            injector.getInstance(ApplicationEventBus.class).register(new ConsoleReportPrinter(out));
            injector.getInstance(SuspicionReportService.class).analyze(dataset);
            return EXIT_OK;
        } catch (BotRadarException e) {
            LOG.error("Analysis aborted: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    static Path resolveConfigPath(String[] args) {
        if (args.length > 1)
            return Path.of(args[1]);

        String path = System.getProperty("botradar.config");
        if (path == null || path.isEmpty())
            path = System.getenv("BOTRADAR_CONFIG");
        if (path == null || path.isEmpty())
            path = "botradar.yml";
        return Path.of(path);
    }
}
