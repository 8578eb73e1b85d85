package de.bsommerfeld.coversync.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.ProvisionException;
import de.bsommerfeld.coversync.core.config.CoverSyncConfig;
import de.bsommerfeld.coversync.core.util.StorageUtils;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Command-line runner. Executes one maintenance command against the library
 * in the application data directory and prints its result as JSON.
 *
 * <pre>
 * cover-sync migrate | sync [covers-root] | merge | clear-inline | cleanup-orphans | all
 * </pre>
 *
 * Exit codes: {@code 0} when the command ran (per-item errors are part of
 * the printed result), {@code 1} when it failed as a whole, {@code 2} on a
 * usage error.
 */
public final class CoverSyncMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static {
        // logback.xml reads LOG_DIR, so it has to be set before the first logger
        Path logDir = StorageUtils.getLogsDir();
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CoverSyncMain.class);

    private static final Set<String> COMMANDS =
            Set.of("migrate", "sync", "merge", "clear-inline", "cleanup-orphans", "all");

    private static final String USAGE =
            "Usage: cover-sync <migrate|sync [covers-root]|merge|clear-inline|cleanup-orphans|all>";

    private CoverSyncMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, new CoverSyncModule(StorageUtils.getAppDataDir())));
    }

    static int run(String[] args, PrintStream out, Module module) {
        if (!isValid(args)) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        Injector injector;
        try {
            injector = Guice.createInjector(module);
        } catch (RuntimeException e) {
            LOG.error("Failed to start cover-sync", e);
            return EXIT_FAILED;
        }
        boolean debug = injector.getInstance(CoverSyncConfig.class).isDebugMode();
        ObjectMapper mapper = new ObjectMapper();
        if (debug) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }

        try {
            CoverMaintenanceService service = injector.getInstance(CoverMaintenanceService.class);
            Object result = execute(service, args);
            out.println(mapper.writeValueAsString(result));
            return EXIT_OK;
        } catch (StoreException e) {
            if (debug) {
                LOG.error("Command {} failed", args[0], e);
            } else {
                LOG.error("Command {} failed: {}", args[0], e.getMessage());
            }
            return EXIT_FAILED;
        } catch (ProvisionException e) {
            LOG.error("Failed to open the library", e);
            return EXIT_FAILED;
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize result", e);
            return EXIT_FAILED;
        } finally {
            closeDatabase(injector);
        }
    }

    private static Object execute(CoverMaintenanceService service, String[] args) throws StoreException {
        switch (args[0]) {
            case "migrate":
                return service.migrateInlineToFiles();
            case "sync":
                return args.length == 2
                        ? service.syncPathsFromFiles(Path.of(args[1]))
                        : service.syncPathsFromFiles();
            case "merge":
                return service.mergeDuplicateCovers();
            case "clear-inline":
                return Map.of("cleared", service.clearInlineAfterMigration());
            case "cleanup-orphans":
                return Map.of("deleted", service.cleanupOrphanedCovers());
            case "all":
                return service.runAll();
            default:
                throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
    }

    private static boolean isValid(String[] args) {
        if (args.length == 0 || !COMMANDS.contains(args[0])) {
            return false;
        }
        if (args.length == 1) {
            return true;
        }
        if (args.length != 2 || !"sync".equals(args[0])) {
            return false;
        }
        try {
            Path.of(args[1]);
            return true;
        } catch (InvalidPathException e) {
            System.err.println("Invalid covers root: " + e.getMessage());
            return false;
        }
    }

    private static void closeDatabase(Injector injector) {
        try {
            injector.getInstance(CoverDatabase.class).close();
        } catch (ProvisionException e) {
            // never opened
            LOG.debug("No database to close", e);
        }
    }
}
