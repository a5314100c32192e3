package io.rockmap.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rockmap.core.config.DatabaseConfig;
import io.rockmap.core.engine.EngineMode;
import io.rockmap.core.error.StorageException;
import io.rockmap.core.keyspace.Keyspace;
import io.rockmap.core.metrics.StorageMetrics;
import io.rockmap.core.stream.KeyVal;
import io.rockmap.core.stream.KeyValueStream;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Read-only inspection of a database directory. Prints JSON. */
public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final List<String> KEYSPACE_PROPERTIES = List.of(
            "rocksdb.estimate-num-keys",
            "rocksdb.total-sst-files-size",
            "rocksdb.cur-size-all-mem-tables",
            "rocksdb.num-live-versions"
    );

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }
        int code = run(options, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(CliOptions options, PrintStream out) {
        DatabaseConfig config;
        try {
            config = options.configFile() != null
                    ? DatabaseConfig.load(options.configFile())
                    : DatabaseConfig.defaults(options.dataDir());
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to read config " + options.configFile(), e);
            return 2;
        }
        config = config.withMode(EngineMode.READ_ONLY).withPool(2, DatabaseConfig.DEFAULT_QUEUE_MULTIPLIER);

        try (Database db = Database.open(config)) {
            Object report;
            if (options.keyspace() == null) {
                report = describeKeyspaces(db);
            } else if (options.properties()) {
                report = describeProperties(db.get(options.keyspace()));
            } else {
                report = listEntries(db.get(options.keyspace()), options);
            }
            out.println(JSON.writeValueAsString(report));
            if (options.metrics()) {
                out.print(StorageMetrics.scrapeMetrics());
            }
            return 0;
        } catch (StorageException e) {
            LOG.log(Level.SEVERE, "Inspection failed: " + e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to render report", e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (ExecutionException e) {
            LOG.log(Level.SEVERE, "Inspection failed", e.getCause());
            return 1;
        }
    }

    private static ArrayNode describeKeyspaces(Database db) {
        ArrayNode list = JSON.createArrayNode();
        for (String name : db.names()) {
            Keyspace keyspace = db.get(name);
            ObjectNode node = list.addObject();
            node.put("name", name);
            node.put("estimatedKeys", keyspace.propertyInteger("rocksdb.estimate-num-keys"));
        }
        return list;
    }

    private static ObjectNode describeProperties(Keyspace keyspace) {
        ObjectNode node = JSON.createObjectNode();
        node.put("name", keyspace.name());
        ObjectNode props = node.putObject("properties");
        for (String property : KEYSPACE_PROPERTIES) {
            props.put(property, keyspace.propertyInteger(property));
        }
        return node;
    }

    private static ArrayNode listEntries(Keyspace keyspace, CliOptions options)
            throws InterruptedException, ExecutionException {
        ArrayNode list = JSON.createArrayNode();
        if (options.keysOnly()) {
            try (KeyValueStream<byte[]> stream = openKeyStream(keyspace, options)) {
                while (list.size() < options.limit()) {
                    Optional<byte[]> key = stream.next().get();
                    if (key.isEmpty()) {
                        break;
                    }
                    list.addObject().put("key", new String(key.get(), StandardCharsets.UTF_8));
                }
            }
            return list;
        }
        try (KeyValueStream<KeyVal> stream = openEntryStream(keyspace, options)) {
            while (list.size() < options.limit()) {
                Optional<KeyVal> item = stream.next().get();
                if (item.isEmpty()) {
                    break;
                }
                ObjectNode node = list.addObject();
                node.put("key", item.get().keyUtf8());
                node.put("value", Base64.getEncoder().encodeToString(item.get().value()));
                node.put("valueSize", item.get().value().length);
            }
        }
        return list;
    }

    private static KeyValueStream<KeyVal> openEntryStream(Keyspace keyspace, CliOptions options) {
        if (options.prefix() != null) {
            byte[] prefix = options.prefix().getBytes(StandardCharsets.UTF_8);
            return options.reverse() ? keyspace.reverseEntriesPrefix(prefix) : keyspace.entriesPrefix(prefix);
        }
        if (options.from() != null) {
            byte[] from = options.from().getBytes(StandardCharsets.UTF_8);
            return options.reverse() ? keyspace.reverseEntriesFrom(from) : keyspace.entriesFrom(from);
        }
        return options.reverse() ? keyspace.reverseEntries() : keyspace.entries();
    }

    private static KeyValueStream<byte[]> openKeyStream(Keyspace keyspace, CliOptions options) {
        if (options.prefix() != null) {
            byte[] prefix = options.prefix().getBytes(StandardCharsets.UTF_8);
            return options.reverse() ? keyspace.reverseKeysPrefix(prefix) : keyspace.keysPrefix(prefix);
        }
        if (options.from() != null) {
            byte[] from = options.from().getBytes(StandardCharsets.UTF_8);
            return options.reverse() ? keyspace.reverseKeysFrom(from) : keyspace.keysFrom(from);
        }
        return options.reverse() ? keyspace.reverseKeys() : keyspace.keys();
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path configFile,
            String keyspace,
            String prefix,
            String from,
            boolean reverse,
            boolean keysOnly,
            int limit,
            boolean properties,
            boolean metrics
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("ROCKMAP_DATA_DIR", Path.of("./data/db"));
            Path configFile = envPath("ROCKMAP_CONFIG", null);
            String keyspace = null;
            String prefix = null;
            String from = null;
            boolean reverse = false;
            boolean keysOnly = false;
            int limit = 100;
            boolean properties = false;
            boolean metrics = false;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--keyspace=")) {
                        keyspace = arg.substring("--keyspace=".length());
                    } else if (arg.startsWith("--prefix=")) {
                        prefix = arg.substring("--prefix=".length());
                    } else if (arg.startsWith("--from=")) {
                        from = arg.substring("--from=".length());
                    } else if (arg.equals("--reverse")) {
                        reverse = true;
                    } else if (arg.equals("--keys-only")) {
                        keysOnly = true;
                    } else if (arg.equals("--properties")) {
                        properties = true;
                    } else if (arg.equals("--metrics")) {
                        metrics = true;
                    } else if (arg.startsWith("--limit=")) {
                        try {
                            limit = parsePositiveInt(arg.substring("--limit=".length()), "--limit");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (prefix != null && from != null && error == null) {
                showHelp = true;
                error = "--prefix and --from cannot be combined";
            }
            if (keyspace != null && keyspace.isBlank()) {
                keyspace = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    configFile,
                    keyspace,
                    prefix,
                    from,
                    reverse,
                    keysOnly,
                    limit,
                    properties,
                    metrics
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: rockmap [options] [data-dir]

Opens the database read-only and prints a JSON report.

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Database directory (default ./data/db)
  --config=<file>            JSON config file; its path and keyspaces are used
  --keyspace=<name>          Keyspace to inspect (omit to list keyspaces)
  --properties               Print engine properties of the keyspace
  --prefix=<text>            Only keys starting with this UTF-8 prefix
  --from=<text>              Start at this UTF-8 key
  --reverse                  Iterate in descending key order
  --keys-only                List keys only, without reading values
  --limit=<n>                Maximum entries to print (default 100)
  --metrics                  Append storage metrics after the report

Environment (flags take precedence):
  ROCKMAP_DATA_DIR           Default for --data-dir
  ROCKMAP_CONFIG             Default for --config
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parsePositiveInt(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed <= 0) {
                    throw new IllegalArgumentException(flag + " must be positive");
                }
                return parsed;
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(flag + " must be a number: " + value);
            }
        }
    }
}
