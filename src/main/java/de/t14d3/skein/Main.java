package de.t14d3.skein;

import de.t14d3.skein.core.InstanceRegistry;
import de.t14d3.skein.core.Skein;
import de.t14d3.skein.core.SkeinConfiguration;
import de.t14d3.skein.mapping.EntityDescriber;
import de.t14d3.skein.migration.SchemaMetadata;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.Schema;

import java.io.PrintStream;
import java.util.*;

/**
 * Skein CLI - Command-line interface for inspecting, validating, migrating and copying files.
 *
 * Usage:
 *   java -cp ... de.t14d3.skein.Main [command] [options]
 *
 * Commands:
 *   version <path>                 - Print the schema version of a file
 *   inspect <path>                 - Print the object types stored in a file
 *   validate <entity-class>...     - Validate entity annotations
 *   migrate --path <p> --schema-version <n> <entity-class>...  - Migrate a file to the entities
 *   compact <path>                 - Reclaim unused space
 *   copy <source> <target>         - Write a compacted copy
 *   help                           - Show this help message
 *
 * Options:
 *   --key <hex>                    - Encryption key of the file (128 hex digits)
 *   --target-key <hex>             - Encryption key of the copy
 *   --verbose                      - Verbose output
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printHelp(out);
            return 1;
        }

        String command = args[0].toLowerCase();
        Options options;
        try {
            options = Options.parse(Arrays.copyOfRange(args, 1, args.length));
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            switch (command) {
                case "help", "--help", "-h" -> {
                    printHelp(out);
                    return 0;
                }
                case "version" -> {
                    return handleVersion(options, out);
                }
                case "inspect" -> {
                    return handleInspect(options, out);
                }
                case "validate" -> {
                    return handleValidate(options, out, err);
                }
                case "migrate" -> {
                    return handleMigrate(options, out);
                }
                case "compact" -> {
                    return handleCompact(options, out);
                }
                case "copy" -> {
                    return handleCopy(options, out);
                }
                default -> {
                    err.println("Unknown command: " + command);
                    out.println();
                    printHelp(out);
                    return 1;
                }
            }
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (options.verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Skein CLI - Command-line interface for schema and migration management");
        out.println();
        out.println("Usage:");
        out.println("  java -cp ... de.t14d3.skein.Main [command] [options]");
        out.println();
        out.println("Commands:");
        out.println("  version <path>                 - Print the schema version of a file");
        out.println("  inspect <path>                 - Print the object types stored in a file");
        out.println("  validate <entity-class>...     - Validate entity annotations");
        out.println("  migrate --path <p> --schema-version <n> <entity-class>...");
        out.println("                                 - Migrate a file to the given entities");
        out.println("  compact <path>                 - Reclaim unused space");
        out.println("  copy <source> <target>         - Write a compacted copy");
        out.println("  help                           - Show this help message");
        out.println();
        out.println("Options:");
        out.println("  --key <hex>                    - Encryption key of the file (128 hex digits)");
        out.println("  --target-key <hex>             - Encryption key of the copy");
        out.println("  --verbose                      - Verbose output");
    }

    private static int handleVersion(Options options, PrintStream out) {
        String path = options.requireArgument(0, "version <path>");
        InstanceRegistry registry = InstanceRegistry.builder().build();
        long version = Skein.schemaVersionAtPath(registry, path, options.key);
        out.println(version == SchemaMetadata.NOT_VERSIONED ? "not versioned" : String.valueOf(version));
        return 0;
    }

    private static int handleInspect(Options options, PrintStream out) {
        String path = options.requireArgument(0, "inspect <path>");
        InstanceRegistry registry = InstanceRegistry.builder().build();
        try (Skein skein = openDynamic(registry, path, options.key)) {
            out.println("Path: " + skein.getPath());
            out.println("Schema version: " + skein.schemaVersion());
            out.println();
            for (ObjectSchema objectSchema : skein.schema()) {
                out.println(objectSchema.getName() + " (" + skein.table(objectSchema.getName()).size() + " objects)");
                printProperties(objectSchema, out);
            }
        }
        return 0;
    }

    private static int handleValidate(Options options, PrintStream out, PrintStream err) {
        if (options.arguments.isEmpty()) {
            throw new IllegalArgumentException("No entity classes specified. Usage: validate <entity-class>...");
        }
        EntityDescriber describer = new EntityDescriber();
        int invalidCount = 0;
        for (String className : options.arguments) {
            try {
                ObjectSchema objectSchema = describer.describe(Class.forName(className));
                List<String> errors = objectSchema.validate();
                if (errors.isEmpty()) {
                    out.println("✓ " + className + " -> " + objectSchema.getName());
                    if (options.verbose) {
                        printProperties(objectSchema, out);
                    }
                } else {
                    invalidCount++;
                    err.println("✗ " + className);
                    for (String error : errors) {
                        err.println("    - " + error);
                    }
                }
            } catch (ClassNotFoundException e) {
                invalidCount++;
                err.println("✗ " + className + " - Class not found");
            } catch (IllegalArgumentException e) {
                invalidCount++;
                err.println("✗ " + className + " - " + e.getMessage());
            }
        }
        out.println();
        out.println("Validation Summary:");
        out.println("  Valid: " + (options.arguments.size() - invalidCount));
        out.println("  Invalid: " + invalidCount);
        return invalidCount == 0 ? 0 : 1;
    }

    private static int handleMigrate(Options options, PrintStream out) throws ClassNotFoundException {
        if (options.path == null || options.schemaVersion == null) {
            throw new IllegalArgumentException("Usage: migrate --path <p> --schema-version <n> <entity-class>...");
        }
        List<Class<?>> classes = new ArrayList<>();
        for (String className : options.arguments) {
            classes.add(Class.forName(className));
        }
        Schema schema = new EntityDescriber().describeAll(classes);
        InstanceRegistry registry = InstanceRegistry.builder().schema(schema).build();
        registry.setSchemaVersion(options.path, options.schemaVersion, null);
        boolean changed = Skein.migrate(registry, options.path, options.key);
        out.println(changed
                ? "Migrated to schema version " + options.schemaVersion
                : "Schema is up to date. No changes needed.");
        return 0;
    }

    private static int handleCompact(Options options, PrintStream out) {
        String path = options.requireArgument(0, "compact <path>");
        InstanceRegistry registry = InstanceRegistry.builder().build();
        try (Skein skein = openDynamic(registry, path, options.key)) {
            if (!skein.compact()) {
                out.println("Could not compact " + skein.getPath());
                return 1;
            }
            out.println("Compacted " + skein.getPath());
        }
        return 0;
    }

    private static int handleCopy(Options options, PrintStream out) {
        String source = options.requireArgument(0, "copy <source> <target>");
        String target = options.requireArgument(1, "copy <source> <target>");
        InstanceRegistry registry = InstanceRegistry.builder().build();
        try (Skein skein = openDynamic(registry, source, options.key)) {
            skein.writeCopy(target, options.targetKey);
        }
        out.println("Wrote copy to " + target);
        return 0;
    }

    private static Skein openDynamic(InstanceRegistry registry, String path, byte[] key) {
        if (Skein.schemaVersionAtPath(registry, path, key) == SchemaMetadata.NOT_VERSIONED) {
            throw new IllegalArgumentException("No versioned file at '" + path + "'");
        }
        return Skein.open(registry, SkeinConfiguration.builder()
                .path(path)
                .encryptionKey(key)
                .dynamic(true)
                .build());
    }

    private static void printProperties(ObjectSchema objectSchema, PrintStream out) {
        for (Property property : objectSchema.getProperties()) {
            StringBuilder line = new StringBuilder("  - ").append(property.getName()).append(": ").append(property.getType());
            if (property.getObjectType() != null) {
                line.append('<').append(property.getObjectType()).append('>');
            }
            if (property.isNullable()) line.append(" optional");
            if (property.isIndexed()) line.append(" indexed");
            if (property.isPrimary()) line.append(" primary");
            out.println(line);
        }
    }

    /**
     * Parsed command options: named options plus positional arguments.
     */
    private static final class Options {
        final List<String> arguments = new ArrayList<>();
        String path;
        Long schemaVersion;
        byte[] key;
        byte[] targetKey;
        boolean verbose;

        static Options parse(String[] args) {
            Options options = new Options();
            int i = 0;
            while (i < args.length) {
                String arg = args[i];
                switch (arg) {
                    case "--path" -> options.path = value(args, i++, arg);
                    case "--schema-version" -> {
                        String value = value(args, i++, arg);
                        try {
                            options.schemaVersion = Long.parseLong(value);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--schema-version requires a number, got '" + value + "'");
                        }
                    }
                    case "--key" -> options.key = hex(value(args, i++, arg), arg);
                    case "--target-key" -> options.targetKey = hex(value(args, i++, arg), arg);
                    case "--verbose" -> options.verbose = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        options.arguments.add(arg);
                    }
                }
                i++;
            }
            return options;
        }

        String requireArgument(int index, String usage) {
            if (arguments.size() <= index) {
                throw new IllegalArgumentException("Missing argument. Usage: " + usage);
            }
            return arguments.get(index);
        }

        private static String value(String[] args, int index, String option) {
            if (index + 1 >= args.length) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            return args[index + 1];
        }

        private static byte[] hex(String value, String option) {
            try {
                return HexFormat.of().parseHex(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(option + " requires a hex encoded key");
            }
        }
    }
}
