package de.admir.unistore.client;

import de.admir.unistore.core.StorageProvider;
import de.admir.unistore.core.config.CoreConfig;
import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.secret.CachingSecretProvider;
import de.admir.unistore.core.secret.ConfigSecretProvider;
import de.admir.unistore.core.util.JsonMapper;
import de.admir.unistore.core.util.Xor;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Runs a single storage operation against the configured backend.
 * <p>
 * Usage: {@code <add|delete|exists|list|read> <path> [localFile [overwrite]]}
 */
public class ClientMain {
    private static final Logger logger = LoggerFactory.getLogger(ClientMain.class);
    private static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: <add|delete|exists|list|read> <path> [localFile [overwrite]]";

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            System.exit(EXIT_USAGE);
        }

        StorageProviderFactory factory = new StorageProviderFactory(CoreConfig.CONFIG,
            new CachingSecretProvider(new ConfigSecretProvider(CoreConfig.CONFIG), CoreConfig.getSecretsCacheTtl()));

        Xor<StorageError, StorageProvider> xorProvider = factory.create();
        if (xorProvider.isLeft()) {
            logger.error(FATAL, "Could not create storage provider: " + xorProvider.getLeft());
            System.exit(EXIT_FAILED);
        }

        System.exit(run(xorProvider.getRight(), args, System.out));
    }

    static int run(StorageProvider provider, String[] args, PrintStream out) {
        String operation = args[0].toLowerCase(Locale.ROOT);
        String path = args[1];
        switch (operation) {
            case "add":
                if (args.length < 3) {
                    System.err.println(USAGE);
                    return EXIT_USAGE;
                }
                boolean overwrite = args.length > 3 && "overwrite".equalsIgnoreCase(args[3]);
                try (InputStream content = Files.newInputStream(Paths.get(args[2]))) {
                    return report(operation, path, provider.add(path, content, overwrite).join(), out);
                } catch (IOException e) {
                    logger.error(FATAL, "Could not open local file: " + args[2], e);
                    return EXIT_FAILED;
                }
            case "delete":
                return report(operation, path, provider.delete(path).join(), out);
            case "exists":
                return report(operation, path, provider.exists(path).join(), out);
            case "list":
                return report(operation, path, provider.list(path).join(), out);
            case "read":
                return copyToOutput(path, provider, out);
            default:
                System.err.println(USAGE);
                return EXIT_USAGE;
        }
    }

    private static int copyToOutput(String path, StorageProvider provider, PrintStream out) {
        Xor<StorageError, Long> xorCopied = provider.read(path, out).join();
        if (xorCopied.isLeft())
            return report("read", path, xorCopied, out);

        out.flush();
        logger.debug(String.format("Copied %d bytes of %s", xorCopied.getRight(), path));
        return EXIT_OK;
    }

    private static int report(String operation, String path, Xor<StorageError, ?> result, PrintStream out) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("operation", operation);
        output.put("path", path);
        if (result.isLeft()) {
            StorageError error = result.getLeft();
            output.put("error", error.getType());
            output.put("message", error.getMessage());
        } else {
            output.put("result", result.getRight());
        }

        try {
            out.println(JsonMapper.getInstance().writeValueAsString(output));
        } catch (JsonProcessingException e) {
            logger.error(FATAL, "Could not serialize result", e);
            return EXIT_FAILED;
        }
        return result.isLeft() ? EXIT_FAILED : EXIT_OK;
    }
}
