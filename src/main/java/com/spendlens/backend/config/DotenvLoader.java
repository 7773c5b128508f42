package com.spendlens.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads provider keys (GEMINI_API_KEY, DEEPSEEK_API_KEY, ...) from a local ".env" file.
 *
 * Values become System properties only when the key is not already set as an environment
 * variable or system property. A missing file is ignored.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Path envPath = Path.of(".env");
        if (!Files.isRegularFile(envPath)) {
            return;
        }

        try {
            int loaded = apply(Files.readAllLines(envPath, StandardCharsets.UTF_8));
            if (loaded > 0) {
                log.info("[Dotenv] Loaded {} keys from {} (values hidden)", loaded, envPath.toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[Dotenv] Could not read .env, continuing without it: {}", e.getMessage());
        }
    }

    static int apply(List<String> lines) {
        int loaded = 0;
        for (String raw : lines) {
            if (raw == null) continue;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring(7).trim();

            int idx = line.indexOf('=');
            if (idx <= 0) continue;

            String key = line.substring(0, idx).trim();
            String value = unquote(line.substring(idx + 1).trim());
            if (key.isEmpty() || value.isEmpty()) continue;

            if (isSet(System.getenv(key)) || isSet(System.getProperty(key))) {
                continue;
            }

            System.setProperty(key, value);
            loaded++;
        }
        return loaded;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
