package ember;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import ember.protocol.FrameCodec;
import ember.utils.Log;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public class Config {
    public static final String DEFAULT_FILE = "ember.yaml";

    public String version = "0.1.0";
    public String host = "127.0.0.1";
    public int port = 6379;
    public int workerThreads = 0; // 0 = Netty default (2 x cores)
    public String logLevel = "info";

    // Active expiration
    public long sweepIntervalMillis = 100;
    public int sweepSampleSize = 20;
    public int sweepMaxRounds = 10;

    // Protocol limits
    public int maxBulkLength = FrameCodec.DEFAULT_MAX_BULK_LENGTH;
    public int maxArrayLength = FrameCodec.DEFAULT_MAX_ARRAY_LENGTH;
    public int maxNestingDepth = FrameCodec.DEFAULT_MAX_DEPTH;

    public Config() {
        // Default constructor for Jackson
    }

    public FrameCodec newCodec() {
        return new FrameCodec(maxBulkLength, maxArrayLength, maxNestingDepth);
    }

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        if (!f.exists()) {
            // Accept the redis-style .conf name for a .yaml file next to it
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.replace(".conf", ".yaml"));
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                Config parsed = mapper.readValue(f, Config.class);
                if (parsed != null) config = parsed;
            } catch (IOException e) {
                Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
                config = loadLegacy(f, new Config());
            }
        }

        applyEnv(config, env);
        config.validate();
        return config;
    }

    private static void applyEnv(Config config, Map<String, String> env) {
        if (env.get("EMBER_HOST") != null) {
            config.host = env.get("EMBER_HOST");
        }
        if (env.get("EMBER_PORT") != null) {
            try {
                config.port = Integer.parseInt(env.get("EMBER_PORT").trim());
            } catch (NumberFormatException e) {
                Log.warn("Ignoring invalid EMBER_PORT: " + env.get("EMBER_PORT"));
            }
        }
    }

    private static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0].toLowerCase();
                String val = parts[1].trim();

                try {
                    switch (key) {
                        case "bind":
                        case "host":
                            config.host = val;
                            break;
                        case "port":
                            config.port = Integer.parseInt(val);
                            break;
                        case "loglevel":
                            config.logLevel = val;
                            break;
                        case "worker-threads":
                            config.workerThreads = Integer.parseInt(val);
                            break;
                        case "sweep-interval":
                            config.sweepIntervalMillis = Long.parseLong(val);
                            break;
                        case "sweep-sample-size":
                            config.sweepSampleSize = Integer.parseInt(val);
                            break;
                        case "proto-max-bulk-len":
                            config.maxBulkLength = (int) Math.min(parseMemory(val), Integer.MAX_VALUE - 2);
                            break;
                        default:
                            Log.warn("Unknown config directive: " + key);
                    }
                } catch (NumberFormatException e) {
                    Log.warn("Invalid value for " + key + ": " + val);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (IOException e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }

    static long parseMemory(String val) {
        val = val.toUpperCase();
        long factor = 1;
        if (val.endsWith("GB")) { factor = 1024 * 1024 * 1024L; val = val.replace("GB", ""); }
        else if (val.endsWith("MB")) { factor = 1024 * 1024L; val = val.replace("MB", ""); }
        else if (val.endsWith("KB")) { factor = 1024L; val = val.replace("KB", ""); }
        return Long.parseLong(val.trim()) * factor;
    }

    void validate() {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (workerThreads < 0) throw new IllegalArgumentException("workerThreads must not be negative");
        if (sweepIntervalMillis <= 0) throw new IllegalArgumentException("sweepIntervalMillis must be positive");
        if (sweepSampleSize <= 0) throw new IllegalArgumentException("sweepSampleSize must be positive");
        if (sweepMaxRounds <= 0) throw new IllegalArgumentException("sweepMaxRounds must be positive");
        if (logLevel == null) throw new IllegalArgumentException("logLevel must be set");
        // Every connection builds a codec from these; reject limits it would refuse.
        newCodec();
    }
}
