package ember;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testDefaultsWhenFileMissing() {
        Config config = Config.load(dir.resolve("absent.yaml").toString(), Collections.emptyMap());
        assertEquals("127.0.0.1", config.host);
        assertEquals(6379, config.port);
        assertEquals("info", config.logLevel);
        assertEquals(100, config.sweepIntervalMillis);
        assertEquals(20, config.sweepSampleSize);
        assertEquals(512 * 1024 * 1024, config.maxBulkLength);
    }

    @Test
    public void testYaml() throws IOException {
        Path file = write("ember.yaml",
                "host: 0.0.0.0\n"
                + "port: 7000\n"
                + "sweepIntervalMillis: 250\n"
                + "maxNestingDepth: 8\n"
                + "somethingElse: ignored\n");
        Config config = Config.load(file.toString(), Collections.emptyMap());
        assertEquals("0.0.0.0", config.host);
        assertEquals(7000, config.port);
        assertEquals(250, config.sweepIntervalMillis);
        assertEquals(8, config.maxNestingDepth);
        assertEquals(20, config.sweepSampleSize);
    }

    @Test
    public void testLegacyFormat() throws IOException {
        Path file = write("ember.conf",
                "# comment\n"
                + "bind 10.0.0.1\n"
                + "port 6380\n"
                + "sweep-interval 50\n"
                + "loglevel warning\n"
                + "proto-max-bulk-len 1mb\n"
                + "mystery-directive yes\n");
        Config config = Config.load(file.toString(), Collections.emptyMap());
        assertEquals("10.0.0.1", config.host);
        assertEquals(6380, config.port);
        assertEquals(50, config.sweepIntervalMillis);
        assertEquals("warning", config.logLevel);
        assertEquals(1024 * 1024, config.maxBulkLength);
    }

    @Test
    public void testConfNameFallsBackToYaml() throws IOException {
        write("server.yaml", "port: 6555\n");
        Config config = Config.load(dir.resolve("server.conf").toString(), Collections.emptyMap());
        assertEquals(6555, config.port);
    }

    @Test
    public void testEnvironmentOverrides() throws IOException {
        Path file = write("ember.yaml", "port: 7000\n");
        Map<String, String> env = new HashMap<>();
        env.put("EMBER_PORT", "7100");
        env.put("EMBER_HOST", "::1");
        Config config = Config.load(file.toString(), env);
        assertEquals(7100, config.port);
        assertEquals("::1", config.host);

        env.put("EMBER_PORT", "not-a-port");
        assertEquals(7000, Config.load(file.toString(), env).port);
    }

    @Test
    public void testValidation() throws IOException {
        Path file = write("bad.yaml", "port: 70000\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(file.toString(), Collections.emptyMap()));

        Path sweep = write("sweep.yaml", "sweepSampleSize: 0\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(sweep.toString(), Collections.emptyMap()));
    }

    @Test
    public void testValidationRejectsCodecLimits() throws IOException {
        Path bulk = write("bulk.yaml", "maxBulkLength: 2147483647\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(bulk.toString(), Collections.emptyMap()));

        Path array = write("array.yaml", "maxArrayLength: -1\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(array.toString(), Collections.emptyMap()));

        Path depth = write("depth.yaml", "maxNestingDepth: 100000\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(depth.toString(), Collections.emptyMap()));

        Path zero = write("zero.yaml", "maxNestingDepth: 0\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(zero.toString(), Collections.emptyMap()));

        Path ok = write("ok.yaml", "maxBulkLength: 1024\nmaxNestingDepth: 256\n");
        Config config = Config.load(ok.toString(), Collections.emptyMap());
        assertNotNull(config.newCodec());
    }

    @Test
    public void testParseMemory() {
        assertEquals(1024, Config.parseMemory("1kb"));
        assertEquals(3L * 1024 * 1024 * 1024, Config.parseMemory("3GB"));
        assertEquals(512, Config.parseMemory("512"));
    }

    @Test
    public void testCodecUsesLimits() {
        Config config = new Config();
        config.maxBulkLength = 4;
        assertTrue(config.newCodec().tryParse("$5\r\n".getBytes(StandardCharsets.US_ASCII)).isMalformed());
    }
}
