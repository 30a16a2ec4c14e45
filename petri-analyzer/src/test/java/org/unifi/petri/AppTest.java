package org.unifi.petri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class AppTest {

    @Test
    public void testConfigFromArgumentsAndEnvironment() {
        AppConfig fromArgs = AppConfig.load(new String[] {"a.net"}, Map.of("PETRINET_FILE", "b.net"));
        assertEquals(Path.of("a.net"), fromArgs.getNetFile(), "The argument wins over the environment");
        assertEquals(AppConfig.ReportFormat.TEXT, fromArgs.getFormat());

        AppConfig fromEnv = AppConfig.load(new String[0], Map.of("PETRINET_FILE", "b.net", "PETRINET_REPORT_FORMAT", "json"));
        assertEquals(Path.of("b.net"), fromEnv.getNetFile());
        assertEquals(AppConfig.ReportFormat.JSON, fromEnv.getFormat());
    }

    @Test
    public void testBadConfig() {
        assertThrows(IllegalArgumentException.class, () -> AppConfig.load(new String[0], Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> AppConfig.load(new String[] {"a.net"}, Map.of("PETRINET_REPORT_FORMAT", "xml")));
    }

    @Test
    public void testRun(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("good.net");
        Files.write(good, "PLACE p1 tokens 1\nPLACE p2\nTRANSITION t1\nARC p1 t1\nARC t1 p2\n".getBytes(StandardCharsets.UTF_8));
        Path bad = dir.resolve("bad.net");
        Files.write(bad, "PLACE p1\nPLACE p2\nARC p1 p2\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(0, App.run(AppConfig.load(new String[] {good.toString()}, Map.of())));
        assertEquals(0, App.run(AppConfig.load(new String[] {good.toString()}, Map.of("PETRINET_REPORT_FORMAT", "json"))));
        assertEquals(1, App.run(AppConfig.load(new String[] {bad.toString()}, Map.of())), "An invalid net is a failure");
        assertEquals(1, App.run(AppConfig.load(new String[] {dir.resolve("missing.net").toString()}, Map.of())));
    }
}
