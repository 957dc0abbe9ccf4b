package com.datasheetrag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.datasheetrag.ingest.DatasheetSource;
import com.datasheetrag.runtime.AppConfig;
import com.datasheetrag.runtime.RetrievalStack;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportStatsForEmptyStore() {
        int exitCode = run("--mode", "stats");

        assertEquals(0, exitCode);
        assertTrue(Files.isDirectory(tempDir.resolve("store")));
    }

    @Test
    void shouldRequireFileInIngestMode() {
        assertEquals(2, run("--mode", "ingest"));
        assertEquals(1, run("--mode", "ingest", "--file", tempDir.resolve("missing.txt").toString()));
    }

    @Test
    void shouldRequireQueryInSearchMode() {
        assertEquals(2, run("--mode", "search"));
    }

    @Test
    void shouldIngestThenSearch() throws IOException {
        Path datasheet = tempDir.resolve("bme280.txt");
        Files.writeString(datasheet, "The BME280 is a combined humidity, pressure and temperature sensor.");

        assertEquals(0, run("--mode", "ingest", "--file", datasheet.toString(),
                "--mpn", "BME280", "--manufacturer", "Bosch", "--category", "sensor"));
        assertEquals(0, run("--mode", "search", "--query", "humidity sensor", "--category", "sensor",
                "--top-k", "3"));

        assertEquals(1, count());
    }

    @Test
    void shouldRunBatchManifestAndFlagMissingEntries() throws IOException {
        Path esp32 = tempDir.resolve("esp32.txt");
        Files.writeString(esp32, "ESP32 is a dual-core microcontroller with integrated WiFi.");
        Path manifest = tempDir.resolve("manifest.yml");
        Files.writeString(manifest, """
                - path: %s
                  component_info:
                    mpn: ESP32
                    manufacturer: Espressif
                    category: microcontroller
                - path: %s
                """.formatted(
                esp32.toString().replace('\\', '/'),
                tempDir.resolve("missing.pdf").toString().replace('\\', '/')));

        assertEquals(1, run("--mode", "batch", "--manifest", manifest.toString()));
        assertEquals(1, count());
    }

    @Test
    void shouldLoadManifestEntries() throws IOException {
        Path manifest = tempDir.resolve("manifest.yml");
        Files.writeString(manifest, """
                - path: datasheets/lm317.pdf
                  component_info:
                    mpn: LM317
                    category: power
                    datasheet_url: https://example.com/lm317.pdf
                """);

        List<DatasheetSource> sources = Main.loadManifest(manifest);

        assertEquals(1, sources.size());
        assertEquals("datasheets/lm317.pdf", sources.get(0).path());
        assertEquals("LM317", sources.get(0).componentInfo().mpn());
        assertEquals("https://example.com/lm317.pdf", sources.get(0).componentInfo().datasheetUrl());
    }

    @Test
    void shouldIngestManifestWithEmptyExtraValues() throws IOException {
        Path tps = tempDir.resolve("tps62160.txt");
        Files.writeString(tps, "TPS62160 is a 3V to 17V 1A step-down converter.");
        Path ina = tempDir.resolve("ina219.txt");
        Files.writeString(ina, "INA219 is a current shunt and power monitor.");
        Path manifest = tempDir.resolve("manifest.yml");
        Files.writeString(manifest, """
                - path: %s
                  component_info:
                    mpn: TPS62160
                    extra:
                      package:
                      grade: industrial
                - path: %s
                  component_info:
                    mpn: INA219
                """.formatted(
                tps.toString().replace('\\', '/'),
                ina.toString().replace('\\', '/')));

        List<DatasheetSource> sources = Main.loadManifest(manifest);
        assertEquals(Map.of("grade", "industrial"), sources.get(0).componentInfo().extra());

        assertEquals(0, run("--mode", "batch", "--manifest", manifest.toString()));
        assertEquals(2, count());
    }

    @Test
    void shouldDeleteCollection() throws IOException {
        Path datasheet = tempDir.resolve("lm317.txt");
        Files.writeString(datasheet, "LM317 adjustable regulator, 1.25V to 37V output.");
        run("--mode", "ingest", "--file", datasheet.toString());

        assertEquals(0, run("--mode", "delete"));
        assertEquals(0, count());
    }

    private int run(String... args) {
        String[] common = {
                "--config", tempDir.resolve("absent.yml").toString(),
                "--store-path", tempDir.resolve("store").toString() };
        String[] all = new String[common.length + args.length];
        System.arraycopy(common, 0, all, 0, common.length);
        System.arraycopy(args, 0, all, common.length, args.length);
        return new CommandLine(new Main()).execute(all);
    }

    private long count() {
        AppConfig config = new AppConfig();
        config.getStore().setPath(tempDir.resolve("store").toString());
        try (RetrievalStack stack = RetrievalStack.open(config)) {
            return stack.collection().count();
        }
    }
}
