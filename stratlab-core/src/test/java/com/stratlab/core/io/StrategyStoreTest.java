package com.stratlab.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.stratlab.core.model.PositionSizing;
import com.stratlab.core.model.PositionSizingMethod;
import com.stratlab.core.model.RiskManagement;
import com.stratlab.core.model.Strategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyStoreTest {

    @TempDir
    Path tempDir;

    private StrategyStore store;

    @BeforeEach
    void setUp() {
        store = new StrategyStore(tempDir.toFile());
    }

    @Nested
    @DisplayName("JSON Format")
    class FormatTests {

        @Test
        @DisplayName("Serialize then deserialize gives an equal strategy")
        void roundTrip() {
            Strategy strategy = new Strategy(
                "Trend Follower",
                "SMA cross with trailing stop",
                "sma(20) > sma(50) AND close > sma(200)",
                "sma(20) < sma(50)",
                PositionSizing.of(PositionSizingMethod.RISK_BASED, 2),
                new RiskManagement(8.0, null, true, 5.0)
            );

            assertEquals(strategy, store.fromJson(store.toJson(strategy)));
        }

        @Test
        @DisplayName("Uses snake_case document field names")
        void usesDocumentFieldNames() throws IOException {
            JsonNode json = store.getMapper().readTree(store.toJson(Strategy.createDefault()));

            assertEquals("rsi(14) < 30 AND price > sma(200)", json.get("entry_rules").asText());
            assertEquals("percentage", json.get("position_sizing").get("method").asText());
            assertEquals(10.0, json.get("position_sizing").get("value").asDouble());
            assertEquals(5.0, json.get("risk_management").get("stop_loss_pct").asDouble());
            assertFalse(json.get("risk_management").get("trailing_stop").asBoolean());
            assertFalse(json.get("position_sizing").has("type"));
        }

        @Test
        @DisplayName("Reads a hand-written document and ignores unknown fields")
        void readsHandWrittenDocument() {
            String json = """
                {
                  "name": "RSI Oversold",
                  "entry_rules": "rsi(14) < 30",
                  "exit_rules": "rsi(14) > 70",
                  "position_sizing": {"method": "fixed", "value": 5000},
                  "risk_management": {"stop_loss_pct": 5, "trailing_stop": false},
                  "created_at": "2024-01-01"
                }
                """;

            Strategy strategy = store.fromJson(json);

            assertEquals("RSI Oversold", strategy.name());
            assertNull(strategy.description());
            assertEquals(PositionSizingMethod.FIXED, strategy.positionSizing().type());
            assertEquals(5000.0, strategy.positionSizing().value());
            assertEquals(5.0, strategy.riskManagement().stopLossPct());
            assertNull(strategy.riskManagement().takeProfitPct());
        }

        @Test
        @DisplayName("Invalid JSON is reported as an I/O failure")
        void invalidJson() {
            assertThrows(UncheckedIOException.class, () -> store.fromJson("{not json"));
        }
    }

    @Nested
    @DisplayName("Files")
    class FileTests {

        @Test
        @DisplayName("Saves under the strategy name and loads it back")
        void saveAndLoad() {
            Strategy strategy = Strategy.createDefault().withName("Mean Reversion");

            File file = store.save(strategy);

            assertEquals("Mean Reversion.json", file.getName());
            assertTrue(store.exists("Mean Reversion"));
            assertEquals(strategy, store.load("Mean Reversion"));
        }

        @Test
        @DisplayName("Missing strategy loads as null")
        void missingIsNull() {
            assertNull(store.load("nope"));
        }

        @Test
        @DisplayName("Lists stored names and skips unreadable files")
        void listsNames() throws IOException {
            store.save(Strategy.createDefault().withName("B"));
            store.save(Strategy.createDefault().withName("A"));
            Files.writeString(tempDir.resolve("broken.json"), "{", StandardCharsets.UTF_8);

            assertEquals(List.of("A", "B"), store.listNames());
        }

        @Test
        @DisplayName("Delete removes the file")
        void delete() {
            store.save(Strategy.createDefault().withName("Gone"));

            assertTrue(store.delete("Gone"));
            assertFalse(store.exists("Gone"));
            assertFalse(store.delete("Gone"));
        }

        @Test
        @DisplayName("Characters unsafe in file names are replaced")
        void sanitizesFileNames() {
            File file = store.save(Strategy.createDefault().withName("A/B: test"));
            assertEquals("A_B_ test.json", file.getName());
        }

        @Test
        @DisplayName("Reads a strategy from an arbitrary path")
        void readFile() throws IOException {
            Path path = tempDir.resolve("elsewhere.txt");
            Files.writeString(path, store.toJson(Strategy.createDefault()), StandardCharsets.UTF_8);

            assertEquals(Strategy.createDefault(), StrategyStore.readFile(path.toFile()));
        }
    }
}
