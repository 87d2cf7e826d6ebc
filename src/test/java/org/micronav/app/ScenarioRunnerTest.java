package org.micronav.app;

import org.micronav.planning.core.PlannerConfig;
import org.micronav.planning.core.PlannerConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Scenario Runner Tests")
class ScenarioRunnerTest {

    private static Path map(String name) throws URISyntaxException {
        return Path.of(ScenarioRunnerTest.class.getResource("/maps/" + name).toURI());
    }

    @Nested
    @DisplayName("Scenario parsing")
    class ParseTests {

        @Test
        @DisplayName("Plain file uses the default footprint")
        void testDefaultFootprint() {
            Scenario scenario = Scenario.parse("maps/corridor.txt", PlannerConfig.defaults());
            assertEquals("corridor", scenario.name());
            assertEquals(Paths.get("maps/corridor.txt"), scenario.mapFile());
            assertEquals(2, scenario.robotWidth());
            assertEquals(2, scenario.robotHeight());
        }

        @Test
        @DisplayName("Footprint suffix overrides width and height")
        void testFootprintSuffix() {
            Scenario scenario = Scenario.parse("narrow@3x1", PlannerConfig.defaults());
            assertEquals("narrow", scenario.name());
            assertEquals(3, scenario.robotWidth());
            assertEquals(1, scenario.robotHeight());
        }

        @Test
        @DisplayName("Malformed or empty footprints are rejected")
        void testMalformed() {
            PlannerConfig defaults = PlannerConfig.defaults();
            assertThrows(IllegalArgumentException.class, () -> Scenario.parse("a.txt@3", defaults));
            assertThrows(IllegalArgumentException.class, () -> Scenario.parse("a.txt@x2", defaults));
            assertThrows(IllegalArgumentException.class, () -> Scenario.parse("a.txt@wide", defaults));
            assertThrows(IllegalArgumentException.class, () -> Scenario.parse("@2x2", defaults));
            assertThrows(PlannerConfigurationException.class, () -> Scenario.parse("a.txt@0x2", defaults));
        }
    }

    @Nested
    @DisplayName("Batch execution")
    class RunTests {

        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private final ScenarioRunner runner = new ScenarioRunner(PlannerConfig.defaults(),
                new PrintStream(bytes, true, StandardCharsets.UTF_8));

        @Test
        @DisplayName("Each scenario is planned with its own footprint")
        void testPerScenarioFootprint() throws URISyntaxException {
            List<ScenarioRunner.Result> results = runner.runAll(List.of(
                    new Scenario("corridor", map("corridor.txt"), 1, 1),
                    new Scenario("corridor-wide", map("corridor.txt"), 3, 3)
            ));

            assertTrue(results.get(0).isSuccess());
            assertFalse(results.get(1).isSuccess());
            assertNull(results.get(1).error());
            assertEquals(3, results.get(1).statistics().getRobotWidth());
            assertEquals(21, results.get(1).statistics().getInflatedObstacleCount());
        }

        @Test
        @DisplayName("A missing map is recorded and the batch continues")
        void testContinuesPastError() throws URISyntaxException {
            List<ScenarioRunner.Result> results = runner.runAll(List.of(
                    new Scenario("absent", Paths.get("does/not/exist.txt"), 1, 1),
                    new Scenario("corridor", map("corridor.txt"), 1, 1)
            ));

            assertEquals(2, results.size());
            assertNotNull(results.get(0).error());
            assertNull(results.get(0).statistics());
            assertFalse(results.get(0).isSuccess());
            assertTrue(results.get(1).isSuccess());

            String out = bytes.toString(StandardCharsets.UTF_8);
            assertTrue(out.contains("Error running scenario: "), out);
            assertTrue(out.contains("[FAIL] Scenario 1: absent"), out);
            assertTrue(out.contains("(error)"), out);
        }

        @Test
        @DisplayName("Single scenario prints no execution summary")
        void testSingleScenario() throws URISyntaxException {
            runner.runAll(List.of(new Scenario("corridor", map("corridor.txt"), 1, 1)));
            assertFalse(bytes.toString(StandardCharsets.UTF_8).contains("=== Execution Summary ==="));
        }

        @Test
        @DisplayName("List prints scenarios without planning")
        void testList() {
            runner.list(List.of(new Scenario("corridor", Paths.get("corridor.txt"), 3, 2)));
            String out = bytes.toString(StandardCharsets.UTF_8);
            assertTrue(out.contains("1. corridor"), out);
            assertTrue(out.contains("(robot 2x3)"), out);
            assertFalse(out.contains("Planning Statistics"), out);
        }
    }
}
