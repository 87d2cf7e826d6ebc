package org.micronav.planning.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Planner Config Tests")
class PlannerConfigTest {

    private static final List<String> PROPERTIES = List.of(
            PlannerConfig.PROP_ATTRACTIVE_GAIN,
            PlannerConfig.PROP_REPULSIVE_GAIN,
            PlannerConfig.PROP_OBSTACLE_INFLUENCE,
            PlannerConfig.PROP_ROBOT_WIDTH,
            PlannerConfig.PROP_ROBOT_HEIGHT,
            PlannerConfig.PROP_SEARCH_ITERATION_FACTOR,
            PlannerConfig.PROP_DESCENT_STEP_FACTOR,
            PlannerConfig.PROP_CYCLE_WINDOW,
            PlannerConfig.PROP_CYCLE_WARMUP_STEPS,
            PlannerConfig.PROP_CYCLE_REPEAT_LIMIT,
            PlannerConfig.PROP_MIN_OBSTACLE_DISTANCE
    );

    @AfterEach
    void clearProperties() {
        PROPERTIES.forEach(System::clearProperty);
    }

    @Test
    @DisplayName("Defaults match the documented tunables")
    void testDefaults() {
        PlannerConfig config = PlannerConfig.defaults();
        assertEquals(1.0d, config.getAttractiveGain());
        assertEquals(50.0d, config.getRepulsiveGain());
        assertEquals(3.0d, config.getObstacleInfluence());
        assertEquals(2, config.getRobotWidth());
        assertEquals(2, config.getRobotHeight());
        assertEquals(4, config.getSearchIterationFactor());
        assertEquals(2, config.getDescentStepFactor());
        assertEquals(20, config.getCycleWindow());
        assertEquals(10, config.getCycleWarmupSteps());
        assertEquals(2, config.getCycleRepeatLimit());
        assertSame(config, config.validate());
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        private void assertRejected(PlannerConfig config, String reasonCode) {
            PlannerConfigurationException ex = assertThrows(PlannerConfigurationException.class, config::validate);
            assertEquals(reasonCode, ex.reasonCode());
            assertTrue(ex.getMessage().startsWith("[" + reasonCode + "] "), ex.getMessage());
        }

        @Test
        @DisplayName("Non-positive gains are rejected")
        void testGains() {
            assertRejected(PlannerConfig.builder().attractiveGain(0.0d).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_GAIN);
            assertRejected(PlannerConfig.builder().repulsiveGain(-1.0d).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_GAIN);
            assertRejected(PlannerConfig.builder().attractiveGain(Double.NaN).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_GAIN);
        }

        @Test
        @DisplayName("Influence radius must be finite and positive")
        void testInfluence() {
            assertRejected(PlannerConfig.builder().obstacleInfluence(0.0d).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_INFLUENCE);
            assertRejected(PlannerConfig.builder().obstacleInfluence(Double.POSITIVE_INFINITY).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_INFLUENCE);
        }

        @Test
        @DisplayName("Footprint below one cell is rejected")
        void testFootprint() {
            assertRejected(PlannerConfig.builder().robotWidth(0).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_FOOTPRINT);
            assertRejected(PlannerConfig.builder().robotHeight(-3).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_FOOTPRINT);
        }

        @Test
        @DisplayName("Budgets and cycle bounds are range-checked")
        void testBudgets() {
            assertRejected(PlannerConfig.builder().searchIterationFactor(0).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_BUDGET);
            assertRejected(PlannerConfig.builder().descentStepFactor(-1).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_BUDGET);
            assertRejected(PlannerConfig.builder().cycleRepeatLimit(0).build(),
                    PlannerConfigurationException.REASON_INVALID_CYCLE_WINDOW);
            assertRejected(PlannerConfig.builder().cycleWarmupSteps(-1).build(),
                    PlannerConfigurationException.REASON_INVALID_CYCLE_WINDOW);
            assertRejected(PlannerConfig.builder().minObstacleDistance(0.0d).build(),
                    PlannerConfigurationException.REASON_NON_POSITIVE_MIN_DISTANCE);
        }
    }

    @Nested
    @DisplayName("System Properties")
    class SystemPropertyTests {

        @Test
        @DisplayName("Set properties override defaults")
        void testOverrides() {
            System.setProperty(PlannerConfig.PROP_REPULSIVE_GAIN, "12.5");
            System.setProperty(PlannerConfig.PROP_ROBOT_WIDTH, " 3 ");
            System.setProperty(PlannerConfig.PROP_SEARCH_ITERATION_FACTOR, "8");

            PlannerConfig config = PlannerConfig.fromSystemProperties();

            assertEquals(12.5d, config.getRepulsiveGain());
            assertEquals(3, config.getRobotWidth());
            assertEquals(8, config.getSearchIterationFactor());
            assertEquals(2, config.getRobotHeight());
        }

        @Test
        @DisplayName("Cycle detection bounds and distance floor are tunable")
        void testCycleOverrides() {
            System.setProperty(PlannerConfig.PROP_CYCLE_WINDOW, "40");
            System.setProperty(PlannerConfig.PROP_CYCLE_WARMUP_STEPS, "0");
            System.setProperty(PlannerConfig.PROP_CYCLE_REPEAT_LIMIT, "5");
            System.setProperty(PlannerConfig.PROP_MIN_OBSTACLE_DISTANCE, "0.25");

            PlannerConfig config = PlannerConfig.fromSystemProperties();

            assertEquals(40, config.getCycleWindow());
            assertEquals(0, config.getCycleWarmupSteps());
            assertEquals(5, config.getCycleRepeatLimit());
            assertEquals(0.25d, config.getMinObstacleDistance());
            assertSame(config, config.validate());
        }

        @Test
        @DisplayName("Blank or unparsable values fall back to defaults")
        void testFallback() {
            System.setProperty(PlannerConfig.PROP_ATTRACTIVE_GAIN, "  ");
            System.setProperty(PlannerConfig.PROP_ROBOT_HEIGHT, "tall");
            System.setProperty(PlannerConfig.PROP_DESCENT_STEP_FACTOR, "2.5");
            System.setProperty(PlannerConfig.PROP_CYCLE_WINDOW, "");
            System.setProperty(PlannerConfig.PROP_MIN_OBSTACLE_DISTANCE, "tiny");

            assertEquals(PlannerConfig.defaults(), PlannerConfig.fromSystemProperties());
        }

        @Test
        @DisplayName("Parsed but invalid values surface on validation")
        void testInvalidOverride() {
            System.setProperty(PlannerConfig.PROP_ROBOT_WIDTH, "0");
            PlannerConfig config = PlannerConfig.fromSystemProperties();
            assertThrows(PlannerConfigurationException.class, config::validate);
        }
    }
}
