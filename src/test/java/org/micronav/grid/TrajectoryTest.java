package org.micronav.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Trajectory Tests")
class TrajectoryTest {

    @Test
    @DisplayName("Rejects empty and non-adjacent waypoint lists")
    void testContract() {
        assertThrows(IllegalArgumentException.class, () -> Trajectory.of(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Trajectory.of(List.of(Position.of(0, 0), Position.of(0, 2))));
        assertThrows(IllegalArgumentException.class,
                () -> Trajectory.of(List.of(Position.of(0, 0), Position.of(0, 0))));
    }

    @Test
    @DisplayName("Cost sums axial and diagonal steps")
    void testCost() {
        Trajectory t = Trajectory.of(List.of(
                Position.of(0, 0),
                Position.of(1, 1),
                Position.of(1, 2),
                Position.of(2, 3)
        ));
        double d = Math.sqrt(2.0d);
        assertArrayEquals(new double[]{0.0d, d, d + 1.0d, 2.0d * d + 1.0d}, t.cumulativeCosts(), 1e-12);
        assertEquals(2.0d * d + 1.0d, t.cost(), 1e-12);
    }

    @Test
    @DisplayName("Goal check looks at the last waypoint")
    void testReaches() {
        Trajectory t = Trajectory.of(List.of(Position.of(0, 0), Position.of(0, 1)));
        assertTrue(t.reaches(Position.of(0, 1)));
        assertFalse(t.reaches(Position.of(0, 0)));
        assertEquals(Position.of(0, 0), t.first());
        assertEquals(Position.of(0, 1), t.last());
    }

    @Test
    @DisplayName("Waypoints are immutable and detached from the source list")
    void testImmutability() {
        List<Position> source = new ArrayList<>(List.of(Position.of(0, 0), Position.of(1, 0)));
        Trajectory t = Trajectory.of(source);
        source.add(Position.of(2, 0));
        assertEquals(2, t.size());
        assertThrows(UnsupportedOperationException.class, () -> t.waypoints().add(Position.of(2, 0)));
        assertEquals(0.0d, Trajectory.singleton(Position.of(3, 3)).cost());
    }
}
