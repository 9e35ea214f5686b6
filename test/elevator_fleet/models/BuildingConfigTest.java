package elevator_fleet.models;

import static org.junit.jupiter.api.Assertions.*;

import elevator_fleet.errors.ValidationException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BuildingConfig")
class BuildingConfigTest {

    @Test
    void defaults() {
        BuildingConfig config = BuildingConfig.defaults();
        assertEquals(10, config.totalFloors);
        assertEquals(5.0, config.floorMoveTime);
        assertEquals(2.0, config.doorOpenCloseTime);
        assertEquals(Duration.ofSeconds(5), config.floorMoveDuration());
        assertEquals(Duration.ofSeconds(2), config.doorPhaseDuration());
    }

    @Test
    @DisplayName("constraints on every field")
    void validation() {
        assertEquals(ValidationException.Constraint.INVALID_CONFIG,
                assertThrows(ValidationException.class, () -> new BuildingConfig(1, 1, 1)).constraint());
        assertThrows(ValidationException.class, () -> new BuildingConfig(10, 0, 1));
        assertThrows(ValidationException.class, () -> new BuildingConfig(10, Double.NaN, 1));
        assertThrows(ValidationException.class, () -> new BuildingConfig(10, 1, -0.5));
        assertThrows(ValidationException.class, () -> new BuildingConfig(10, Double.POSITIVE_INFINITY, 1));
        assertDoesNotThrow(() -> new BuildingConfig(2, 0.1, 0));
    }

    @Test
    void containsFloor() {
        BuildingConfig config = new BuildingConfig(4, 1, 1);
        assertFalse(config.containsFloor(0));
        assertTrue(config.containsFloor(1));
        assertTrue(config.containsFloor(4));
        assertFalse(config.containsFloor(5));
    }

    @Test
    @DisplayName("merge keeps fields the update leaves out")
    void merge() {
        BuildingConfig base = new BuildingConfig(10, 5, 2);
        assertEquals(new BuildingConfig(20, 5, 2), base.merge(ConfigUpdate.totalFloors(20)));
        assertEquals(new BuildingConfig(10, 1.5, 0.5), base.merge(ConfigUpdate.timings(1.5, 0.5)));
        assertSame(base, base.merge(null));
        assertThrows(ValidationException.class, () -> base.merge(ConfigUpdate.totalFloors(0)));
    }

    @Test
    @DisplayName("fractional seconds round to milliseconds")
    void seconds() {
        assertEquals(Duration.ofMillis(500), BuildingConfig.seconds(0.5));
        assertEquals(Duration.ofMillis(1), BuildingConfig.seconds(0.0005));
        assertEquals(Duration.ZERO, BuildingConfig.seconds(0));
    }
}
