package vypr.ir;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameAllocatorTest {
    private final NameAllocator names = new NameAllocator("main");

    @Test
    void plainNamesAreKept() {
        assertEquals("total", names.allocate("total", Set.of()));
        assertFalse(names.isReserved("total"));
    }

    @Test
    void reservedNamesGetSuffix() {
        assertEquals("str_", names.allocate("str", Set.of()));
        assertEquals("lambda_", names.allocate("lambda", Set.of()));
        assertEquals("main_", names.allocate("main", Set.of()));
        assertEquals("_t3_", names.allocate("_t3", Set.of()));
        assertEquals("u_vy_str", names.allocate("_vy_str", Set.of()));
        assertTrue(names.isReserved("None"));
    }

    @Test
    void collisionsGetNumericSuffix() {
        assertEquals("x_1", names.allocate("x", Set.of("x")));
        assertEquals("x_2", names.allocate("x", Set.of("x", "x_1")));
        assertEquals("str__1", names.allocate("str", Set.of("str_")));
    }
}
