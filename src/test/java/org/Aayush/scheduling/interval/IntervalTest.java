package org.Aayush.scheduling.interval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Interval Validation Tests")
class IntervalTest {

    @Test
    @DisplayName("Valid triple yields an interval and no violation")
    void testAcceptedCheck() {
        IntervalCheck check = Interval.check(10, 20, 2);
        assertTrue(check.valid());
        assertNull(check.violation());
        assertEquals(10.0, check.interval().getStart());
        assertEquals(20.0, check.interval().getFinish());
        assertEquals(2.0, check.interval().getWeight());
    }

    @Test
    @DisplayName("Each constraint reports its own violation")
    void testViolations() {
        assertEquals(IntervalViolation.NON_POSITIVE_DURATION, Interval.check(5, 5, 1).violation());
        assertEquals(IntervalViolation.NON_POSITIVE_DURATION, Interval.check(6, 5, 1).violation());
        assertEquals(IntervalViolation.NON_POSITIVE_WEIGHT, Interval.check(0, 1, 0).violation());
        assertEquals(IntervalViolation.NON_POSITIVE_WEIGHT, Interval.check(0, 1, -3).violation());
        assertEquals(IntervalViolation.START_NOT_FINITE, Interval.check(Double.NaN, 1, 1).violation());
        assertEquals(IntervalViolation.START_NOT_FINITE, Interval.check(Double.NEGATIVE_INFINITY, 1, 1).violation());
        assertEquals(IntervalViolation.FINISH_NOT_FINITE, Interval.check(0, Double.POSITIVE_INFINITY, 1).violation());
        assertEquals(IntervalViolation.WEIGHT_NOT_FINITE, Interval.check(0, 1, Double.NaN).violation());
        assertEquals(IntervalViolation.WEIGHT_NOT_FINITE, Interval.check(0, 1, Double.POSITIVE_INFINITY).violation());
    }

    @Test
    @DisplayName("Finiteness is checked before ordering and weight sign")
    void testCheckOrder() {
        IntervalCheck check = Interval.check(Double.NaN, Double.NaN, -1);
        assertFalse(check.valid());
        assertNull(check.interval());
        assertEquals(IntervalViolation.START_NOT_FINITE, check.violation());
    }

    @Test
    @DisplayName("Factory throws reason-coded exception")
    void testFactoryThrows() {
        IntervalValidationException ex = assertThrows(IntervalValidationException.class, () -> Interval.of(3, 1, 1));
        assertEquals("WIS_NON_POSITIVE_DURATION", ex.reasonCode());
        assertEquals(IntervalViolation.NON_POSITIVE_DURATION, ex.violation());
        assertTrue(ex.getMessage().startsWith("[WIS_NON_POSITIVE_DURATION]"));
    }

    @Test
    @DisplayName("Touching endpoints are compatible, shared instants are not")
    void testPrecedes() {
        Interval a = Interval.of(10, 20, 2);
        Interval b = Interval.of(20, 30, 2);
        Interval c = Interval.of(15, 25, 5);

        assertTrue(a.precedes(b));
        assertFalse(b.precedes(a));
        assertFalse(a.precedes(c));
        assertFalse(c.precedes(b));
        assertFalse(a.precedes(a));
    }

    @Test
    @DisplayName("Value semantics")
    void testEquality() {
        assertEquals(Interval.of(-17, -6, 1.1), Interval.of(-17, -6, 1.1));
        assertNotEquals(Interval.of(-17, -6, 1.1), Interval.of(-17, -6, 1.2));
    }
}
