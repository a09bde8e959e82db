package ru.aritmos.studioavailability.model;

import org.junit.jupiter.api.Test;
import ru.aritmos.studioavailability.error.ScraperValidationException;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeSlotTest {

    @Test
    void midnightEndMeansEndOfDay() {
        TimeSlot slot = TimeSlot.parse("22:00", "00:00");

        assertEquals(1320, slot.startMinutes());
        assertEquals(1440, slot.endMinutes());
        assertEquals(120, slot.durationMinutes());
        assertEquals("22:00-24:00", slot.toString());
    }

    @Test
    void endOfDayLiteralIsAcceptedOnlyAsEnd() {
        assertEquals(LocalTime.MIDNIGHT, TimeOfDay.parse("24:00", true));
        assertThrows(ScraperValidationException.class, () -> TimeOfDay.parse("24:00", false));
    }

    @Test
    void fullWidthColonIsAccepted() {
        assertEquals(LocalTime.of(9, 30), TimeOfDay.parse("09：30", false));
    }

    @Test
    void reversedOrEmptyIntervalIsRejected() {
        assertThrows(ScraperValidationException.class, () -> TimeSlot.parse("12:00", "09:00"));
        assertThrows(ScraperValidationException.class, () -> TimeSlot.parse("10:00", "10:00"));
        assertThrows(ScraperValidationException.class, () -> new TimeSlot(null, LocalTime.NOON));
    }

    @Test
    void malformedTimeIsRejected() {
        assertThrows(ScraperValidationException.class, () -> TimeOfDay.parse("9-30", false));
        assertThrows(ScraperValidationException.class, () -> TimeOfDay.parse("25:00", true));
        assertThrows(ScraperValidationException.class, () -> TimeOfDay.parse(" ", false));
    }

    @Test
    void minutesRoundTripKeepsMidnightSentinel() {
        TimeSlot slot = TimeSlot.ofMinutes(1380, 1440);

        assertEquals(LocalTime.of(23, 0), slot.start());
        assertEquals(LocalTime.MIDNIGHT, slot.end());
        assertEquals("24:00", TimeOfDay.format(slot.end(), true));
        assertEquals("00:00", TimeOfDay.format(slot.end(), false));
        assertThrows(ScraperValidationException.class, () -> TimeOfDay.fromMinutes(1441));
    }

    @Test
    void desiredRangeFollowsSameRules() {
        DesiredRange range = DesiredRange.parse("23:00", "24:00");

        assertEquals(1380, range.startMinutes());
        assertEquals(1440, range.endMinutes());
        assertThrows(ScraperValidationException.class, () -> DesiredRange.parse("11:00", "10:00"));
    }
}
