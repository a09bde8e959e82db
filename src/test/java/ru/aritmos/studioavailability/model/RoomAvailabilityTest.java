package ru.aritmos.studioavailability.model;

import org.junit.jupiter.api.Test;
import ru.aritmos.studioavailability.error.ScraperValidationException;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomAvailabilityTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 7);

    @Test
    void gridIsSortedAndImmutable() {
        RoomAvailability room = RoomAvailability.of("A", DAY, List.of(TimeSlot.parse("09:00", "12:00")), List.of(30, 0), true);

        assertEquals(List.of(0, 30), List.copyOf(room.startMinutes()));
        assertThrows(UnsupportedOperationException.class, () -> room.startMinutes().add(15));
        assertThrows(UnsupportedOperationException.class, () -> room.slots().clear());
    }

    @Test
    void invalidGridIsRejected() {
        assertThrows(ScraperValidationException.class,
                () -> RoomAvailability.of("A", DAY, List.of(), Set.of(), false));
        assertThrows(ScraperValidationException.class,
                () -> RoomAvailability.of("A", DAY, List.of(), Set.of(0, 20), false));
        assertThrows(ScraperValidationException.class,
                () -> RoomAvailability.of("A", DAY, List.of(), null, false));
    }

    @Test
    void roomNameAndDateAreRequired() {
        assertThrows(ScraperValidationException.class,
                () -> RoomAvailability.of(" ", DAY, List.of(), Set.of(0), false));
        assertThrows(ScraperValidationException.class,
                () -> RoomAvailability.of("A", null, List.of(), Set.of(0), false));
    }

    @Test
    void withSlotsKeepsRoomAttributes() {
        RoomAvailability room = RoomAvailability.of("A", DAY, List.of(TimeSlot.parse("09:00", "12:00")), Set.of(15), false);
        RoomAvailability copy = room.withSlots(List.of(TimeSlot.parse("10:15", "11:15")));

        assertEquals("A", copy.roomName());
        assertEquals(DAY, copy.date());
        assertEquals(Set.of(15), copy.startMinutes());
        assertEquals(1, copy.slots().size());
        assertTrue(room.slots().get(0).durationMinutes() > copy.slots().get(0).durationMinutes());
    }
}
