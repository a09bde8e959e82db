package ru.aritmos.studioavailability.matching;

import jakarta.inject.Singleton;
import ru.aritmos.studioavailability.error.ScraperValidationException;
import ru.aritmos.studioavailability.model.DesiredRange;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.model.TimeSlot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Подбор окон бронирования по желаемому диапазону и длительности.
 * <p>
 * Порядок работы для каждой комнаты:
 * <ol>
 *   <li>«сырые» слоты источника склеиваются в непрерывные блоки;</li>
 *   <li>для каждой минуты сетки начало блока выравнивается вперёд до ближайшего допустимого старта;
 *       блок проходит, если после выравнивания в нём осталась минимальная единица брони
 *       (30 минут при получасовых бронированиях, иначе вся запрошенная длительность);</li>
 *   <li>прошедшие блоки объединяются без дублей и снова склеиваются (соседние блоки сливаются);</li>
 *   <li>окно пересекается с диапазоном, начало пересечения выравнивается вверх по сетке;
 *       окна короче запрошенной длительности отбрасываются.</li>
 * </ol>
 * Комнаты без подходящих окон в результат не попадают; порядок комнат сохраняется.
 * <p>
 * Класс без состояния и не выполняет ввода-вывода.
 */
@Singleton
public class AvailabilityMatcher {

    private static final int SUB_HOUR_UNIT = 30;
    private static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * @param rooms доступность комнат (слоты не склеены)
     * @param range желаемый диапазон
     * @param durationHours длительность брони в часах, строго больше нуля
     * @return комнаты с подходящими окнами
     * @throws ScraperValidationException некорректная длительность или отсутствуют входные данные
     */
    public List<RoomAvailability> findAvailable(List<RoomAvailability> rooms, DesiredRange range, double durationHours) {
        int required = validateQuery(range, durationHours);
        if (rooms == null) {
            throw new ScraperValidationException("Не задан список комнат");
        }

        List<RoomAvailability> out = new ArrayList<>();
        for (RoomAvailability room : rooms) {
            List<TimeSlot> windows = windowsFor(room, range.startMinutes(), range.endMinutes(), required);
            if (!windows.isEmpty()) {
                out.add(room.withSlots(windows));
            }
        }
        return out;
    }

    /**
     * Проверить параметры подбора без обращения к данным комнат.
     *
     * @return требуемая длительность в минутах (округление вверх)
     * @throws ScraperValidationException длительность не положительна, больше суток или не задан диапазон
     */
    public int validateQuery(DesiredRange range, double durationHours) {
        if (Double.isNaN(durationHours) || Double.isInfinite(durationHours) || durationHours <= 0) {
            throw new ScraperValidationException("Длительность должна быть положительной, получено: " + durationHours);
        }
        int required = (int) Math.ceil(durationHours * 60);
        if (required > MINUTES_PER_DAY) {
            throw new ScraperValidationException("Длительность не может превышать 24 часа, получено: " + durationHours);
        }
        if (range == null) {
            throw new ScraperValidationException("Не задан желаемый диапазон");
        }
        return required;
    }

    /**
     * Склеить пересекающиеся и соседние слоты. Результат отсортирован по началу.
     */
    public static List<TimeSlot> merge(List<TimeSlot> slots) {
        List<int[]> intervals = new ArrayList<>();
        for (TimeSlot s : slots) {
            intervals.add(new int[]{s.startMinutes(), s.endMinutes()});
        }
        List<TimeSlot> out = new ArrayList<>();
        for (int[] i : mergeIntervals(intervals)) {
            out.add(TimeSlot.ofMinutes(i[0], i[1]));
        }
        return out;
    }

    private static List<TimeSlot> windowsFor(RoomAvailability room, int rangeStart, int rangeEnd, int required) {
        List<int[]> blocks = new ArrayList<>();
        for (TimeSlot s : room.slots()) {
            blocks.add(new int[]{s.startMinutes(), s.endMinutes()});
        }
        blocks = mergeIntervals(blocks);

        int unit = room.allowsSubHourGranularity() ? SUB_HOUR_UNIT : required;
        Set<List<Integer>> qualifying = new LinkedHashSet<>();
        for (int offset : room.startMinutes()) {
            for (int[] b : blocks) {
                int aligned = alignUp(b[0], offset);
                if (b[1] - aligned >= unit) {
                    qualifying.add(List.of(aligned, b[1]));
                }
            }
        }

        List<int[]> candidates = new ArrayList<>();
        for (List<Integer> q : qualifying) {
            candidates.add(new int[]{q.get(0), q.get(1)});
        }

        List<TimeSlot> out = new ArrayList<>();
        for (int[] w : mergeIntervals(candidates)) {
            int start = ceilToGrid(Math.max(w[0], rangeStart), room.startMinutes());
            int end = Math.min(w[1], rangeEnd);
            if (end - start >= required) {
                out.add(TimeSlot.ofMinutes(start, end));
            }
        }
        return out;
    }

    private static List<int[]> mergeIntervals(List<int[]> intervals) {
        List<int[]> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.<int[]>comparingInt(i -> i[0]).thenComparingInt(i -> i[1]));

        List<int[]> out = new ArrayList<>();
        int[] current = null;
        for (int[] next : sorted) {
            if (current == null) {
                current = next.clone();
            } else if (next[0] <= current[1]) {
                current[1] = Math.max(current[1], next[1]);
            } else {
                out.add(current);
                current = next.clone();
            }
        }
        if (current != null) {
            out.add(current);
        }
        return out;
    }

    /**
     * Ближайший момент {@code >= minute}, минута которого внутри часа равна {@code offset}.
     */
    static int alignUp(int minute, int offset) {
        int candidate = (minute / 60) * 60 + offset;
        return candidate < minute ? candidate + 60 : candidate;
    }

    static int ceilToGrid(int minute, Set<Integer> grid) {
        int best = Integer.MAX_VALUE;
        for (int offset : grid) {
            best = Math.min(best, alignUp(minute, offset));
        }
        return best;
    }
}
