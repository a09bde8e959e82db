package ru.aritmos.studioavailability.scraper.padstudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.ScraperParseException;
import ru.aritmos.studioavailability.error.ScraperValidationException;
import ru.aritmos.studioavailability.model.TimeOfDay;
import ru.aritmos.studioavailability.scraper.HtmlFragments;
import ru.aritmos.studioavailability.scraper.HtmlFragments.Element;
import ru.aritmos.studioavailability.scraper.RawSlot;
import ru.aritmos.studioavailability.scraper.ScheduleParser;
import ru.aritmos.studioavailability.scraper.SlotState;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Разбор таблицы расписания страницы {@code member_select.php}.
 * <p>
 * Первая строка таблицы {@code table.table_base} содержит колонки {@code HH:MM~HH:MM} (ячейки {@code td.item_base}).
 * В строках комнат первая ячейка содержит название, последняя служебная; ячейка доступна,
 * если у неё класс {@code koma} (без {@code koma_01_x}/{@code koma_03_x}) и внутри есть чекбокс {@code c_v[]}.
 * Атрибут {@code colspan} сдвигает индекс колонки.
 */
public class PadStudioScheduleParser implements ScheduleParser {

    private static final Logger log = LoggerFactory.getLogger(PadStudioScheduleParser.class);

    private static final Set<String> BLOCKED_CLASSES = Set.of("koma_01_x", "koma_03_x");

    @Override
    public List<RawSlot> parse(String body, LocalDate date) {
        if (body == null || body.isBlank()) {
            throw new ScraperParseException("pad_studio: пустая страница расписания");
        }
        Element form = HtmlFragments.first(body, "form", "name", "form1");
        Element table = form == null ? null : HtmlFragments.first(form.inner(), "table", "class", "table_base");
        if (table == null) {
            // страница без формы бронирования: на дату нет расписания
            log.info("pad_studio: таблица расписания на {} не найдена", date);
            return List.of();
        }

        List<Element> rows = HtmlFragments.elements(table.inner(), "tr");
        if (rows.isEmpty()) {
            return List.of();
        }
        List<LocalTime[]> columns = headerColumns(rows.get(0));
        if (columns.isEmpty()) {
            throw new ScraperParseException("pad_studio: в заголовке таблицы нет колонок времени");
        }

        List<RawSlot> out = new ArrayList<>();
        for (Element row : rows.subList(1, rows.size())) {
            List<Element> cells = HtmlFragments.elements(row.inner(), "td");
            if (cells.isEmpty()) {
                continue;
            }
            String room = cells.get(0).text();
            if (room.isEmpty()) {
                continue;
            }
            int column = 0;
            for (Element cell : cells.subList(1, Math.max(1, cells.size() - 1))) {
                if (column >= columns.size()) {
                    break;
                }
                LocalTime[] col = columns.get(column);
                out.add(new RawSlot(room, col[0], col[1], isAvailable(cell) ? SlotState.AVAILABLE : SlotState.BOOKED));
                column += colspan(cell);
            }
        }
        return out;
    }

    static boolean isAvailable(Element cell) {
        Set<String> classes = cell.classes();
        if (!classes.contains("koma")) {
            return false;
        }
        for (String blocked : BLOCKED_CLASSES) {
            if (classes.contains(blocked)) {
                return false;
            }
        }
        for (String input : HtmlFragments.openTags(cell.inner(), "input")) {
            if ("checkbox".equalsIgnoreCase(HtmlFragments.attr(input, "type"))
                    && "c_v[]".equals(HtmlFragments.attr(input, "name"))) {
                return true;
            }
        }
        return false;
    }

    private static List<LocalTime[]> headerColumns(Element headerRow) {
        List<LocalTime[]> out = new ArrayList<>();
        for (Element cell : HtmlFragments.elements(headerRow.inner(), "td")) {
            if (!cell.classes().contains("item_base")) {
                continue;
            }
            String text = cell.text().replace('～', '~').replace(" ", "");
            int sep = text.indexOf('~');
            if (sep < 0) {
                continue;
            }
            try {
                out.add(new LocalTime[]{
                        TimeOfDay.parse(text.substring(0, sep), false),
                        TimeOfDay.parse(text.substring(sep + 1), true)
                });
            } catch (ScraperValidationException e) {
                throw new ScraperParseException("pad_studio: некорректная колонка времени '" + text + "'", e);
            }
        }
        return out;
    }

    private static int colspan(Element cell) {
        String v = cell.attr("colspan");
        if (v == null || v.isBlank()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(v.trim()));
        } catch (NumberFormatException e) {
            throw new ScraperParseException("pad_studio: некорректный colspan '" + v + "'", e);
        }
    }
}
