package ru.aritmos.studioavailability.scraper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Минимальные средства разбора HTML регулярными выражениями.
 * <p>
 * Рассчитано на табличную разметку страниц бронирования: без вложенных таблиц внутри ячеек.
 */
public final class HtmlFragments {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private HtmlFragments() {
    }

    /**
     * Элемент разметки: атрибуты открывающего тега и внутреннее содержимое.
     */
    public record Element(String attributes, String inner) {

        public String attr(String name) {
            return HtmlFragments.attr(attributes, name);
        }

        public Set<String> classes() {
            String c = attr("class");
            if (c == null || c.isBlank()) {
                return Set.of();
            }
            return Arrays.stream(SPACES.split(c.trim())).collect(Collectors.toSet());
        }

        public String text() {
            return HtmlFragments.text(inner);
        }
    }

    /**
     * Все элементы {@code tag} верхнего уровня внутри фрагмента в порядке появления.
     */
    public static List<Element> elements(String html, String tag) {
        List<Element> out = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return out;
        }
        Matcher m = elementPattern(tag).matcher(html);
        while (m.find()) {
            out.add(new Element(m.group(1), m.group(2)));
        }
        return out;
    }

    /**
     * Строки атрибутов всех открывающих тегов {@code tag} (в том числе пустых элементов вроде {@code input}).
     */
    public static List<String> openTags(String html, String tag) {
        List<String> out = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return out;
        }
        Matcher m = Pattern.compile("<" + Pattern.quote(tag) + "\\b([^>]*)>", Pattern.CASE_INSENSITIVE).matcher(html);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }

    /**
     * Первый элемент {@code tag}, у которого атрибут {@code attrName} содержит токен {@code attrToken}.
     */
    public static Element first(String html, String tag, String attrName, String attrToken) {
        for (Element e : elements(html, tag)) {
            String v = e.attr(attrName);
            if (v != null && Arrays.asList(SPACES.split(v.trim())).contains(attrToken)) {
                return e;
            }
        }
        return null;
    }

    /**
     * Значение атрибута из строки атрибутов тега (в двойных или одинарных кавычках) или null.
     */
    public static String attr(String attributes, String name) {
        if (attributes == null) {
            return null;
        }
        Matcher m = Pattern.compile("(?i)(?:^|\\s)" + Pattern.quote(name) + "\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))")
                .matcher(attributes);
        if (!m.find()) {
            return null;
        }
        if (m.group(1) != null) {
            return m.group(1);
        }
        return m.group(2) != null ? m.group(2) : m.group(3);
    }

    /**
     * Текст фрагмента без тегов; пробелы схлопываются, основные сущности раскрываются.
     */
    public static String text(String html) {
        if (html == null) {
            return "";
        }
        String t = TAG.matcher(html).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
        return SPACES.matcher(t).replaceAll(" ").trim();
    }

    private static Pattern elementPattern(String tag) {
        String t = Pattern.quote(tag.toLowerCase(Locale.ROOT));
        return Pattern.compile("<" + t + "\\b([^>]*)>(.*?)</" + t + "\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
