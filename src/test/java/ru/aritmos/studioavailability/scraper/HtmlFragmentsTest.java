package ru.aritmos.studioavailability.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class HtmlFragmentsTest {

    @Test
    void attributesInAnyQuotingAreRead() {
        String attrs = " class=\"koma  koma_03_x\" colspan='2' data-time=10:00";

        assertEquals("koma  koma_03_x", HtmlFragments.attr(attrs, "class"));
        assertEquals("2", HtmlFragments.attr(attrs, "colspan"));
        assertEquals("10:00", HtmlFragments.attr(attrs, "data-time"));
        assertNull(HtmlFragments.attr(attrs, "time"));
    }

    @Test
    void elementsTextAndClassesAreExtracted() {
        List<HtmlFragments.Element> cells = HtmlFragments.elements(
                "<TR><TD class=\"a b\">x&nbsp;<b>y</b></TD><td>&amp;</td></TR>", "td");

        assertEquals(2, cells.size());
        assertEquals(Set.of("a", "b"), cells.get(0).classes());
        assertEquals("x y", cells.get(0).text());
        assertEquals("&", cells.get(1).text());
        assertEquals(Set.of(), cells.get(1).classes());
    }
}
