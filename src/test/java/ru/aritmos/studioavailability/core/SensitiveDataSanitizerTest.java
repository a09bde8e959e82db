package ru.aritmos.studioavailability.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class SensitiveDataSanitizerTest {

    @Test
    void sessionHeadersAreMasked() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Cookie", "PHPSESSID=abc");
        headers.put("X-CSRF-TOKEN", "csrf-abc");
        headers.put("X-Requested-With", "XMLHttpRequest");

        Map<String, String> out = SensitiveDataSanitizer.sanitizeHeaders(headers);

        assertEquals("***", out.get("Cookie"));
        assertEquals("***", out.get("X-CSRF-TOKEN"));
        assertEquals("XMLHttpRequest", out.get("X-Requested-With"));
    }

    @Test
    void tokensInTextAreMasked() {
        String text = SensitiveDataSanitizer.sanitizeText("POST /get_schedule_shop?_token=abc&shop_id=673\nPHPSESSID=xyz; Bearer t0k");

        assertFalse(text.contains("abc"));
        assertFalse(text.contains("xyz"));
        assertFalse(text.contains("t0k"));
        assertFalse(text.contains("\n"));
        assertEquals("POST /get_schedule_shop?_token=***&shop_id=673 PHPSESSID=***; Bearer ***", text);
    }

    @Test
    void nullPassesThrough() {
        assertNull(SensitiveDataSanitizer.sanitizeText(null));
        assertEquals(Map.of(), SensitiveDataSanitizer.sanitizeHeaders(null));
    }
}
