package com.jz.crm.channel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ChannelAddressesTest {

    @ParameterizedTest
    @CsvSource({
            "whatsapp:+5553999990000, 5553999990000",
            "WhatsApp:+5553999990000, 5553999990000",
            "+55 53 99999-0000,       5553999990000",
            "5553999990000,           5553999990000"
    })
    void normalizesToDigits(String raw, String expected) {
        assertEquals(expected, ChannelAddresses.normalize(raw));
    }

    @Test
    void nullStaysNull() {
        assertNull(ChannelAddresses.normalize(null));
    }

    @Test
    void whatsappForm() {
        assertEquals("whatsapp:+5553999990000", ChannelAddresses.toWhatsapp("+5553999990000"));
    }
}
