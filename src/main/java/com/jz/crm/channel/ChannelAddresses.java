package com.jz.crm.channel;

/** Customer addresses are stored as bare digits, e.g. 5553999990000. */
public final class ChannelAddresses {

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private ChannelAddresses() {
    }

    /** "whatsapp:+55 53 99999-0000" -> "5553999990000"; {@code null} stays {@code null}. */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.regionMatches(true, 0, WHATSAPP_PREFIX, 0, WHATSAPP_PREFIX.length())) {
            s = s.substring(WHATSAPP_PREFIX.length());
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    public static String toWhatsapp(String address) {
        return WHATSAPP_PREFIX + "+" + normalize(address);
    }
}
