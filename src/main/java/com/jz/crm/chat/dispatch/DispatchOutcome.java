package com.jz.crm.chat.dispatch;

/** How one inbound message's unit of work ended. */
public enum DispatchOutcome {
    REPLIED,
    /** A newer message from the same customer took over. */
    SUPERSEDED,
    /** An operator owns the conversation; the bot stays silent. */
    OPERATOR_ENGAGED,
    DUPLICATE_SUPPRESSED,
    FAILED;

    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
