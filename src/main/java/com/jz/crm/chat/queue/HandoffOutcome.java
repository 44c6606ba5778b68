package com.jz.crm.chat.queue;

public enum HandoffOutcome {
    /** Was with the bot; now waiting in a sector queue. */
    ENQUEUED,
    /** Was already waiting; moved to a different sector queue. */
    MIGRATED,
    /** Already waiting in the requested sector. */
    UNCHANGED,
    /** Status does not allow a handoff (in progress, resolved, closed). */
    REJECTED
}
