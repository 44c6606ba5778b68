package com.jz.crm.channel;

import com.jz.crm.domain.dto.SendResult;

/** Outbound text to a customer. Delivery problems are reported in the result, never thrown. */
public interface MessageSender {

    /** @param to canonical address, digits only */
    SendResult send(String to, String text);
}
