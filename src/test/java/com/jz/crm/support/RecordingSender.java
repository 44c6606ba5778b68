package com.jz.crm.support;

import com.jz.crm.channel.MessageSender;
import com.jz.crm.domain.dto.SendResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingSender implements MessageSender {

    public record Sent(String to, String text) {}

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public volatile SendResult next = SendResult.sent("SM123", "queued");
    public volatile RuntimeException failWith;
    public volatile Runnable during;

    @Override
    public SendResult send(String to, String text) {
        if (during != null) during.run();
        if (failWith != null) throw failWith;
        sent.add(new Sent(to, text));
        return next;
    }
}
