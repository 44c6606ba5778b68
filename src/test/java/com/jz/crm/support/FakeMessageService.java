package com.jz.crm.support;

import com.jz.crm.domain.entity.Message;
import com.jz.crm.domain.entity.SenderRole;
import com.jz.crm.service.MessageService;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class FakeMessageService implements MessageService {

    public final List<Message> rows = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public void create(Message message) {
        message.setId(ids.incrementAndGet());
        rows.add(message);
    }

    @Override
    public void tagIntent(Long messageId, String intent) {
        rows.stream().filter(m -> m.getId().equals(messageId)).forEach(m -> m.setIntent(intent));
    }

    public List<Message> byRole(SenderRole role) {
        return rows.stream().filter(m -> m.getSenderRole() == role).collect(Collectors.toList());
    }
}
