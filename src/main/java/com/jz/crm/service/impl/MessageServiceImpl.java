package com.jz.crm.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.mapper.MessageMapper;
import com.jz.crm.service.MessageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
public class MessageServiceImpl extends ServiceImpl<MessageMapper, Message>
        implements MessageService {

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void create(Message message) {
        try {
            this.save(message);
        } catch (Exception e) {
            log.error("persist message failed, conversationId={}, role={}, err={}",
                    message.getConversationId(), message.getSenderRole(), e.getMessage(), e);
            throw e;
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void tagIntent(Long messageId, String intent) {
        this.lambdaUpdate()
                .eq(Message::getId, messageId)
                .set(Message::getIntent, intent)
                .update();
    }
}
