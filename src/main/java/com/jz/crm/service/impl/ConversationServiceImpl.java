package com.jz.crm.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;
import com.jz.crm.mapper.ConversationMapper;
import com.jz.crm.service.ConversationService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation>
        implements ConversationService {

    @Override
    public Conversation findById(Long id) {
        return this.getById(id);
    }

    @Override
    public Conversation findLatestActive(Long customerId) {
        return baseMapper.selectLatestActive(customerId);
    }

    @Override
    public Conversation findLatest(Long customerId) {
        return baseMapper.selectLatest(customerId);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void create(Conversation conversation) {
        this.save(conversation);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void modify(Conversation conversation) {
        this.updateById(conversation);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean applyRouting(Conversation conversation, ConversationStatus expected) {
        return this.lambdaUpdate()
                .eq(Conversation::getId, conversation.getId())
                .eq(Conversation::getStatus, expected)
                .set(Conversation::getStatus, conversation.getStatus())
                .set(Conversation::getSector, conversation.getSector())
                .set(Conversation::getIntent, conversation.getIntent())
                .update();
    }
}
