package com.jz.crm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.crm.domain.entity.Message;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface MessageMapper extends BaseMapper<Message> {
}
