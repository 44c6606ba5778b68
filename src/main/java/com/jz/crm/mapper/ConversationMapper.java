package com.jz.crm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.crm.domain.entity.Conversation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ConversationMapper extends BaseMapper<Conversation> {

    @Select("""
        SELECT * FROM conversation
          WHERE customer_id = #{customerId}
            AND status NOT IN ('resolved', 'closed')
          ORDER BY started_at DESC, id DESC
          LIMIT 1
    """)
    Conversation selectLatestActive(@Param("customerId") Long customerId);

    @Select("""
        SELECT * FROM conversation
          WHERE customer_id = #{customerId}
          ORDER BY started_at DESC, id DESC
          LIMIT 1
    """)
    Conversation selectLatest(@Param("customerId") Long customerId);
}
