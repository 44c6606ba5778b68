package com.jz.crm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.crm.domain.entity.Customer;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface CustomerMapper extends BaseMapper<Customer> {
}
