package com.jz.crm.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.crm.domain.entity.Customer;
import com.jz.crm.mapper.CustomerMapper;
import com.jz.crm.service.CustomerService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CustomerServiceImpl extends ServiceImpl<CustomerMapper, Customer>
        implements CustomerService {

    @Override
    public Customer findById(Long id) {
        return this.getById(id);
    }

    @Override
    public Customer findByAddress(String address) {
        return this.lambdaQuery()
                .eq(Customer::getAddress, address)
                .last("limit 1")
                .one();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void create(Customer customer) {
        this.save(customer);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void modify(Customer customer) {
        this.updateById(customer);
    }
}
