package com.jz.crm.service;

import com.jz.crm.domain.entity.Customer;

public interface CustomerService {
    Customer findById(Long id);

    /** {@code null} when the address has never written in. */
    Customer findByAddress(String address);
    void create(Customer customer);
    void modify(Customer customer);
}
