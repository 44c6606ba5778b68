package com.jz.crm.support;

import com.jz.crm.domain.entity.Customer;
import com.jz.crm.service.CustomerService;
import org.springframework.dao.DuplicateKeyException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class FakeCustomerService implements CustomerService {

    public final Map<Long, Customer> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public Customer findById(Long id) {
        return rows.get(id);
    }

    @Override
    public Customer findByAddress(String address) {
        return rows.values().stream().filter(c -> address.equals(c.getAddress())).findFirst().orElse(null);
    }

    /** Rejects a second row for the same address, like the unique key on the table. */
    @Override
    public synchronized void create(Customer customer) {
        if (findByAddress(customer.getAddress()) != null) {
            throw new DuplicateKeyException("Duplicate entry '" + customer.getAddress() + "' for key 'uk_customer_address'");
        }
        customer.setId(ids.incrementAndGet());
        rows.put(customer.getId(), customer);
    }

    @Override
    public void modify(Customer customer) {
        rows.put(customer.getId(), customer);
    }
}
