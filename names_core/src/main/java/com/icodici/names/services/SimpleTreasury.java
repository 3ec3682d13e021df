package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.exception.NameServiceError;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link Treasury}. One lock orders all transfers and transactions; a transaction started inside another
 * one on the same thread is nested and rolls back only its own part when it fails.
 */
public class SimpleTreasury implements Treasury {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Address, Decimal> balances = new HashMap<>();
    private final Map<Address, ReceiveHook> hooks = new ConcurrentHashMap<>();

    /**
     * Credit an account from outside of the system.
     */
    public void deposit(Address account, Decimal amount) {
        if (amount.isNegative())
            throw new IllegalArgumentException("can't deposit negative amount");
        lock.lock();
        try {
            balances.merge(account, amount, Decimal::add);
        } finally {
            lock.unlock();
        }
    }

    public void setReceiveHook(Address account, ReceiveHook hook) {
        if (hook == null)
            hooks.remove(account);
        else
            hooks.put(account, hook);
    }

    @Override
    public Decimal balanceOf(Address account) {
        lock.lock();
        try {
            return balances.getOrDefault(account, Decimal.ZERO);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean transfer(Address from, Address to, Decimal amount) {
        if (from == null || to == null || amount == null || amount.isNegative())
            return false;
        lock.lock();
        try {
            if (balanceOf(from).compareTo(amount) < 0)
                return false;
            Map<Address, Decimal> savepoint = new HashMap<>(balances);
            balances.put(from, balanceOf(from).subtract(amount));
            balances.merge(to, amount, Decimal::add);
            ReceiveHook hook = hooks.get(to);
            boolean accepted;
            try {
                accepted = hook == null || hook.onReceive(from, amount);
            } catch (RuntimeException e) {
                // a failing receiver refuses the payment
                accepted = false;
            }
            if (!accepted)
                restore(savepoint);
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T transaction(Transactional<T> work) throws NameServiceError {
        lock.lock();
        try {
            Map<Address, Decimal> savepoint = new HashMap<>(balances);
            try {
                return work.call();
            } catch (NameServiceError | RuntimeException e) {
                restore(savepoint);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private void restore(Map<Address, Decimal> savepoint) {
        balances.clear();
        balances.putAll(savepoint);
    }
}
