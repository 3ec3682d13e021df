package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.Decimal;

/**
 * Code run by an account when it receives value, before the transfer completes. It may call anything, including the
 * component that pays; returning false (or throwing) rejects the payment.
 */
@FunctionalInterface
public interface ReceiveHook {
    boolean onReceive(Address from, Decimal amount);
}
