package com.icodici.names.services;

import com.icodici.names.Address;
import com.icodici.names.Decimal;
import com.icodici.names.exception.NameServiceError;

/**
 * Value accounts of all parties and synchronous transfers between them.
 */
public interface Treasury {

    /**
     * Work performed inside a {@link #transaction(Transactional)}.
     */
    @FunctionalInterface
    interface Transactional<T> {
        T call() throws NameServiceError;
    }

    /**
     * Move value between accounts. Never throws: any failure, including the receiver rejecting the payment, is
     * reported as false and leaves balances untouched.
     *
     * @return true if the value was moved
     */
    boolean transfer(Address from, Address to, Decimal amount);

    Decimal balanceOf(Address account);

    /**
     * Perform the work in a transaction. If it throws, every transfer made inside it is rolled back and the exception
     * is rethrown; otherwise transfers stay and the work result is returned. Transactions of all callers are totally
     * ordered.
     *
     * @param work to execute
     *
     * @return what the work returns
     *
     * @throws NameServiceError whatever the work throws
     */
    <T> T transaction(Transactional<T> work) throws NameServiceError;
}
