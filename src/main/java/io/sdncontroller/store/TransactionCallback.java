package io.sdncontroller.store;

import io.sdncontroller.exceptions.NetworkControllerException;

/**
 * Unit of work executed inside a record store transaction.
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction() throws NetworkControllerException;
}
