package com.amumal.backend.global.transaction;

/**
 * 하나의 트랜잭션 안에서 실행되는 작업 단위.
 */
@FunctionalInterface
public interface AtomicUnit<T> {

    T execute(TransactionScope scope);
}
