package com.amumal.backend.global.transaction;

import jakarta.persistence.EntityManager;

import org.springframework.transaction.TransactionStatus;

/**
 * 진행 중인 원자 단위에 대한 핸들.
 * 쓰기 저장소 메서드는 이 핸들을 요구하며, 단위가 끝나면 핸들은 더 이상 사용할 수 없다.
 * 같은 핸들로 수행한 후속 조회는 같은 트랜잭션(같은 커넥션)에서 실행된다.
 */
public final class TransactionScope {

    private final TransactionStatus status;
    private final EntityManager entityManager;
    private final boolean readOnly;
    private boolean closed;

    TransactionScope(TransactionStatus status, EntityManager entityManager, boolean readOnly) {
        this.status = status;
        this.entityManager = entityManager;
        this.readOnly = readOnly;
    }

    public EntityManager entityManager() {
        ensureActive();
        return entityManager;
    }

    public void ensureActive() {
        if (closed || status.isCompleted()) {
            throw new IllegalStateException("Transaction scope is no longer active");
        }
    }

    public void ensureWritable() {
        ensureActive();
        if (readOnly) {
            throw new IllegalStateException("Write attempted through a read-only transaction scope");
        }
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * 현재 단위를 롤백 전용으로 표시한다. 단위가 정상 반환하더라도 커밋되지 않는다.
     */
    public void markRollbackOnly() {
        ensureActive();
        status.setRollbackOnly();
    }

    void close() {
        closed = true;
    }
}
