package com.amumal.backend.global.transaction;

import java.util.function.Consumer;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 계정/자격증명 상태를 바꾸는 다중 문장 쓰기를 READ COMMITTED 원자 단위로 실행한다.
 *
 * <p>단위는 전부 반영되거나 전혀 반영되지 않는다. 코디네이터는 자신이 보고하는 커밋을 직접 소유해야 하므로
 * 이미 진행 중인 트랜잭션 안에서의 호출은 거부한다. 저장소 오류는 {@link ErrorCategory#CONFLICT} 또는
 * {@link ErrorCategory#IO_ERROR}로 변환되고, 단위가 던진 {@link ProblemException}은 그대로 전달된다.</p>
 */
@Component
public class TransactionalWriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransactionalWriteCoordinator.class);

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final EntityManager entityManager;

    public TransactionalWriteCoordinator(
            PlatformTransactionManager transactionManager,
            EntityManager entityManager,
            TransactionProperties properties
    ) {
        this.entityManager = entityManager;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.writeTemplate.setTimeout(properties.timeoutSeconds());

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(properties.timeoutSeconds());
    }

    public <T> T runAtomic(AtomicUnit<T> unit) {
        refuseNested();
        try {
            return execute(writeTemplate, unit, false);
        } catch (ProblemException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw translate(ex);
        }
    }

    public void runAtomicVoid(Consumer<TransactionScope> unit) {
        runAtomic(scope -> {
            unit.accept(scope);
            return null;
        });
    }

    /**
     * 읽기 전용 단위를 실행한다. 일시적인 데이터 접근 오류는 한 번 재시도한다.
     * 재시도해도 안전한 멱등 조회에만 사용한다.
     */
    public <T> T read(AtomicUnit<T> unit) {
        refuseNested();
        try {
            try {
                return execute(readTemplate, unit, true);
            } catch (TransientDataAccessException ex) {
                log.warn("Transient read failure, retrying once: {}", ex.getClass().getSimpleName());
                return execute(readTemplate, unit, true);
            }
        } catch (ProblemException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw translate(ex);
        }
    }

    private <T> T execute(TransactionTemplate template, AtomicUnit<T> unit, boolean readOnly) {
        return template.execute(status -> {
            TransactionScope scope = new TransactionScope(status, entityManager, readOnly);
            try {
                return unit.execute(scope);
            } finally {
                scope.close();
            }
        });
    }

    private void refuseNested() {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Atomic units must not run inside an existing transaction");
        }
    }

    RuntimeException translate(RuntimeException ex) {
        if (isTimeout(ex)) {
            log.warn("Atomic unit timed out and was rolled back");
            return new ProblemException(ErrorCategory.IO_ERROR, "storage_timeout", "요청 처리 시간이 초과되었습니다.", ex);
        }
        if (ex instanceof DataIntegrityViolationException
                || ex instanceof ConcurrencyFailureException
                || hasConstraintViolationCause(ex)) {
            log.info("Atomic unit rolled back on conflicting write: {}", ex.getClass().getSimpleName());
            return new ProblemException(ErrorCategory.CONFLICT, "conflict", "다른 요청과 충돌했습니다. 다시 시도해 주세요.", ex);
        }
        if (ex instanceof DataAccessException
                || ex instanceof TransactionException
                || ex instanceof PersistenceException) {
            log.error("Atomic unit failed on storage access", ex);
            return new ProblemException(ErrorCategory.IO_ERROR, "storage_unavailable", "저장소를 일시적으로 사용할 수 없습니다.", ex);
        }
        return ex;
    }

    private boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof TransactionTimedOutException
                    || current instanceof QueryTimeoutException
                    || current instanceof jakarta.persistence.QueryTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean hasConstraintViolationCause(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof org.hibernate.exception.ConstraintViolationException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
