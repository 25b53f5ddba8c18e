package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderChangeEvent;
import io.dispatch.orders.domain.OrderChangeNotifier;
import io.dispatch.orders.domain.SequenceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs an order write in its own transaction and notifies only once that transaction has
 * committed. A notification is never attempted for a write that rolled back.
 */
@Component
public class OrderCommitter {

    private static final Logger log = LoggerFactory.getLogger(OrderCommitter.class);

    private final TransactionTemplate transactionTemplate;
    private final OrderChangeNotifier notifier;

    public OrderCommitter(PlatformTransactionManager transactionManager,
                          OrderChangeNotifier notifier) {
        Objects.requireNonNull(transactionManager, "transactionManager cannot be null");
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.notifier = Objects.requireNonNull(notifier, "notifier cannot be null");
    }

    /**
     * Executes {@code work} in a new transaction. Returns after commit. A request interrupted
     * before commit rolls back with {@link ErrorCode#REQUEST_CANCELLED}.
     */
    public Order commit(Supplier<Order> work) {
        try {
            return transactionTemplate.execute(status -> {
                var result = work.get();
                if (Thread.currentThread().isInterrupted()) {
                    throw new BusinessException(ErrorCode.REQUEST_CANCELLED);
                }
                return result;
            });
        } catch (BusinessException | SequenceConflictException e) {
            throw e;
        } catch (DataIntegrityViolationException e) {
            log.warn("Order write rejected by a constraint: {}", e.getMostSpecificCause().getMessage());
            throw new BusinessException(ErrorCode.CONSTRAINT_VIOLATION,
                ErrorCode.CONSTRAINT_VIOLATION.defaultMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Order write failed and was rolled back", e);
            throw new BusinessException(ErrorCode.PERSISTENCE_FAILURE,
                ErrorCode.PERSISTENCE_FAILURE.defaultMessage(), e);
        }
    }

    /** Hands a committed change to the notifier. Failures are logged, never propagated. */
    public void notifyCommitted(OrderChangeEvent event) {
        try {
            notifier.publish(event);
        } catch (RuntimeException e) {
            log.warn("Change notification failed for orderId={} type={}. Order is committed. Cause: {}",
                event.order().id(), event.type().wireValue(), e.getMessage());
        }
    }
}
