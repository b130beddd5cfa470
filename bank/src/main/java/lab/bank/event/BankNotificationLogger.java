package lab.bank.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
public class BankNotificationLogger {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDeposited(DepositedEvent event) {
        log.info("event=notification.deposited account={} amountWei={} newBalanceWei={}",
                event.account(), event.amount(), event.newBalance());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onWithdrawn(WithdrawnEvent event) {
        log.info("event=notification.withdrawn account={} amountWei={} newBalanceWei={} transferRef={}",
                event.account(), event.amount(), event.newBalance(), event.transferReference());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOwnerChanged(OwnerChangedEvent event) {
        log.info("event=notification.owner_changed previousOwner={} newOwner={}", event.previousOwner(), event.newOwner());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOracleAddressUpdated(OracleAddressUpdatedEvent event) {
        log.info("event=notification.oracle_updated oracleAddress={}", event.oracleAddress());
    }
}
