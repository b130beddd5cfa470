package lab.bank.adapter;

import lab.bank.common.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

// In-process gateway used when no chain is configured. Outcomes can be scripted per recipient.
@Component
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class MockTransferGateway implements ValueTransferGateway {

    private final Map<String, String> scriptedFailures = new ConcurrentHashMap<>();
    private final AtomicReference<Consumer<String>> nextReceiverHook = new AtomicReference<>();
    private final List<SentTransfer> sentTransfers = new CopyOnWriteArrayList<>();

    public void failNextTransferTo(String to, String reason) {
        scriptedFailures.put(Addresses.normalize(to), reason);
    }

    // Runs on the sending thread during the next send, before the transfer is reported.
    public void onNextTransfer(Consumer<String> receiverHook) {
        nextReceiverHook.set(receiverHook);
    }

    public List<SentTransfer> sentTransfers() {
        return List.copyOf(sentTransfers);
    }

    public void reset() {
        scriptedFailures.clear();
        nextReceiverHook.set(null);
        sentTransfers.clear();
    }

    @Override
    public TransferResult send(String to, BigInteger amountWei) {
        String recipient = Addresses.normalize(to);
        String scripted = scriptedFailures.remove(recipient);
        if (scripted != null) {
            log.info("event=mock_gateway.send.scripted_failure to={} amountWei={} reason={}", recipient, amountWei, scripted);
            return TransferResult.failed(scripted);
        }

        Consumer<String> hook = nextReceiverHook.getAndSet(null);
        if (hook != null) {
            try {
                hook.accept(recipient);
            } catch (RuntimeException e) {
                log.warn("event=mock_gateway.send.receiver_reverted to={} amountWei={} error={}", recipient, amountWei, e.toString());
                return TransferResult.failed("receiver reverted: " + e.getMessage());
            }
        }

        String txHash = "0xMOCK_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        recordWhenCommitted(new SentTransfer(recipient, amountWei, txHash));
        log.info("event=mock_gateway.send.success to={} amountWei={} txHash={}", recipient, amountWei, txHash);
        return TransferResult.succeeded(txHash);
    }

    // Inside a ledger transaction the transfer only counts as sent once that transaction commits.
    private void recordWhenCommitted(SentTransfer transfer) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            sentTransfers.add(transfer);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                sentTransfers.add(transfer);
            }

            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    log.info("event=mock_gateway.send.discarded to={} amountWei={} txHash={}", transfer.to(), transfer.amountWei(), transfer.txHash());
                }
            }
        });
    }

    public record SentTransfer(
            String to,
            BigInteger amountWei,
            String txHash
    ) {}
}
