package lab.bank.ledger;

import lab.bank.adapter.ValueTransferGateway;
import lab.bank.adapter.ValueTransferGateway.TransferResult;
import lab.bank.common.Addresses;
import lab.bank.common.InvalidRequestException;
import lab.bank.domain.account.Account;
import lab.bank.domain.account.AccountRepository;
import lab.bank.domain.history.TxHistoryEntry;
import lab.bank.domain.history.TxHistoryKind;
import lab.bank.domain.history.TxHistoryRepository;
import lab.bank.domain.pool.CustodyPool;
import lab.bank.domain.pool.CustodyPoolRepository;
import lab.bank.event.DepositedEvent;
import lab.bank.event.WithdrawnEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

// Mutations are serialized on one lock, each in a single transaction.
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AccountRepository accountRepository;
    private final CustodyPoolRepository poolRepository;
    private final TxHistoryRepository historyRepository;
    private final ValueTransferGateway transferGateway;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;

    static final String NESTED_FAILURE_REASON = "nested ledger operation failed during transfer";

    private final ReentrantLock ledgerLock = new ReentrantLock();
    private final ReentrancyGuard withdrawGuard = new ReentrancyGuard("withdraw");

    // Zero is a valid amount: it still counts as a deposit and writes a zero history entry.
    public LedgerReceipt deposit(String caller, BigInteger amount) {
        String account = Addresses.normalize(caller);
        requireNonNegative(amount);
        log.info("event=ledger.deposit.start account={} amountWei={}", account, amount);

        ledgerLock.lock();
        try {
            LedgerReceipt receipt = transactionTemplate.execute(status -> applyDeposit(account, amount));
            if (receipt == null) {
                throw new IllegalStateException("deposit produced no receipt");
            }
            log.info(
                    "event=ledger.deposit.done account={} amountWei={} newBalanceWei={} historyIndex={} totalBalanceWei={}",
                    account,
                    amount,
                    receipt.newBalance(),
                    receipt.historyIndex(),
                    receipt.totalBalance()
            );
            return receipt;
        } finally {
            ledgerLock.unlock();
        }
    }

    // Value arriving without an operation selector is booked as a deposit from the sender.
    public LedgerReceipt receive(String sender, BigInteger amount) {
        log.info("event=ledger.receive sender={} amountWei={}", sender, amount);
        return deposit(sender, amount);
    }

    public LedgerReceipt withdraw(String caller, BigInteger amount) {
        String account = Addresses.normalize(caller);
        requireNonNegative(amount);
        log.info("event=ledger.withdraw.start account={} amountWei={}", account, amount);

        ledgerLock.lock();
        try (ReentrancyGuard.Permit permit = withdrawGuard.enter()) {
            LedgerReceipt receipt = transactionTemplate.execute(status -> applyWithdrawal(account, amount, status));
            if (receipt == null) {
                throw new IllegalStateException("withdrawal produced no receipt");
            }
            log.info(
                    "event=ledger.withdraw.done account={} amountWei={} newBalanceWei={} historyIndex={} transferRef={}",
                    account,
                    amount,
                    receipt.newBalance(),
                    receipt.historyIndex(),
                    receipt.transferReference()
            );
            return receipt;
        } catch (ReentrancyDetectedException e) {
            log.warn("event=ledger.withdraw.reentrancy_rejected account={} amountWei={}", account, amount);
            throw e;
        } finally {
            ledgerLock.unlock();
        }
    }

    @Transactional(readOnly = true)
    public BigInteger getBalance(String address) {
        return accountRepository.findById(Addresses.normalize(address))
                .map(Account::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Transactional(readOnly = true)
    public PoolSnapshot getPoolSnapshot() {
        return PoolSnapshot.of(loadPool());
    }

    @Transactional(readOnly = true)
    public List<TxHistoryEntry> getHistory(String address) {
        return historyRepository.findByAccountAddressOrderByKindAscHistoryIndexAsc(Addresses.normalize(address));
    }

    private LedgerReceipt applyDeposit(String account, BigInteger amount) {
        CustodyPool pool = loadPool();
        BigInteger newTotal = pool.getTotalBalance().add(amount);
        if (newTotal.compareTo(pool.getBankCap()) > 0) {
            log.warn("event=ledger.deposit.capacity_exceeded account={} newTotalWei={} bankCapWei={}", account, newTotal, pool.getBankCap());
            throw new CapacityExceededException(newTotal, pool.getBankCap());
        }

        Account holder = accountRepository.findById(account).orElseGet(() -> Account.opened(account));
        holder.credit(amount);
        long historyIndex = pool.recordDeposit(amount);

        accountRepository.save(holder);
        poolRepository.save(pool);
        historyRepository.save(TxHistoryEntry.recorded(account, TxHistoryKind.DEPOSIT, historyIndex, amount));

        eventPublisher.publishEvent(new DepositedEvent(account, amount, holder.getBalance()));
        return new LedgerReceipt(account, TxHistoryKind.DEPOSIT, amount, holder.getBalance(), historyIndex, pool.getTotalBalance(), null);
    }

    private LedgerReceipt applyWithdrawal(String account, BigInteger amount, TransactionStatus status) {
        CustodyPool pool = loadPool();
        if (amount.compareTo(pool.getWithdrawLimit()) > 0) {
            log.warn("event=ledger.withdraw.limit_exceeded account={} amountWei={} withdrawLimitWei={}", account, amount, pool.getWithdrawLimit());
            throw new LimitExceededException(amount, pool.getWithdrawLimit());
        }

        Account holder = accountRepository.findById(account).orElseGet(() -> Account.opened(account));
        if (amount.compareTo(holder.getBalance()) > 0) {
            log.warn("event=ledger.withdraw.insufficient_funds account={} amountWei={} balanceWei={}", account, amount, holder.getBalance());
            throw new InsufficientFundsException(account, amount, holder.getBalance());
        }

        // Effects are flushed before the transfer; the transfer is the last step of the transaction.
        holder.debit(amount);
        long historyIndex = pool.recordWithdrawal(amount);
        accountRepository.save(holder);
        poolRepository.save(pool);
        historyRepository.saveAndFlush(TxHistoryEntry.recorded(account, TxHistoryKind.WITHDRAWAL, historyIndex, amount));

        TransferResult result = transferGateway.send(account, amount);
        if (!result.success()) {
            log.warn("event=ledger.withdraw.transfer_failed account={} amountWei={} reason={}", account, amount, result.reason());
            throw new TransferFailedException(result.reason());
        }
        // A ledger call made by the receiver joins this transaction; if it failed, nothing here can commit.
        if (status.isRollbackOnly()) {
            log.warn("event=ledger.withdraw.nested_failure account={} amountWei={} transferRef={}", account, amount, result.reference());
            throw new TransferFailedException(NESTED_FAILURE_REASON);
        }

        eventPublisher.publishEvent(new WithdrawnEvent(account, amount, holder.getBalance(), result.reference()));
        return new LedgerReceipt(account, TxHistoryKind.WITHDRAWAL, amount, holder.getBalance(), historyIndex, pool.getTotalBalance(), result.reference());
    }

    private CustodyPool loadPool() {
        return poolRepository.findById(CustodyPool.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("custody pool is not initialised"));
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null) {
            throw new InvalidRequestException("amount is required");
        }
        if (amount.signum() < 0) {
            throw new InvalidRequestException("amount must not be negative: " + amount);
        }
    }
}
