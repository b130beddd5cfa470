package lab.bank;

import lab.bank.common.Addresses;
import lab.bank.domain.admin.BankAdministration;
import lab.bank.domain.admin.BankAdministrationRepository;
import lab.bank.domain.pool.CustodyPool;
import lab.bank.domain.pool.CustodyPoolRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;

// Limits are read from config only when the pool row is first created.
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class BankBootstrap implements ApplicationRunner {

    private final CustodyPoolRepository poolRepository;
    private final BankAdministrationRepository administrationRepository;
    private final TransactionTemplate transactionTemplate;
    private final BigInteger withdrawLimit;
    private final BigInteger bankCap;
    private final String ownerAddress;
    private final String oracleAddress;

    public BankBootstrap(
            CustodyPoolRepository poolRepository,
            BankAdministrationRepository administrationRepository,
            TransactionTemplate transactionTemplate,
            @Value("${bank.withdraw-limit-wei}") BigInteger withdrawLimit,
            @Value("${bank.cap-wei}") BigInteger bankCap,
            @Value("${bank.owner-address}") String ownerAddress,
            @Value("${bank.oracle.address}") String oracleAddress
    ) {
        if (withdrawLimit.signum() < 0 || bankCap.signum() < 0) {
            throw new IllegalStateException("bank.withdraw-limit-wei and bank.cap-wei must be non-negative");
        }
        this.poolRepository = poolRepository;
        this.administrationRepository = administrationRepository;
        this.transactionTemplate = transactionTemplate;
        this.withdrawLimit = withdrawLimit;
        this.bankCap = bankCap;
        this.ownerAddress = Addresses.normalize(ownerAddress);
        this.oracleAddress = Addresses.normalize(oracleAddress);
    }

    @Override
    public void run(ApplicationArguments args) {
        transactionTemplate.executeWithoutResult(status -> {
            initialisePool();
            initialiseAdministration();
        });
    }

    private void initialisePool() {
        poolRepository.findById(CustodyPool.SINGLETON_ID).ifPresentOrElse(
                existing -> {
                    if (existing.getWithdrawLimit().compareTo(withdrawLimit) != 0 || existing.getBankCap().compareTo(bankCap) != 0) {
                        log.warn(
                                "event=bootstrap.pool.config_ignored storedWithdrawLimitWei={} storedBankCapWei={} configuredWithdrawLimitWei={} configuredBankCapWei={}",
                                existing.getWithdrawLimit(),
                                existing.getBankCap(),
                                withdrawLimit,
                                bankCap
                        );
                    }
                },
                () -> {
                    poolRepository.save(CustodyPool.created(withdrawLimit, bankCap));
                    log.info("event=bootstrap.pool.created withdrawLimitWei={} bankCapWei={}", withdrawLimit, bankCap);
                }
        );
    }

    private void initialiseAdministration() {
        if (administrationRepository.existsById(BankAdministration.SINGLETON_ID)) {
            return;
        }
        administrationRepository.save(BankAdministration.created(ownerAddress, oracleAddress));
        log.info("event=bootstrap.administration.created owner={} oracleAddress={}", ownerAddress, oracleAddress);
    }
}
