package lab.bank.admin;

import lab.bank.common.Addresses;
import lab.bank.domain.admin.BankAdministration;
import lab.bank.domain.admin.BankAdministrationRepository;
import lab.bank.event.OracleAddressUpdatedEvent;
import lab.bank.event.OwnerChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

// Owner and price-feed address; only the owner changes either.
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminRegistry {

    private final BankAdministrationRepository administrationRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public BankAdministration changeOwner(String caller, String newOwner) {
        BankAdministration administration = load();
        requireOwner(administration, caller);
        String normalizedNewOwner = Addresses.normalize(newOwner);

        String previousOwner = administration.getOwner();
        administration.changeOwner(normalizedNewOwner);
        BankAdministration saved = administrationRepository.save(administration);
        eventPublisher.publishEvent(new OwnerChangedEvent(previousOwner, normalizedNewOwner));
        log.info("event=admin.owner.changed previousOwner={} newOwner={}", previousOwner, normalizedNewOwner);
        return saved;
    }

    @Transactional
    public BankAdministration updateOracleAddress(String caller, String newAddress) {
        BankAdministration administration = load();
        requireOwner(administration, caller);
        String normalizedAddress = Addresses.normalizeEvm(newAddress);

        administration.repointOracle(normalizedAddress);
        BankAdministration saved = administrationRepository.save(administration);
        eventPublisher.publishEvent(new OracleAddressUpdatedEvent(normalizedAddress));
        log.info("event=admin.oracle.updated oracleAddress={}", normalizedAddress);
        return saved;
    }

    @Transactional(readOnly = true)
    public BankAdministration current() {
        return load();
    }

    @Transactional(readOnly = true)
    public String getOwner() {
        return load().getOwner();
    }

    @Transactional(readOnly = true)
    public String getOracleAddress() {
        return load().getOracleAddress();
    }

    private void requireOwner(BankAdministration administration, String caller) {
        String normalizedCaller = caller == null || caller.isBlank() ? "" : Addresses.normalize(caller);
        if (!administration.getOwner().equals(normalizedCaller)) {
            log.warn("event=admin.not_authorized caller={}", caller);
            throw new NotAuthorizedException(caller == null ? "" : caller);
        }
    }

    private BankAdministration load() {
        return administrationRepository.findById(BankAdministration.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("bank administration is not initialised"));
    }
}
