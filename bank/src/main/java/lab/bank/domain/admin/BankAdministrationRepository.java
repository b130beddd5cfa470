package lab.bank.domain.admin;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BankAdministrationRepository extends JpaRepository<BankAdministration, Long> {
}
