package lab.bank.domain.pool;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CustodyPoolRepository extends JpaRepository<CustodyPool, Long> {
}
