package lab.bank.domain.history;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TxHistoryRepository extends JpaRepository<TxHistoryEntry, UUID> {

    List<TxHistoryEntry> findByAccountAddressOrderByKindAscHistoryIndexAsc(String accountAddress);
}
