package lab.bank.domain.history;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tx_history",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_history_slot", columnNames = {"accountAddress", "kind", "historyIndex"})
       },
       indexes = {
           @Index(name = "idx_history_account", columnList = "accountAddress")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TxHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String accountAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private TxHistoryKind kind;

    // Global deposit/withdrawal counter value, not a per-account sequence.
    @Column(nullable = false, updatable = false)
    private long historyIndex;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static TxHistoryEntry recorded(String accountAddress, TxHistoryKind kind, long historyIndex, BigInteger amount) {
        return TxHistoryEntry.builder()
                .accountAddress(accountAddress)
                .kind(kind)
                .historyIndex(historyIndex)
                .amount(amount)
                .createdAt(Instant.now())
                .build();
    }
}
