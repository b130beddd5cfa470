package lab.bank.domain.pool;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "custody_pool")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class CustodyPool {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalBalance;

    @Column(nullable = false)
    private long depositCount;

    @Column(nullable = false)
    private long withdrawalCount;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger withdrawLimit;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger bankCap;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static CustodyPool created(BigInteger withdrawLimit, BigInteger bankCap) {
        return CustodyPool.builder()
                .id(SINGLETON_ID)
                .totalBalance(BigInteger.ZERO)
                .depositCount(0)
                .withdrawalCount(0)
                .withdrawLimit(withdrawLimit)
                .bankCap(bankCap)
                .createdAt(Instant.now())
                .build();
    }

    // Returns the deposit counter after increment; it doubles as the history index of this deposit.
    public long recordDeposit(BigInteger amount) {
        this.totalBalance = this.totalBalance.add(amount);
        this.depositCount++;
        return this.depositCount;
    }

    public long recordWithdrawal(BigInteger amount) {
        if (amount.compareTo(this.totalBalance) > 0) {
            throw new IllegalStateException("withdrawal exceeds custody total: amount=" + amount + " total=" + totalBalance);
        }
        this.totalBalance = this.totalBalance.subtract(amount);
        this.withdrawalCount++;
        return this.withdrawalCount;
    }
}
