package lab.bank.domain.account;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Account {

    @Id
    @Column(nullable = false, updatable = false, length = 64)
    private String address;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger balance; // wei

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static Account opened(String address) {
        Instant now = Instant.now();
        return Account.builder()
                .address(address)
                .balance(BigInteger.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void credit(BigInteger amount) {
        this.balance = this.balance.add(amount);
        this.updatedAt = Instant.now();
    }

    public void debit(BigInteger amount) {
        if (amount.compareTo(this.balance) > 0) {
            throw new IllegalStateException("debit exceeds balance: account=" + address + " amount=" + amount + " balance=" + balance);
        }
        this.balance = this.balance.subtract(amount);
        this.updatedAt = Instant.now();
    }
}
