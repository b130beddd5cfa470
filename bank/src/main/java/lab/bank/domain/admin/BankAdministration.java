package lab.bank.domain.admin;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "bank_administration")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class BankAdministration {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false, length = 64)
    private String owner;

    @Column(nullable = false, length = 64)
    private String oracleAddress;

    @Column(nullable = false)
    private Instant updatedAt;

    public static BankAdministration created(String owner, String oracleAddress) {
        return BankAdministration.builder()
                .id(SINGLETON_ID)
                .owner(owner)
                .oracleAddress(oracleAddress)
                .updatedAt(Instant.now())
                .build();
    }

    public void changeOwner(String newOwner) {
        this.owner = newOwner;
        this.updatedAt = Instant.now();
    }

    public void repointOracle(String newOracleAddress) {
        this.oracleAddress = newOracleAddress;
        this.updatedAt = Instant.now();
    }
}
