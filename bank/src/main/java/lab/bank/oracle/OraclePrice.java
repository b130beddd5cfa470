package lab.bank.oracle;

import java.math.BigInteger;
import java.time.Instant;

public record OraclePrice(
        BigInteger answer,
        int decimals,
        Instant updatedAt,
        BigInteger roundId
) {}
