package lab.bank.oracle;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;

@Component
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class FixedPriceOracleClient implements PriceOracleClient {

    private final BigInteger price;

    public FixedPriceOracleClient(@Value("${bank.oracle.fixed-price:200000000000}") BigInteger price) {
        this.price = price;
    }

    @Override
    public OraclePrice latestPrice() {
        return new OraclePrice(price, PRICE_DECIMALS, Instant.now(), BigInteger.ZERO);
    }
}
