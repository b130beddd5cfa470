package lab.bank.oracle;

import java.math.BigInteger;

// Prices carry PRICE_DECIMALS implied decimals and may be negative.
public interface PriceOracleClient {

    int PRICE_DECIMALS = 8;

    BigInteger PRICE_SCALE = BigInteger.TEN.pow(PRICE_DECIMALS);

    OraclePrice latestPrice();

    default BigInteger getValueInQuoteCurrency(BigInteger amountWei) {
        return quote(amountWei, latestPrice());
    }

    // amountWei * price / 10^8; BigInteger division truncates toward zero.
    static BigInteger quote(BigInteger amountWei, OraclePrice price) {
        return amountWei.multiply(price.answer()).divide(PRICE_SCALE);
    }
}
