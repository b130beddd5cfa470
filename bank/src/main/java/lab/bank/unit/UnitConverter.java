package lab.bank.unit;

import lab.bank.common.InvalidRequestException;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

// Shrinking precision floors: fromMajorUnit(toMajorUnit(wei)) == wei only for whole ether.
public final class UnitConverter {

    public static final int ETHER_DECIMALS = 18;
    public static final BigInteger WEI_PER_ETHER = Convert.Unit.ETHER.getWeiFactor().toBigIntegerExact();

    private UnitConverter() {
    }

    public static BigInteger rescale(BigInteger amount, int fromDecimals, int toDecimals) {
        Objects.requireNonNull(amount, "amount");
        if (fromDecimals < 0 || toDecimals < 0) {
            throw new IllegalArgumentException("decimals must be non-negative: from=" + fromDecimals + ", to=" + toDecimals);
        }
        if (fromDecimals == toDecimals) {
            return amount;
        }
        if (fromDecimals > toDecimals) {
            return amount.divide(BigInteger.TEN.pow(fromDecimals - toDecimals));
        }
        return amount.multiply(BigInteger.TEN.pow(toDecimals - fromDecimals));
    }

    // Lossy: sub-ether remainder is discarded.
    public static BigInteger toMajorUnit(BigInteger amountWei) {
        Objects.requireNonNull(amountWei, "amountWei");
        return amountWei.divide(WEI_PER_ETHER);
    }

    public static BigInteger fromMajorUnit(BigInteger amountEther) {
        Objects.requireNonNull(amountEther, "amountEther");
        return amountEther.multiply(WEI_PER_ETHER);
    }

    // Convert a human-entered ETH decimal to wei; more than 18 fractional digits cannot be represented.
    public static BigInteger parseMajorUnit(BigDecimal amountEther) {
        if (amountEther == null) {
            throw new InvalidRequestException("amount is required");
        }
        if (amountEther.signum() < 0) {
            throw new InvalidRequestException("amount must not be negative: " + amountEther.toPlainString());
        }
        try {
            return Convert.toWei(amountEther, Convert.Unit.ETHER).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("invalid amount: must be a decimal with up to 18 fractional digits representing ETH");
        }
    }

    public static String formatMajorUnit(BigInteger amountWei) {
        Objects.requireNonNull(amountWei, "amountWei");
        return Convert.fromWei(new BigDecimal(amountWei), Convert.Unit.ETHER)
                .stripTrailingZeros()
                .toPlainString();
    }
}
