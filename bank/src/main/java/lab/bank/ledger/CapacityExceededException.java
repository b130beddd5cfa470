package lab.bank.ledger;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.math.BigInteger;
import java.util.Map;

public class CapacityExceededException extends BankException {

    private final BigInteger newTotal;
    private final BigInteger bankCap;

    public CapacityExceededException(BigInteger newTotal, BigInteger bankCap) {
        super(ErrorCode.CAPACITY_EXCEEDED, "deposit would exceed bank cap: newTotal=" + newTotal + ", bankCap=" + bankCap);
        this.newTotal = newTotal;
        this.bankCap = bankCap;
    }

    public BigInteger getNewTotal() {
        return newTotal;
    }

    public BigInteger getBankCap() {
        return bankCap;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("newTotal", newTotal.toString(), "bankCap", bankCap.toString());
    }
}
