package lab.bank.ledger;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.util.Map;

public class TransferFailedException extends BankException {

    private final String reason;

    public TransferFailedException(String reason) {
        super(ErrorCode.TRANSFER_FAILED, "outbound transfer failed: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("reason", reason);
    }
}
