package lab.bank.ledger;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.util.Map;

public class ReentrancyDetectedException extends BankException {

    private final String operation;

    public ReentrancyDetectedException(String operation) {
        super(ErrorCode.REENTRANCY_DETECTED, "reentrant call rejected: " + operation + " is already in progress");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("operation", operation);
    }
}
