package lab.bank.admin;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.util.Map;

public class NotAuthorizedException extends BankException {

    private final String caller;

    public NotAuthorizedException(String caller) {
        super(ErrorCode.NOT_AUTHORIZED, "caller is not the bank owner: " + caller);
        this.caller = caller;
    }

    public String getCaller() {
        return caller;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("caller", caller);
    }
}
