package lab.bank.common;

import java.util.Map;

public class InvalidRequestException extends BankException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    @Override
    public Map<String, Object> details() {
        return Map.of();
    }
}
