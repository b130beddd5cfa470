package lab.bank.oracle;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.util.Map;

public class OracleUnavailableException extends BankException {

    private final String oracleAddress;
    private final String reason;

    public OracleUnavailableException(String oracleAddress, String reason) {
        super(ErrorCode.ORACLE_UNAVAILABLE, "price oracle unavailable: " + reason);
        this.oracleAddress = oracleAddress;
        this.reason = reason;
    }

    public OracleUnavailableException(String oracleAddress, String reason, Throwable cause) {
        super(ErrorCode.ORACLE_UNAVAILABLE, "price oracle unavailable: " + reason, cause);
        this.oracleAddress = oracleAddress;
        this.reason = reason;
    }

    public String getOracleAddress() {
        return oracleAddress;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("oracleAddress", oracleAddress == null ? "" : oracleAddress, "reason", reason);
    }
}
