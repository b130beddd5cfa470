package lab.bank.adapter;

import jakarta.annotation.PostConstruct;
import lab.bank.common.Addresses;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "rpc")
public class RpcModeStartupGuard {

    @Value("${bank.evm.chain-id}")
    private long chainId;

    @Value("${bank.evm.private-key:}")
    private String privateKey;

    @Value("${bank.evm.rpc-url:}")
    private String rpcUrl;

    @Value("${bank.oracle.address:}")
    private String oracleAddress;

    @PostConstruct
    void validate() {
        if (chainId == 1) {
            throw new IllegalStateException("Mainnet(chain-id=1) is not allowed in rpc mode");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("BANK_EVM_PRIVATE_KEY must be configured in rpc mode");
        }
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("BANK_EVM_RPC_URL must be configured in rpc mode");
        }
        if (!Addresses.isEvmAddress(oracleAddress == null ? null : oracleAddress.trim())) {
            throw new IllegalStateException("bank.oracle.address must be an EVM address in rpc mode: " + oracleAddress);
        }
    }
}
