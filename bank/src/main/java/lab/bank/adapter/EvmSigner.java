package lab.bank.adapter;

import lab.bank.common.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.util.Locale;

@Component
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class EvmSigner implements Signer {

    private final Credentials custodyKey;

    public EvmSigner(
            @Value("${bank.evm.private-key:}") String privateKey,
            @Value("${bank.evm.custody-address:}") String expectedCustodyAddress
    ) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("bank.evm.private-key must be configured when bank.chain.mode=rpc");
        }
        this.custodyKey = Credentials.create(privateKey.trim());

        // An empty custody address skips the check.
        if (expectedCustodyAddress != null && !expectedCustodyAddress.isBlank()) {
            String expected = Addresses.normalizeEvm(expectedCustodyAddress);
            if (!expected.equals(custodyAddress())) {
                throw new IllegalStateException(
                        "bank.evm.private-key does not control the custody wallet: expected=" + expected + ", actual=" + custodyAddress());
            }
        }
        log.info("event=evm_signer.loaded custodyAddress={}", custodyAddress());
    }

    @Override
    public String signWithdrawal(RawTransaction withdrawal, long chainId) {
        if (withdrawal.getData() != null && !withdrawal.getData().isEmpty() && !"0x".equals(withdrawal.getData())) {
            throw new IllegalStateException("custody wallet only signs plain ether withdrawals");
        }
        byte[] signed = TransactionEncoder.signMessage(withdrawal, chainId, custodyKey);
        log.debug("event=evm_signer.signed to={} valueWei={} nonce={}", withdrawal.getTo(), withdrawal.getValue(), withdrawal.getNonce());
        return Numeric.toHexString(signed);
    }

    @Override
    public String custodyAddress() {
        return custodyKey.getAddress().toLowerCase(Locale.ROOT);
    }
}
