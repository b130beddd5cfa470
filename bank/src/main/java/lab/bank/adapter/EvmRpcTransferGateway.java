package lab.bank.adapter;

import lab.bank.common.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.exceptions.ClientConnectionException;

import java.io.IOException;
import java.math.BigInteger;

// Success means the node accepted the transaction; inclusion is not awaited.
@Component
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class EvmRpcTransferGateway implements ValueTransferGateway {

    private static final BigInteger GAS_LIMIT = BigInteger.valueOf(21_000);

    private final Web3j web3j;
    private final long configuredChainId;
    private final Signer signer;
    private final BigInteger maxPriorityFeePerGas;
    private final BigInteger maxFeePerGas;

    public EvmRpcTransferGateway(
            Web3j web3j,
            @Value("${bank.evm.chain-id}") long configuredChainId,
            Signer signer,
            @Value("${bank.evm.max-priority-fee-per-gas-wei:2000000000}") BigInteger maxPriorityFeePerGas,
            @Value("${bank.evm.max-fee-per-gas-wei:20000000000}") BigInteger maxFeePerGas
    ) {
        this.web3j = web3j;
        this.configuredChainId = configuredChainId;
        this.signer = signer;
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
        this.maxFeePerGas = maxFeePerGas;
    }

    @Override
    public TransferResult send(String to, BigInteger amountWei) {
        if (!Addresses.isEvmAddress(to)) {
            return TransferResult.failed("invalid EVM recipient address: " + to);
        }

        try {
            ensureConnectedChainIdMatchesConfigured();

            BigInteger nonce = getPendingNonce(signer.custodyAddress());
            RawTransaction rawTransaction = RawTransaction.createEtherTransaction(
                    configuredChainId,
                    nonce,
                    GAS_LIMIT,
                    to,
                    amountWei,
                    maxPriorityFeePerGas,
                    maxFeePerGas
            );
            String signedTxHex = signer.signWithdrawal(rawTransaction, configuredChainId);

            EthSendTransaction sent = web3j.ethSendRawTransaction(signedTxHex).send();
            if (sent.hasError()) {
                log.warn("event=evm_gateway.send.rejected to={} amountWei={} nonce={} error={}", to, amountWei, nonce, sent.getError().getMessage());
                return TransferResult.failed("EVM RPC rejected transaction: " + sent.getError().getMessage());
            }

            String txHash = sent.getTransactionHash();
            if (txHash == null || txHash.isBlank()) {
                return TransferResult.failed("RPC returned an empty tx hash");
            }

            log.info("event=evm_gateway.send.accepted to={} amountWei={} nonce={} txHash={}", to, amountWei, nonce, txHash);
            return TransferResult.succeeded(txHash);
        } catch (IOException e) {
            log.warn("event=evm_gateway.send.io_error to={} amountWei={} error={}", to, amountWei, e.toString());
            return TransferResult.failed("EVM RPC request failed: " + e.getMessage());
        } catch (IllegalStateException | ClientConnectionException e) {
            log.warn("event=evm_gateway.send.precondition_failed to={} amountWei={} error={}", to, amountWei, e.getMessage());
            return TransferResult.failed(e.getMessage());
        }
    }

    // Refuse to sign for a chain other than the configured one.
    private void ensureConnectedChainIdMatchesConfigured() throws IOException {
        EthChainId chainIdResponse = web3j.ethChainId().send();
        if (chainIdResponse.hasError()) {
            throw new IllegalStateException("Failed to verify chain id from RPC: " + chainIdResponse.getError().getMessage());
        }
        long remoteChainId = chainIdResponse.getChainId().longValue();
        if (remoteChainId != configuredChainId) {
            throw new IllegalStateException("Connected RPC chain id mismatch. expected=" + configuredChainId + ", actual=" + remoteChainId);
        }
    }

    private BigInteger getPendingNonce(String address) throws IOException {
        EthGetTransactionCount txCountResponse = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
        if (txCountResponse.hasError()) {
            throw new IllegalStateException("Failed to fetch nonce from RPC: " + txCountResponse.getError().getMessage());
        }
        return txCountResponse.getTransactionCount();
    }
}
