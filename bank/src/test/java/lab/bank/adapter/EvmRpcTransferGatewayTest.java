package lab.bank.adapter;

import lab.bank.adapter.ValueTransferGateway.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;

import java.io.IOException;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvmRpcTransferGatewayTest {

    private static final long SEPOLIA = 11_155_111L;
    private static final String CUSTODY = "0x9999999999999999999999999999999999999999";
    private static final String RECIPIENT = "0x00000000000000000000000000000000000000a1";
    private static final String TX_HASH = "0x" + "ab".repeat(32);

    @Mock Web3j web3j;
    @Mock Signer signer;
    @Mock Request<?, EthChainId> chainIdRequest;
    @Mock Request<?, EthGetTransactionCount> nonceRequest;
    @Mock Request<?, EthSendTransaction> sendRequest;

    EvmRpcTransferGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new EvmRpcTransferGateway(
                web3j,
                SEPOLIA,
                signer,
                BigInteger.valueOf(2_000_000_000L),
                BigInteger.valueOf(20_000_000_000L)
        );
    }

    @Test
    void signsAndSubmitsEtherTransfer() throws Exception {
        connectedTo("0xaa36a7");
        pendingNonce("0x5");
        when(signer.signWithdrawal(any(), eq(SEPOLIA))).thenReturn("0xsigned");
        doReturn(sendRequest).when(web3j).ethSendRawTransaction("0xsigned");
        when(sendRequest.send()).thenReturn(sendResult(TX_HASH));

        TransferResult result = gateway.send(RECIPIENT, BigInteger.valueOf(800));

        assertThat(result.success()).isTrue();
        assertThat(result.reference()).isEqualTo(TX_HASH);

        ArgumentCaptor<RawTransaction> captor = ArgumentCaptor.forClass(RawTransaction.class);
        verify(signer).signWithdrawal(captor.capture(), eq(SEPOLIA));
        assertThat(captor.getValue().getTo()).isEqualTo(RECIPIENT);
        assertThat(captor.getValue().getValue()).isEqualTo(BigInteger.valueOf(800));
        assertThat(captor.getValue().getNonce()).isEqualTo(BigInteger.valueOf(5));
        assertThat(captor.getValue().getGasLimit()).isEqualTo(BigInteger.valueOf(21_000));
    }

    @Test
    void invalidRecipientFailsWithoutTouchingRpc() {
        TransferResult result = gateway.send("alice", BigInteger.ONE);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).contains("invalid EVM recipient address");
        verifyNoInteractions(web3j, signer);
    }

    @Test
    void chainIdMismatchFailsBeforeSigning() throws Exception {
        connectedTo("0x1");

        TransferResult result = gateway.send(RECIPIENT, BigInteger.ONE);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).contains("chain id mismatch");
        verifyNoInteractions(signer);
    }

    @Test
    void rejectedTransactionIsAFailureResult() throws Exception {
        connectedTo("0xaa36a7");
        pendingNonce("0x0");
        when(signer.signWithdrawal(any(), eq(SEPOLIA))).thenReturn("0xsigned");
        doReturn(sendRequest).when(web3j).ethSendRawTransaction(anyString());
        EthSendTransaction rejected = new EthSendTransaction();
        rejected.setError(new Response.Error(-32000, "insufficient funds for gas * price + value"));
        when(sendRequest.send()).thenReturn(rejected);

        TransferResult result = gateway.send(RECIPIENT, BigInteger.ONE);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).isEqualTo("EVM RPC rejected transaction: insufficient funds for gas * price + value");
    }

    @Test
    void transportErrorIsAFailureResult() throws Exception {
        doReturn(chainIdRequest).when(web3j).ethChainId();
        when(chainIdRequest.send()).thenThrow(new IOException("read timed out"));

        TransferResult result = gateway.send(RECIPIENT, BigInteger.ONE);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).isEqualTo("EVM RPC request failed: read timed out");
    }

    private void connectedTo(String chainIdHex) throws IOException {
        EthChainId chainId = new EthChainId();
        chainId.setResult(chainIdHex);
        doReturn(chainIdRequest).when(web3j).ethChainId();
        when(chainIdRequest.send()).thenReturn(chainId);
    }

    private void pendingNonce(String nonceHex) throws IOException {
        when(signer.custodyAddress()).thenReturn(CUSTODY);
        EthGetTransactionCount count = new EthGetTransactionCount();
        count.setResult(nonceHex);
        doReturn(nonceRequest).when(web3j).ethGetTransactionCount(eq(CUSTODY), any());
        when(nonceRequest.send()).thenReturn(count);
    }

    private static EthSendTransaction sendResult(String txHash) {
        EthSendTransaction sent = new EthSendTransaction();
        sent.setResult(txHash);
        return sent;
    }
}
