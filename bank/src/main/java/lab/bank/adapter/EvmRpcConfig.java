package lab.bank.adapter;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "rpc")
public class EvmRpcConfig {

    // Bounded timeouts: a withdrawal holds the ledger lock while its transfer is in flight.
    @Bean
    public OkHttpClient rpcHttpClient(
            @Value("${bank.evm.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${bank.evm.call-timeout-ms:15000}") long callTimeoutMs,
            @Value("${bank.evm.proxy.enabled:false}") boolean proxyEnabled,
            @Value("${bank.evm.proxy.host:}") String proxyHost,
            @Value("${bank.evm.proxy.port:8080}") int proxyPort,
            @Value("${bank.evm.proxy.username:}") String proxyUsername,
            @Value("${bank.evm.proxy.password:}") String proxyPassword) {
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .callTimeout(Duration.ofMillis(callTimeoutMs));

        if (!proxyEnabled) {
            return clientBuilder.build();
        }

        if (proxyHost == null || proxyHost.isBlank()) {
            throw new IllegalStateException("bank.evm.proxy.host must be configured when bank.evm.proxy.enabled=true");
        }

        clientBuilder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort)));
        if (proxyUsername != null && !proxyUsername.isBlank()) {
            clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                String credential = okhttp3.Credentials.basic(proxyUsername, proxyPassword == null ? "" : proxyPassword);
                Request request = response.request();
                return request.newBuilder()
                        .header("Proxy-Authorization", credential)
                        .build();
            });
        }
        return clientBuilder.build();
    }

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(@Value("${bank.evm.rpc-url}") String rpcUrl, OkHttpClient rpcHttpClient) {
        return Web3j.build(new HttpService(rpcUrl, rpcHttpClient, false));
    }
}
