package lab.bank.common;

import lab.bank.ledger.ReentrancyDetectedException;
import lab.bank.oracle.OracleUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@Import(GlobalExceptionHandlerTest.TestConfig.class)
@AutoConfigureMockMvc
class GlobalExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runtimeExceptionMessageIsSanitized() throws Exception {
        mockMvc.perform(get("/test-error").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.path").value("/test-error"))
                .andExpect(jsonPath("$.message").value("Failed with secret 0x[REDACTED]"));
    }

    @Test
    void reentrancyMapsToConflict() throws Exception {
        mockMvc.perform(get("/test-error/reentrancy"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("REENTRANCY_DETECTED"))
                .andExpect(jsonPath("$.details.operation").value("withdraw"));
    }

    @Test
    void oracleOutageMapsToServiceUnavailable() throws Exception {
        mockMvc.perform(get("/test-error/oracle"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503))
                .andExpect(jsonPath("$.error").value("ORACLE_UNAVAILABLE"))
                .andExpect(jsonPath("$.details.reason").value("feed offline"));
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        TestErrorController testErrorController() {
            return new TestErrorController();
        }
    }

    @RestController
    static class TestErrorController {
        @GetMapping("/test-error")
        String error() {
            throw new IllegalStateException("Failed with secret 0x0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef");
        }

        @GetMapping("/test-error/reentrancy")
        String reentrancy() {
            throw new ReentrancyDetectedException("withdraw");
        }

        @GetMapping("/test-error/oracle")
        String oracle() {
            throw new OracleUnavailableException("0x694aa1769357215de4fac081bf1f309adc325306", "feed offline");
        }
    }
}
