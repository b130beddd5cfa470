package lab.bank.admin;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "bank.owner-address=0x1111111111111111111111111111111111111111",
        "bank.oracle.address=0x694AA1769357215DE4FAC081bf1f309aDC325306"
})
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class AdminControllerIntegrationTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";
    private static final String SUCCESSOR = "0x2222222222222222222222222222222222222222";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AdminRegistry adminRegistry;

    @Test
    void getAdmin_returnsConfiguredOwnerAndOracle() throws Exception {
        mockMvc.perform(get("/admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value(OWNER))
                .andExpect(jsonPath("$.oracleAddress").value("0x694aa1769357215de4fac081bf1f309adc325306"));
    }

    @Test
    void nonOwner_isForbidden() throws Exception {
        mockMvc.perform(put("/admin/owner")
                        .header("X-Caller-Address", SUCCESSOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newOwner\":\"" + SUCCESSOR + "\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value(403))
                .andExpect(jsonPath("$.error").value("NOT_AUTHORIZED"))
                .andExpect(jsonPath("$.details.caller").value(SUCCESSOR));
    }

    @Test
    void ownerChange_transfersAuthority() throws Exception {
        mockMvc.perform(put("/admin/owner")
                        .header("X-Caller-Address", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newOwner\":\"" + SUCCESSOR + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value(SUCCESSOR));
        assertThat(adminRegistry.getOwner()).isEqualTo(SUCCESSOR);

        mockMvc.perform(put("/admin/oracle")
                        .header("X-Caller-Address", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"oracleAddress\":\"0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_AUTHORIZED"));

        mockMvc.perform(put("/admin/oracle")
                        .header("X-Caller-Address", SUCCESSOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"oracleAddress\":\"0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.oracleAddress").value("0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419"));
        assertThat(adminRegistry.getOracleAddress()).isEqualTo("0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419");
    }

    @Test
    void malformedOracleAddress_isBadRequest() throws Exception {
        mockMvc.perform(put("/admin/oracle")
                        .header("X-Caller-Address", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"oracleAddress\":\"0x1234\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void missingCallerHeader_isBadRequest() throws Exception {
        mockMvc.perform(put("/admin/owner")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newOwner\":\"" + SUCCESSOR + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required header: X-Caller-Address"));
    }
}
