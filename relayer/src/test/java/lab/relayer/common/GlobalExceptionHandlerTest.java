package lab.relayer.common;

import lab.relayer.adapter.TransactionRevertedException;
import lab.relayer.adapter.TransientLedgerException;
import lab.relayer.domain.escrow.ErrorCategory;
import lab.relayer.domain.escrow.EscrowErrorCode;
import lab.relayer.domain.escrow.EscrowException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "relayer.scheduling.enabled=false")
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
    void escrowExceptionMapsCategoryToStatus() throws Exception {
        mockMvc.perform(get("/test-error/escrow"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.category").value("AUTHORIZATION"));
    }

    @Test
    void revertedTransactionUsesErrorCodeCategory() throws Exception {
        mockMvc.perform(get("/test-error/reverted"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.category").value("STATE_CONFLICT"));
    }

    @Test
    void transientLedgerFailureIsServiceUnavailable() throws Exception {
        mockMvc.perform(get("/test-error/transient").header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-42"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-42"))
                .andExpect(jsonPath("$.category").value("TRANSIENT_NETWORK"));
    }

    @Test
    void everyCategoryHasAStatus() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertThat(GlobalExceptionHandler.statusFor(category)).isNotNull();
        }
        assertThat(GlobalExceptionHandler.statusFor(ErrorCategory.TIMING)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(GlobalExceptionHandler.sanitizeMessage(null)).isEqualTo("Unexpected server error");
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

        @GetMapping("/test-error/escrow")
        String escrow() {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED, "caller is not the receiver");
        }

        @GetMapping("/test-error/reverted")
        String reverted() {
            throw new TransactionRevertedException("etherlink", "0x01", EscrowErrorCode.ALREADY_WITHDRAWN, "already withdrawn");
        }

        @GetMapping("/test-error/transient")
        String transientFailure() {
            throw new TransientLedgerException("monad", "chain unreachable");
        }
    }
}
