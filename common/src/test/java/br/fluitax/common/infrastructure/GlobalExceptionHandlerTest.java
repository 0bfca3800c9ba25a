package br.fluitax.common.infrastructure;

import br.fluitax.common.exception.ExternalServiceException;
import br.fluitax.common.exception.KardexConfigurationException;
import br.fluitax.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GlobalExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new RequestCorrelationFilter())
                .build();
    }

    @Test
    void validationException_ShouldMapToBadRequest() throws Exception {
        mockMvc.perform(get("/fail/validation"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("FLUITAX_ERR_400"))
                .andExpect(jsonPath("$.message").value("bad date"));
    }

    @Test
    void configurationException_ShouldMapToBadRequestWithConfigCode() throws Exception {
        mockMvc.perform(get("/fail/config"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("FLUITAX_ERR_400_CONFIG"));
    }

    @Test
    void externalServiceException_ShouldMapToBadGateway() throws Exception {
        mockMvc.perform(get("/fail/external"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("FLUITAX_ERR_502"))
                .andExpect(jsonPath("$.message").value("External service 'firestore' error: timed out"));
    }

    @Test
    void missingParameter_ShouldMapToBadRequest() throws Exception {
        mockMvc.perform(get("/fail/param"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("FLUITAX_ERR_400"));
    }

    @Test
    void unexpectedException_ShouldHideDetails() throws Exception {
        mockMvc.perform(get("/fail/unexpected"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"))
                .andExpect(jsonPath("$.errorCode").value("FLUITAX_ERR_500"));
    }

    @Test
    void requestId_ShouldBeEchoedWhenProvided() throws Exception {
        mockMvc.perform(get("/fail/validation").header(RequestCorrelationFilter.HEADER, "req-42"))
                .andExpect(header().string(RequestCorrelationFilter.HEADER, "req-42"));
    }

    @Test
    void requestId_ShouldBeGeneratedWhenMissing() throws Exception {
        mockMvc.perform(get("/fail/validation"))
                .andExpect(header().exists(RequestCorrelationFilter.HEADER));
    }

    @RestController
    static class FailingController {

        @GetMapping("/fail/validation")
        String validation() {
            throw new ValidationException("bad date");
        }

        @GetMapping("/fail/config")
        String config() {
            throw new KardexConfigurationException("company OLG not found");
        }

        @GetMapping("/fail/external")
        String external() {
            throw new ExternalServiceException("firestore", "timed out");
        }

        @GetMapping("/fail/param")
        String param(@RequestParam("to") String to) {
            return to;
        }

        @GetMapping("/fail/unexpected")
        String unexpected() {
            throw new IllegalStateException("boom");
        }
    }
}
