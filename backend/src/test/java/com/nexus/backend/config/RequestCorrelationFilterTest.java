package com.nexus.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RequestCorrelationFilterTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void echoesCallerRequestId() throws Exception {
        mockMvc.perform(get("/health").header(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-123"))
                .andExpect(header().string(RequestCorrelationFilter.CORRELATION_ID_HEADER, not(emptyOrNullString())));
    }

    @Test
    void errorBodyCarriesRequestId() throws Exception {
        mockMvc.perform(get("/api/trades")
                        .param("user_id", "trader-1")
                        .param("days", "-1")
                        .header(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-456"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.request_id").value("req-456"))
                .andExpect(jsonPath("$.path").value("/api/trades"));
    }
}
