package com.tazifor.planner.exception;

import com.tazifor.planner.dto.CoverageRequestDto;
import com.tazifor.planner.geo.service.CoverageService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Unexpected failures")
class ApiExceptionHandlerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CoverageService coverageService;

    @Test
    @DisplayName("Unexpected exception is a 500 with a fixed message that hides the cause")
    void unexpectedErrorHidesCause() throws Exception {
        when(coverageService.cover(any(CoverageRequestDto.class)))
            .thenThrow(new IllegalStateException("jdbc:postgresql://db:5432 password=hunter2"));

        mvc.perform(post("/api/coverage")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"polygons\":[]}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Internal server error"))
            .andExpect(jsonPath("$.message").value(ApiExceptionHandler.UNEXPECTED_ERROR_MESSAGE))
            .andExpect(content().string(not(containsString("hunter2"))));
    }
}
