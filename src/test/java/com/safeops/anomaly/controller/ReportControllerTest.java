package com.safeops.anomaly.controller;

import com.safeops.anomaly.model.PipelineStats;
import com.safeops.anomaly.service.ReportService;
import com.safeops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReportController.class)
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportService reportService;

    @Test
    void getReports_defaultLimit() throws Exception {
        when(reportService.recentReports(null, 20))
                .thenReturn(List.of(TestDataFactory.createReport("p1", 0.9, true)));

        mockMvc.perform(get("/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].is_anomaly").value(true));
    }

    @Test
    void getReports_filteredByPipeline() throws Exception {
        when(reportService.recentReports("p1", 5)).thenReturn(List.of());

        mockMvc.perform(get("/reports").param("pipeline_id", "p1").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(reportService).recentReports("p1", 5);
    }

    @Test
    void getStats_forPipeline() throws Exception {
        when(reportService.stats("p1")).thenReturn(new PipelineStats("p1", 42, 3));

        mockMvc.perform(get("/stats").param("pipeline_id", "p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pipeline_id").value("p1"))
                .andExpect(jsonPath("$.runs").value(42))
                .andExpect(jsonPath("$.anomalies").value(3));
    }
}
