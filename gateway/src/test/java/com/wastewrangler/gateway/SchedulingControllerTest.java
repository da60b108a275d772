package com.wastewrangler.gateway;

import com.wastewrangler.compliance.model.QualificationRecord;
import com.wastewrangler.gateway.controller.SchedulingController;
import com.wastewrangler.gateway.service.WasteWrangler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("unit")
public class SchedulingControllerTest {

    private WasteWrangler wasteWrangler;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        wasteWrangler = mock(WasteWrangler.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SchedulingController(wasteWrangler)).build();
    }

    @Test
    void test_schedule_trip() throws Exception {
        when(wasteWrangler.scheduleTrip(4, LocalDateTime.of(2023, 5, 4, 9, 30))).thenReturn(true);

        mockMvc.perform(post("/api/scheduling/routes/4/trips").param("time", "2023-05-04T09:30:00"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scheduled").value(true));
    }

    @Test
    void test_schedule_trips_for_truck() throws Exception {
        when(wasteWrangler.scheduleTrips(2, LocalDate.of(2023, 5, 4))).thenReturn(3);

        mockMvc.perform(post("/api/scheduling/trucks/2/trips").param("date", "2023-05-04"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scheduled").value(3));
    }

    @Test
    void test_reroute() throws Exception {
        when(wasteWrangler.rerouteWaste(7, LocalDate.of(2023, 5, 4))).thenReturn(5);

        mockMvc.perform(post("/api/scheduling/facilities/7/reroute").param("date", "2023-05-04"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rerouted").value(5));
    }

    @Test
    void test_maintenance() throws Exception {
        when(wasteWrangler.scheduleMaintenance(LocalDate.of(2023, 6, 1))).thenReturn(2);

        mockMvc.perform(post("/api/scheduling/maintenance").param("date", "2023-06-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scheduled").value(2));
    }

    @Test
    void test_workmates() throws Exception {
        when(wasteWrangler.workmateSphere(3)).thenReturn(Set.of(5));

        mockMvc.perform(get("/api/scheduling/drivers/3/workmates"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value(5));
    }

    @Test
    void test_update_technicians_from_json() throws Exception {
        List<QualificationRecord> expected = List.of(new QualificationRecord("Maria", "Lopez", "A"));
        when(wasteWrangler.updateTechnicians(expected)).thenReturn(1);

        mockMvc.perform(post("/api/scheduling/technicians")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"firstName\":\"Maria\",\"lastName\":\"Lopez\",\"truckTypeCode\":\"A\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.applied").value(1));
    }

    @Test
    void test_malformed_time_is_bad_request() throws Exception {
        mockMvc.perform(post("/api/scheduling/routes/4/trips").param("time", "tomorrow"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(wasteWrangler);
    }

    @Test
    void test_health() throws Exception {
        mockMvc.perform(get("/api/scheduling/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"));
    }
}
