package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.service.CapacityManager;
import com.github.crucibleplatform.orchestrator.service.DispatcherService;
import com.github.crucibleplatform.orchestrator.service.TaskRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * @author crucible-platform
 */
@ExtendWith(MockitoExtension.class)
class CapacityControllerTest {

    @Mock
    DispatcherService dispatcherService;

    @Mock
    TaskRouter taskRouter;

    CapacityManager capacityManager;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        capacityManager = new CapacityManager(4, 0, 0);
        mockMvc = MockMvcBuilders.standaloneSetup(new CapacityController(capacityManager, dispatcherService, taskRouter))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void getCapacity_reportsSlotsAndQueue() throws Exception {
        // given
        when(dispatcherService.getNumberOfActiveUnits()).thenReturn(0);
        when(taskRouter.getQueueSize()).thenReturn(2);

        // when / then
        mockMvc.perform(get("/capacity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.capacity.capacity").value(4))
                .andExpect(jsonPath("$.queueSize").value(2));
    }

    @Test
    void setCapacity_resizesPool() throws Exception {
        // given
        doAnswer(invocation -> {
            capacityManager.resize(invocation.getArgument(0));
            return null;
        }).when(dispatcherService).updateCapacity(8);

        // when / then
        mockMvc.perform(put("/capacity").param("slots", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.capacity").value(8));
    }

    @Test
    void setCapacity_negativeValueIsBadRequest() throws Exception {
        // given
        doThrow(new IllegalArgumentException("Capacity must not be negative"))
                .when(dispatcherService).updateCapacity(-1);

        // when / then
        mockMvc.perform(put("/capacity").param("slots", "-1"))
                .andExpect(status().isBadRequest());
    }

}
