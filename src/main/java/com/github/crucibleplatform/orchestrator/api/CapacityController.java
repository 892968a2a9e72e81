package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.domain.CapacityStatus;
import com.github.crucibleplatform.orchestrator.service.CapacityManager;
import com.github.crucibleplatform.orchestrator.service.DispatcherService;
import com.github.crucibleplatform.orchestrator.service.TaskRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * @author crucible-platform
 */
@RestController
@RequestMapping("/capacity")
@Slf4j
public class CapacityController {

    private final CapacityManager capacityManager;

    private final DispatcherService dispatcherService;

    private final TaskRouter taskRouter;

    public CapacityController(final CapacityManager capacityManager,
                              final DispatcherService dispatcherService,
                              final TaskRouter taskRouter) {
        this.capacityManager = capacityManager;
        this.dispatcherService = dispatcherService;
        this.taskRouter = taskRouter;
    }

    @RequestMapping(method = RequestMethod.GET)
    public Map<String, Object> getCapacity() {
        return Map.of(
                "capacity", capacityManager.snapshot(),
                "activeUnits", dispatcherService.getNumberOfActiveUnits(),
                "queueSize", taskRouter.getQueueSize());
    }

    @RequestMapping(method = RequestMethod.PUT)
    public CapacityStatus setCapacity(@RequestParam("slots") final int slots) {
        log.info("Changing capacity to {} slots", slots);
        dispatcherService.updateCapacity(slots);
        return capacityManager.snapshot();
    }

}
