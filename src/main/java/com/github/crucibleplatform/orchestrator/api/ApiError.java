package com.github.crucibleplatform.orchestrator.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author crucible-platform
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    public static final String REASON_NOT_FOUND = "NOT_FOUND";

    public static final String REASON_BAD_REQUEST = "BAD_REQUEST";

    private String reason;

    private String message;

    private boolean retryable;

}
