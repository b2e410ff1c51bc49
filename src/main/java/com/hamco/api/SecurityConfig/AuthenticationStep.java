package com.hamco.api.SecurityConfig;

import com.hamco.api.model.StepOutcome;
import jakarta.servlet.http.HttpServletRequest;

/**
 * One credential mechanism inside {@link AuthenticationChainFilter}.
 */
public interface AuthenticationStep {

    /** Short name used in logs. */
    String name();

    StepOutcome attempt(HttpServletRequest request);
}
