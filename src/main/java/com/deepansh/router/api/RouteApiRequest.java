package com.deepansh.router.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class RouteApiRequest {

    @NotBlank(message = "input must not be blank")
    private String input;

    /** Optional; defaults to "default". */
    private String userId;

    /** Optional; a new session is started when absent. */
    private String sessionId;

    private Map<String, String> additionalParams = new HashMap<>();

    /** Optional; skips classification and sends the turn straight to this responder id. */
    private String responderId;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;
}
