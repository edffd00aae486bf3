package com.deepansh.router.api;

import com.deepansh.router.core.RequestMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteApiResponse {

    private RequestMetadata metadata;

    /** Reply text; for a streaming responder, the joined fragments. */
    private String output;

    /** Whether the responder streamed its reply. */
    private boolean streaming;
}
