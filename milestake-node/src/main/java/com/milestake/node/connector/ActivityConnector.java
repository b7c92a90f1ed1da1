package com.milestake.node.connector;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Source of per-participant mileage.
 *
 * <p>Implementations return zero miles when the service has no matching activity,
 * and fail with {@link ActivityServiceException} when the service cannot be reached
 * or refuses the request.
 */
public interface ActivityConnector {

    String getId();

    /**
     * Fetches the mileage a participant logged within {@code [windowStart, windowEnd]}.
     *
     * @param identity      the participant's wallet address
     * @param correlationId the participant's account id at the activity service
     */
    CompletableFuture<MileageReading> fetchMileage(String identity, String correlationId,
                                                   Instant windowStart, Instant windowEnd);
}
