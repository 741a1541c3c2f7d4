package org.javai.shuuten;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of handing one event to one destination.
 *
 * @param destinationName The destination's name
 * @param status Delivered, failed after its attempts, or not attempted because disabled
 * @param error Failure or disabled-reason detail (null when delivered)
 * @param attempts Number of send attempts made
 */
public record DestinationResult(String destinationName, Status status, String error, int attempts) {

    public enum Status {
        DELIVERED,
        FAILED,
        DISABLED
    }

    public DestinationResult {
        Objects.requireNonNull(destinationName, "destinationName must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    public static DestinationResult delivered(String destinationName, int attempts) {
        return new DestinationResult(destinationName, Status.DELIVERED, null, attempts);
    }

    public static DestinationResult failed(String destinationName, String error, int attempts) {
        return new DestinationResult(destinationName, Status.FAILED, error, attempts);
    }

    public static DestinationResult disabled(String destinationName, String reason) {
        return new DestinationResult(destinationName, Status.DISABLED, reason, 0);
    }

    public boolean success() {
        return status == Status.DELIVERED;
    }

    public Optional<String> errorDetail() {
        return Optional.ofNullable(error);
    }
}
