package dev.visibility.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What happened to one business during a scheduler pass.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BusinessOutcome(Long businessId, String businessName, Status status, String error) {

    public enum Status {
        SUCCESS,
        FAILED,
        SKIPPED
    }

    public static BusinessOutcome success(Long businessId, String businessName) {
        return new BusinessOutcome(businessId, businessName, Status.SUCCESS, null);
    }

    public static BusinessOutcome failed(Long businessId, String businessName, String error) {
        return new BusinessOutcome(businessId, businessName, Status.FAILED, error);
    }

    public static BusinessOutcome skipped(Long businessId, String businessName, String reason) {
        return new BusinessOutcome(businessId, businessName, Status.SKIPPED, reason);
    }
}
