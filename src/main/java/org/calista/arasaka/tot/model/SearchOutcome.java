package org.calista.arasaka.tot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * What the submitter observes: {@code COMPLETED} with a result, or {@code FAILED} with a reason.
 * Never a partial result.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SearchOutcome {

    public enum Status { COMPLETED, FAILED }

    public final String searchId;
    public final Status status;
    public final SearchResult result;
    public final FailureReason reason;
    public final String message;

    @JsonCreator
    public SearchOutcome(@JsonProperty("searchId") String searchId,
                         @JsonProperty("status") Status status,
                         @JsonProperty("result") SearchResult result,
                         @JsonProperty("reason") FailureReason reason,
                         @JsonProperty("message") String message) {
        this.searchId = searchId;
        this.status = Objects.requireNonNull(status, "status");
        this.result = result;
        this.reason = reason;
        this.message = message;
    }

    public static SearchOutcome completed(SearchResult result) {
        Objects.requireNonNull(result, "result");
        return new SearchOutcome(result.searchId, Status.COMPLETED, result, null, null);
    }

    public static SearchOutcome failed(String searchId, FailureReason reason, String message) {
        return new SearchOutcome(searchId, Status.FAILED, null, Objects.requireNonNull(reason, "reason"), message);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    @Override
    public String toString() {
        return isCompleted()
                ? "Completed(" + result + ")"
                : "Failed(" + reason + (message == null ? "" : ": " + message) + ")";
    }
}
