package dev.visibility.publish;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublishResult(boolean success, String qid, String error) {

    public static PublishResult published(String qid) {
        return new PublishResult(true, qid, null);
    }

    public static PublishResult failed(String error) {
        return new PublishResult(false, null, error);
    }
}
