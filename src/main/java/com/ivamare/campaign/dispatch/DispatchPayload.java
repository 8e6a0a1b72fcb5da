package com.ivamare.campaign.dispatch;

/**
 * The message sent to every recipient of a job.
 *
 * @param subject Subject line
 * @param body Message body
 */
public record DispatchPayload(String subject, String body) {
}
