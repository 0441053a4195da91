package com.acme.shove.order;

/**
 * A request from the captain to run {@code command} for {@code project}. The result is published to
 * {@code logQueue}, tagged with {@code logKey}.
 */
public record Order(String project, String command, String logKey, String logQueue) {
}
