package beacon.adapter.in.rest;

import java.util.Map;

/**
 * Body of {@code POST /admin/broker/publish}.
 *
 * @param target  {@code all} or a channel id
 * @param event   event name delivered to clients
 * @param payload event payload, may be null
 */
public record PublishRequest(String target, String event, Map<String, Object> payload) {}
