package com.autonomous.dogwalker.service;

/**
 * Outbound side of the chat platform.
 */
public interface ChatGateway {

    /** @return the posted message's timestamp, or null if posting failed */
    String post(String channelId, String threadTs, String text, String emoji);

    /**
     * Posts a message with a single button. Clicking it sends {@code actionId}
     * with {@code value} back to the interaction endpoint.
     */
    String postWithButton(String channelId, String threadTs, String text,
                          String actionId, String buttonLabel, String value);

    void react(String channelId, String messageTs, String emoji);

    String displayName(String userId);
}
