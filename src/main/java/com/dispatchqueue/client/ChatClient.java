package com.dispatchqueue.client;

import org.json.JSONObject;

import java.io.IOException;

/**
 * Posts rich embed messages to a chat channel.
 */
public interface ChatClient {

    /**
     * Post one embed.
     *
     * @param channelId target channel; implementations bound to a single channel may ignore it
     * @param embed the embed object (title, description, color, fields, footer, timestamp)
     * @return the id of the created message, or null if the platform does not report one
     * @throws IOException if the message could not be delivered
     */
    String send(String channelId, JSONObject embed) throws IOException;
}
