package com.dispatchqueue.jobs;

import com.dispatchqueue.client.ChatClient;
import com.dispatchqueue.engine.CompletionNotifier;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts a green (success) or red (failure) embed when a job that asked for it settles.
 * Delivery problems are logged and never reach the queue.
 */
public class ChatCompletionNotifier implements CompletionNotifier {
    private static final Logger logger = Logger.getLogger(ChatCompletionNotifier.class.getName());

    static final int SUCCESS_COLOR = 0x2ecc71;
    static final int FAILURE_COLOR = 0xe74c3c;
    private static final int MAX_DESCRIPTION_LENGTH = 4096;

    private final ChatClient chatClient;
    private final String channelId;
    private final String successTitle;
    private final String failureTitle;
    private final String footer;
    private final Clock clock;

    /**
     * @param chatClient transport for the embeds
     * @param channelId destination channel
     * @param successTitle embed title for {@link Outcome#SUCCESS}
     * @param failureTitle embed title for {@link Outcome#FAILURE}
     * @param footer footer text on every embed
     * @param clock embed timestamp source
     */
    public ChatCompletionNotifier(ChatClient chatClient, String channelId, String successTitle,
                                  String failureTitle, String footer, Clock clock) {
        this.chatClient = chatClient;
        this.channelId = channelId;
        this.successTitle = successTitle;
        this.failureTitle = failureTitle;
        this.footer = footer;
        this.clock = clock;
    }

    @Override
    public void emit(String summary, Outcome outcome) {
        try {
            chatClient.send(channelId, buildEmbed(summary, outcome));
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to send " + outcome + " notification", e);
        }
    }

    JSONObject buildEmbed(String summary, Outcome outcome) {
        boolean success = outcome == Outcome.SUCCESS;
        String description = summary.length() > MAX_DESCRIPTION_LENGTH
                ? summary.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "..."
                : summary;
        return new JSONObject()
                .put("color", success ? SUCCESS_COLOR : FAILURE_COLOR)
                .put("title", success ? successTitle : failureTitle)
                .put("description", description)
                .put("footer", new JSONObject().put("text", footer))
                .put("timestamp", clock.instant().toString());
    }
}
