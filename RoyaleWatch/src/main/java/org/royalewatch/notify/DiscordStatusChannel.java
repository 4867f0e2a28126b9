package org.royalewatch.notify;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pinned status messages in a Discord text channel. Calls block, so they must not run on a JDA
 * event thread.
 */
public class DiscordStatusChannel implements StatusChannel {
    private static final Logger log = LoggerFactory.getLogger(DiscordStatusChannel.class);

    private final JDA jda;
    private final String channelId;

    public DiscordStatusChannel(JDA jda, String channelId) {
        this.jda = jda;
        this.channelId = channelId;
    }

    @Override
    public String post(String text) {
        TextChannel channel = jda.getTextChannelById(channelId);
        if (channel == null) {
            log.warn("Status channel {} not found", channelId);
            return null;
        }
        Message message;
        try {
            message = channel.sendMessage(text).complete();
        } catch (RuntimeException e) {
            log.warn("Could not post status message in {}: {}", channelId, e.getMessage());
            return null;
        }
        message.pin().queue(
                null,
                error -> log.warn("Could not pin status message {}: {}", message.getId(), error.getMessage()));
        return message.getId();
    }

    @Override
    public boolean edit(String messageId, String text) {
        TextChannel channel = jda.getTextChannelById(channelId);
        if (channel == null) {
            log.warn("Status channel {} not found", channelId);
            return false;
        }
        try {
            channel.editMessageById(messageId, text).complete();
            return true;
        } catch (ErrorResponseException e) {
            if (e.getErrorResponse() == ErrorResponse.UNKNOWN_MESSAGE) {
                log.info("Status message {} was deleted, a new one will be posted", messageId);
                return false;
            }
            log.warn("Could not edit status message {}: {}", messageId, e.getMessage());
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not edit status message {}: {}", messageId, e.getMessage());
            return true;
        }
    }
}
