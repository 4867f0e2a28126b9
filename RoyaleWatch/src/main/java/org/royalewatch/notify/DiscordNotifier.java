package org.royalewatch.notify;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import org.royalewatch.event.MonitorEvent;
import org.royalewatch.event.MonitorEventListener;
import org.royalewatch.util.BattleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts monitor events to a Discord text channel.
 */
public class DiscordNotifier implements MonitorEventListener {
    private static final Logger log = LoggerFactory.getLogger(DiscordNotifier.class);

    // Discord rejects messages above 2000 characters
    private static final int MESSAGE_LIMIT = 1900;

    private final JDA jda;
    private final String channelId;

    public DiscordNotifier(JDA jda, String channelId) {
        this.jda = jda;
        this.channelId = channelId;
    }

    @Override
    public void onEvent(MonitorEvent event) {
        TextChannel channel = jda.getTextChannelById(channelId);
        if (channel == null) {
            log.warn("Notification channel {} not found, dropping {} for #{}",
                    channelId, event.getClass().getSimpleName(), event.subjectTag());
            return;
        }
        for (String part : BattleFormatter.split(BattleFormatter.formatEvent(event), MESSAGE_LIMIT)) {
            channel.sendMessage(part).queue(
                    null,
                    error -> log.warn("Failed to post {} for #{}: {}",
                            event.getClass().getSimpleName(), event.subjectTag(), error.getMessage()));
        }
    }
}
