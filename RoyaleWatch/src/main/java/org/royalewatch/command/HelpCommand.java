package org.royalewatch.command;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;

import java.awt.*;

public class HelpCommand implements SlashCommand {

    @Override
    public CommandData getCommandData() {
        return Commands.slash("help", "List the available commands");
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        EmbedBuilder embed = new EmbedBuilder();
        embed.setTitle("👑 RoyaleWatch - Commands");
        embed.setColor(Color.CYAN);
        embed.setDescription("Battle monitoring for Clash Royale players:");

        embed.addField("🔔 `/monitor [tag]`",
                "Start monitoring a player. New battles are posted in the notification channel and a pinned status message is kept up to date.\n*Example: /monitor #2PP*", false);

        embed.addField("🔎 `/search [tag]`",
                "Profile, clan and upcoming chests of any player.\n*Example: /search #2PP*", false);

        embed.addField("🔕 `/unmonitor [tag] [forget]`",
                "Stop monitoring. Statistics are kept unless `forget` is set.", false);

        embed.addField("📋 `/listmonitors`",
                "List monitored players and their status.", false);

        embed.addField("📊 `/stats [tag] [rebuild]`",
                "Win rate overall and per game mode since monitoring started.", false);

        embed.addField("⚔️ `/rivals [tag] [opponent]`",
                "Opponents faced at least twice, or the head-to-head record against one opponent.", false);

        embed.setFooter("Battle logs are polled about once a minute.");

        event.replyEmbeds(embed.build()).queue();
    }
}
