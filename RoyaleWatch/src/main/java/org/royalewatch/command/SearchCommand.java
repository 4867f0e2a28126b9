package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.royalewatch.util.BattleFormatter;

import java.time.Instant;

public class SearchCommand implements SlashCommand {

    @Override
    public CommandData getCommandData() {
        return Commands.slash("search", "Show a player's profile, clan and upcoming chests")
                .addOption(OptionType.STRING, "tag", "Player tag (ex: #2PP)", true);
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        String tag = event.getOption("tag").getAsString();
        CommandManager.replyAsync(event, ctx,
                () -> BattleFormatter.formatPlayerInfo(ctx.lookupService().lookup(tag), Instant.now()));
    }
}
