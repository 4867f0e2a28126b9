package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.util.BattleFormatter;

public class StatsCommand implements SlashCommand {

    @Override
    public CommandData getCommandData() {
        return Commands.slash("stats", "Battle statistics recorded since monitoring started")
                .addOption(OptionType.STRING, "tag", "Player tag", true)
                .addOption(OptionType.BOOLEAN, "rebuild", "Recompute the statistics from the recorded battles", false);
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        String tag = event.getOption("tag").getAsString();
        boolean rebuild = event.getOption("rebuild") != null && event.getOption("rebuild").getAsBoolean();
        CommandManager.replyAsync(event, ctx, () -> {
            Subject subject = ctx.monitorService().getSubject(tag);
            SubjectAggregate stats = rebuild
                    ? ctx.monitorService().rebuildStats(tag)
                    : ctx.monitorService().getStats(tag);
            return BattleFormatter.formatStats(subject, stats);
        });
    }
}
