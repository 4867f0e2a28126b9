package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.royalewatch.model.RivalEntry;
import org.royalewatch.model.Subject;
import org.royalewatch.util.BattleFormatter;

public class RivalsCommand implements SlashCommand {

    private static final int HISTORY_SHOWN = 10;

    @Override
    public CommandData getCommandData() {
        return Commands.slash("rivals", "Repeat opponents, or the head-to-head against one opponent")
                .addOption(OptionType.STRING, "tag", "Player tag", true)
                .addOption(OptionType.STRING, "opponent", "Opponent tag for a head-to-head view", false);
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        String tag = event.getOption("tag").getAsString();
        OptionMapping opponentOption = event.getOption("opponent");
        CommandManager.replyAsync(event, ctx, () -> {
            if (opponentOption != null) {
                String opponent = opponentOption.getAsString();
                RivalEntry rival = ctx.monitorService().getRival(tag, opponent);
                return BattleFormatter.formatHeadToHead(rival,
                        ctx.monitorService().headToHeadHistory(tag, opponent, HISTORY_SHOWN));
            }
            Subject subject = ctx.monitorService().getSubject(tag);
            return BattleFormatter.formatRivals(subject, ctx.monitorService().getRivals(tag));
        });
    }
}
