package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.royalewatch.model.Subject;

public class MonitorCommand implements SlashCommand {

    @Override
    public CommandData getCommandData() {
        return Commands.slash("monitor", "Start monitoring a player's battles")
                .addOption(OptionType.STRING, "tag", "Player tag (ex: #2PP)", true);
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        String tag = event.getOption("tag").getAsString();
        CommandManager.replyAsync(event, ctx, () -> {
            Subject subject = ctx.monitorService().startMonitoring(tag);
            ctx.statusBoard().refreshSoon(subject.tag());
            return "✅ Now monitoring " + subject.name() + " (" + Subject.displayTag(subject.tag()) + ")\n"
                    + "New battles will be posted here. Existing history is kept as baseline.";
        });
    }
}
