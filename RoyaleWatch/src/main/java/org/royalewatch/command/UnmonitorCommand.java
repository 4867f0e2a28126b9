package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.royalewatch.model.Subject;

public class UnmonitorCommand implements SlashCommand {

    @Override
    public CommandData getCommandData() {
        return Commands.slash("unmonitor", "Stop monitoring a player (statistics are kept)")
                .addOption(OptionType.STRING, "tag", "Player tag", true)
                .addOption(OptionType.BOOLEAN, "forget", "Also delete every recorded battle and statistic", false);
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        String tag = event.getOption("tag").getAsString();
        boolean forget = event.getOption("forget") != null && event.getOption("forget").getAsBoolean();
        CommandManager.replyAsync(event, ctx, () -> {
            Subject subject = ctx.monitorService().getSubject(tag);
            if (forget) {
                ctx.monitorService().forgetSubject(tag);
                return "🗑️ Stopped monitoring " + subject.name() + " and deleted its battle history.";
            }
            ctx.monitorService().stopMonitoring(tag);
            return "✅ Stopped monitoring " + subject.name() + " (" + Subject.displayTag(subject.tag()) + ")\n"
                    + "📊 Statistics are preserved; use /monitor again to resume.";
        });
    }
}
