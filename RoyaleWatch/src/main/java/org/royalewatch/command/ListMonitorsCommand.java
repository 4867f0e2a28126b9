package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.royalewatch.model.Subject;

import java.util.List;

public class ListMonitorsCommand implements SlashCommand {

    @Override
    public CommandData getCommandData() {
        return Commands.slash("listmonitors", "List every monitored player");
    }

    @Override
    public void execute(SlashCommandInteractionEvent event, BotContext ctx) {
        CommandManager.replyAsync(event, ctx, () -> {
            List<Subject> subjects = ctx.monitorService().listMonitored();
            if (subjects.isEmpty()) return "📋 No players are currently being monitored.";

            StringBuilder sb = new StringBuilder("📋 MONITORED PLAYERS\n\n");
            for (Subject s : subjects) {
                sb.append(s.isActive() ? "🟢 " : "⏸️ ").append(s.name())
                        .append(" (").append(Subject.displayTag(s.tag())).append(")");
                if (s.lastArena() != null) sb.append(" - ").append(s.lastArena());
                sb.append("\n");
            }
            return sb.toString();
        });
    }
}
