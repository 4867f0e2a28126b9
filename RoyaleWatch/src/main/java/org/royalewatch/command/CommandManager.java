package org.royalewatch.command;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import org.royalewatch.monitor.MonitorException;
import org.royalewatch.util.BattleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CommandManager extends ListenerAdapter {
    private static final Logger log = LoggerFactory.getLogger(CommandManager.class);

    private static final int MESSAGE_LIMIT = 1900;

    private final Map<String, SlashCommand> commands = new LinkedHashMap<>();
    private final BotContext context;

    public CommandManager(BotContext context) {
        this.context = context;
    }

    public void addCommand(SlashCommand command) {
        commands.put(command.getCommandData().getName(), command);
    }

    public List<CommandData> getCommandDataList() {
        List<CommandData> dataList = new ArrayList<>();
        for (SlashCommand cmd : commands.values()) {
            dataList.add(cmd.getCommandData());
        }
        return dataList;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        SlashCommand command = commands.get(event.getName());
        if (command == null) return;

        try {
            command.execute(event, context);
        } catch (Exception e) {
            log.error("Command /{} failed before it could answer", event.getName(), e);
            // Unacknowledged interactions time out on the user's side
            if (!event.isAcknowledged()) {
                event.reply("❌ Command failed: " + e.getMessage()).setEphemeral(true).queue();
            }
        }
    }

    /** Runs {@code action} on the worker pool and sends its text reply, mapping errors to readable messages. */
    static void replyAsync(SlashCommandInteractionEvent event, BotContext ctx, ReplySupplier action) {
        event.deferReply().queue();
        ctx.executor().submit(() -> {
            try {
                for (String part : BattleFormatter.split(action.get(), MESSAGE_LIMIT)) {
                    event.getHook().sendMessage(part).queue();
                }
            } catch (MonitorException e) {
                event.getHook().sendMessage(describe(e)).queue();
            } catch (Exception e) {
                log.error("Command /{} failed", event.getName(), e);
                event.getHook().sendMessage("❌ Unexpected error, see logs.").queue();
            }
        });
    }

    static String describe(MonitorException e) {
        String tag = "#" + e.getSubjectTag();
        return switch (e.getKind()) {
            case INVALID_TAG -> "⚠️ " + tag + " is not a valid player tag.";
            case ALREADY_MONITORED -> "⚠️ Already monitoring " + tag + ".";
            case PROFILE_NOT_FOUND -> "❌ Player " + tag + " not found.";
            case NOT_MONITORED -> "⚠️ Player " + tag + " is not being monitored.";
            case OPPONENT_NOT_FOUND -> "No match history found for " + tag + " against this opponent.";
            case UNAVAILABLE -> "❌ " + tag + ": service temporarily unavailable, try again later.";
        };
    }

    @FunctionalInterface
    interface ReplySupplier {
        String get() throws Exception;
    }
}
