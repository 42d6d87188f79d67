package com.aigreentick.services.evolutionapi.console.command;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.console.CommandInput;
import com.aigreentick.services.evolutionapi.console.ConsoleCommand;
import com.aigreentick.services.evolutionapi.console.ConsoleIO;
import com.aigreentick.services.evolutionapi.repository.EvolutionMessageRepository;
import com.aigreentick.services.evolutionapi.repository.EvolutionWebhookLogRepository;
import com.aigreentick.services.evolutionapi.repository.FailedMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * prune [--days=N] [--messages] [--webhooks] [--all] [--dry-run]
 *
 * --messages covers the sent-message log and failed-message records,
 * --webhooks the webhook log. No selection means everything.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PruneOldDataCommand implements ConsoleCommand {

    private final EvolutionMessageRepository messageRepository;
    private final EvolutionWebhookLogRepository webhookLogRepository;
    private final FailedMessageRepository failedMessageRepository;
    private final TransactionTemplate transactionTemplate;
    private final EvolutionApiProperties properties;
    private final Clock clock;

    @Override
    public String name() {
        return "prune";
    }

    @Override
    public String description() {
        return "Prune old data from the Evolution API tables";
    }

    @Override
    public int execute(CommandInput input, ConsoleIO io) {
        int days = input.intOption("days", properties.getDatabase().getPruneAfterDays());
        if (days < 0) {
            io.error("Option --days must not be negative.");
            return FAILURE;
        }
        boolean dryRun = input.hasFlag("dry-run");
        boolean all = input.hasFlag("all");
        boolean pruneMessages = all || input.hasFlag("messages");
        boolean pruneWebhooks = all || input.hasFlag("webhooks");
        if (!pruneMessages && !pruneWebhooks) {
            pruneMessages = true;
            pruneWebhooks = true;
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(days);
        io.info("Pruning data older than " + days + " days...");
        if (dryRun) {
            io.warn("Dry run mode - no data will be deleted.");
        }
        io.newLine();

        long total = 0;
        if (pruneMessages) {
            total += prune(io, "messages", cutoff, dryRun,
                    messageRepository::countByCreatedAtBefore, messageRepository::deleteOlderThan);
            total += prune(io, "failed messages", cutoff, dryRun,
                    failedMessageRepository::countByCreatedAtBefore, failedMessageRepository::deleteOlderThan);
        }
        if (pruneWebhooks) {
            total += prune(io, "webhook logs", cutoff, dryRun,
                    webhookLogRepository::countByCreatedAtBefore, webhookLogRepository::deleteOlderThan);
        }

        io.newLine();
        io.info((dryRun ? "Would delete " : "Deleted ") + total + " total records.");
        log.info("Prune finished: cutoff={}, dryRun={}, records={}", cutoff, dryRun, total);
        return SUCCESS;
    }

    private long prune(ConsoleIO io, String label, LocalDateTime cutoff, boolean dryRun,
                       ToLongFunction<LocalDateTime> counter, Function<LocalDateTime, Integer> deleter) {
        io.comment("Pruning old " + label + "...");
        long count = counter.applyAsLong(cutoff);
        if (count == 0) {
            io.line("  No old " + label + " to prune.");
            return 0;
        }
        if (dryRun) {
            io.line("  Would delete " + count + " " + label + ".");
            return count;
        }
        Integer deleted = transactionTemplate.execute(status -> deleter.apply(cutoff));
        long result = deleted != null ? deleted : 0;
        io.line("  Deleted " + result + " " + label + ".");
        return result;
    }
}
