package com.aigreentick.services.evolutionapi.console.command;

import com.aigreentick.services.evolutionapi.console.CommandInput;
import com.aigreentick.services.evolutionapi.console.ConsoleCommand;
import com.aigreentick.services.evolutionapi.console.ConsoleIO;
import com.aigreentick.services.evolutionapi.entity.FailedMessage;
import com.aigreentick.services.evolutionapi.job.SendMessageJob;
import com.aigreentick.services.evolutionapi.job.SendMessageJobFactory;
import com.aigreentick.services.evolutionapi.repository.FailedMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * retry [--instance=name] [--max-retries=3] [--limit=100] [--dry-run]
 *
 * Resends failed-message records one by one on this thread, oldest first.
 * A record is deleted when its resend succeeds; otherwise its retry count
 * goes up and the error is kept for the next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryFailedMessagesCommand implements ConsoleCommand {

    private final FailedMessageRepository failedMessageRepository;
    private final SendMessageJobFactory jobFactory;

    @Override
    public String name() {
        return "retry";
    }

    @Override
    public String description() {
        return "Retry failed messages";
    }

    @Override
    public int execute(CommandInput input, ConsoleIO io) {
        String instance = input.option("instance");
        int maxRetries = input.intOption("max-retries", 3);
        int limit = input.intOption("limit", 100);
        boolean dryRun = input.hasFlag("dry-run");
        if (limit < 1) {
            io.error("Option --limit must be at least 1.");
            return FAILURE;
        }

        io.info("Finding failed messages to retry...");
        if (dryRun) {
            io.warn("Dry run mode - no messages will be sent.");
        }
        io.newLine();

        List<FailedMessage> records = failedMessageRepository.findRetryable(
                instance, maxRetries, PageRequest.of(0, limit));
        if (records.isEmpty()) {
            io.info("No failed messages found to retry.");
            return SUCCESS;
        }
        io.info("Found " + records.size() + " message(s) to retry.");
        io.newLine();

        int succeeded = 0;
        int failed = 0;
        for (FailedMessage record : records) {
            io.line("Retrying message #" + record.getId());
            io.line("  Instance: " + record.getInstanceName());
            io.line("  Recipient: " + record.getRecipient());
            io.line("  Type: " + record.getMessageType());
            io.line("  Retry count: " + record.getRetryCount());

            if (dryRun) {
                io.line("  Would retry...");
                succeeded++;
            } else if (resend(record, io)) {
                succeeded++;
            } else {
                failed++;
            }
            io.newLine();
        }

        io.info("Completed: " + succeeded + " succeeded, " + failed + " failed.");
        return failed > 0 ? FAILURE : SUCCESS;
    }

    private boolean resend(FailedMessage record, ConsoleIO io) {
        if (record.getPayload() == null || record.getPayload().isEmpty()) {
            io.line("  No payload found, skipping...");
            recordFailure(record, "No payload");
            return false;
        }
        try {
            SendMessageJob job = jobFactory.create(record.getInstanceName(), record.getMessageType(),
                    record.getPayload(), record.getConnectionName());
            // a single attempt; the record itself carries the retry budget
            job.handle(record.getRetryCount() + 1);
        } catch (Exception ex) {
            String error = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            recordFailure(record, error);
            io.line("  Failed: " + error);
            return false;
        }

        io.line("  Success!");
        log.info("Failed message resent: id={}, instance={}", record.getId(), record.getInstanceName());
        try {
            failedMessageRepository.delete(record);
        } catch (DataAccessException ex) {
            log.error("Resent message #{} could not be removed from the failed messages", record.getId(), ex);
            io.warn("Message #" + record.getId() + " was sent but its record could not be deleted: "
                    + ex.getMostSpecificCause().getMessage());
        }
        return true;
    }

    private void recordFailure(FailedMessage record, String error) {
        record.recordRetryFailure(error);
        failedMessageRepository.save(record);
    }
}
