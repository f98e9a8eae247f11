package com.polychaeta.bot.triage;

import com.polychaeta.bot.github.GitHubPlatform;
import com.polychaeta.bot.github.LabelRemoval;
import com.polychaeta.bot.github.Permission;
import com.polychaeta.bot.model.IssueRef;
import com.polychaeta.bot.model.JobId;
import com.polychaeta.bot.model.ScheduledJob;
import com.polychaeta.bot.scheduler.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns issue events into scheduler calls.
 *
 * <ul>
 *   <li>Trigger label applied: close the issue after the configured delay.</li>
 *   <li>{@code @<bot> autoclose <when>} from a repository admin: close at {@code <when>}.</li>
 *   <li>Any other comment on an issue with a pending close: cancel it.</li>
 * </ul>
 */
public final class AutoCloseHandler {
    private static final Logger log = LoggerFactory.getLogger(AutoCloseHandler.class);

    public static final String COMMAND = "autoclose";

    public enum CommentOutcome {
        /** Admin command with a future date; close (re)scheduled. */
        SNOOZED,
        /** Admin command whose date could not be read or is not in the future. */
        REJECTED,
        /** Pending close cancelled by activity. */
        CANCELLED,
        NO_ACTION
    }

    private final JobScheduler scheduler;
    private final GitHubPlatform github;
    private final SnoozeDateParser dateParser;
    private final String triggerLabel;
    private final int autocloseDays;
    private final Clock clock;

    public AutoCloseHandler(JobScheduler scheduler,
                            GitHubPlatform github,
                            SnoozeDateParser dateParser,
                            String triggerLabel,
                            int autocloseDays,
                            Clock clock) {
        this.scheduler = scheduler;
        this.github = github;
        this.dateParser = dateParser;
        this.triggerLabel = triggerLabel;
        this.autocloseDays = autocloseDays;
        this.clock = clock;
    }

    /**
     * @return true if a close was scheduled
     */
    public boolean onIssueLabeled(IssueRef issue, String label) throws IOException {
        if (!triggerLabel.equals(label)) {
            log.debug("Label '{}' on {} is not the trigger label", label, issue);
            return false;
        }

        Instant runAt = clock.instant().plus(Duration.ofDays(autocloseDays));
        scheduler.schedule(ScheduledJob.closeIssue(issue, runAt));
        github.createComment(issue, Texts.autocloseScheduled(autocloseDays));
        return true;
    }

    public CommentOutcome onCommentCreated(IssueRef issue, long commentId, String body, String sender)
            throws IOException {
        String text = body == null ? "" : body;
        Matcher trigger = Pattern.compile(Pattern.quote("@" + github.myLogin() + " " + COMMAND),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(text);

        if (trigger.find() && isAdmin(issue.repoFullName, sender)) {
            String when = text.substring(trigger.end());
            ZonedDateTime now = ZonedDateTime.now(clock);
            Optional<Instant> closeAt = dateParser.parse(when, now);
            if (closeAt.isEmpty() || !closeAt.get().isAfter(now.toInstant())) {
                log.info("Ignoring autoclose command on {} from {}: no future date in '{}'",
                        issue, sender, when.trim());
                return CommentOutcome.REJECTED;
            }

            scheduler.schedule(ScheduledJob.closeIssue(issue, closeAt.get()));
            github.addLabel(issue, triggerLabel);
            github.reactPlusOne(issue, commentId);
            return CommentOutcome.SNOOZED;
        }

        String id = JobId.make(issue);
        if (scheduler.get(id).isEmpty()) {
            return CommentOutcome.NO_ACTION;
        }

        log.info("Activity from {} on {}, cancelling autoclose", sender, issue);
        scheduler.cancel(id);
        if (github.removeLabel(issue, triggerLabel) == LabelRemoval.FAILED) {
            log.warn("Could not remove label '{}' from {}", triggerLabel, issue);
        }
        github.createComment(issue, Texts.AUTOCLOSE_CANCELLED);
        return CommentOutcome.CANCELLED;
    }

    private boolean isAdmin(String repoFullName, String login) {
        try {
            Permission permission = github.permissionOf(repoFullName, login);
            log.debug("{} has {} permission on {}", login, permission, repoFullName);
            return permission == Permission.ADMIN;
        } catch (IOException e) {
            log.warn("Permission lookup for {} on {} failed, treating as non-admin: {}",
                    login, repoFullName, e.getMessage());
            return false;
        }
    }
}
