package com.polychaeta.bot.triage;

import com.polychaeta.bot.github.GitHubPlatform;
import com.polychaeta.bot.github.LabelRemoval;
import com.polychaeta.bot.model.IssueRef;
import com.polychaeta.bot.model.JobId;
import com.polychaeta.bot.model.ScheduledJob;
import com.polychaeta.bot.scheduler.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs fired jobs: closes the issue, then drops the trigger label.
 *
 * Platform failures end here as log entries; nothing is rethrown to the scheduler.
 */
public final class CloseIssueAction implements JobScheduler.Handler {
    private static final Logger log = LoggerFactory.getLogger(CloseIssueAction.class);

    private final GitHubPlatform github;
    private final String triggerLabel;

    public CloseIssueAction(GitHubPlatform github, String triggerLabel) {
        this.github = github;
        this.triggerLabel = triggerLabel;
    }

    @Override
    public void handle(ScheduledJob job) {
        switch (job.action) {
            case CLOSE_ISSUE -> closeIssue(issueOf(job));
        }
    }

    /**
     * @return true if the issue was closed
     */
    public boolean closeIssue(IssueRef issue) {
        log.info("Closing issue {}", issue);
        try {
            github.closeIssue(issue);
        } catch (IOException e) {
            log.warn("Could not close issue {}: {}", issue, e.getMessage());
            return false;
        }

        LabelRemoval removal = github.removeLabel(issue, triggerLabel);
        if (removal == LabelRemoval.FAILED) {
            log.warn("Closed {} but could not remove label '{}'", issue, triggerLabel);
        }
        return true;
    }

    static IssueRef issueOf(ScheduledJob job) {
        if (job.args.size() == 2) {
            try {
                return new IssueRef(job.args.get(0), Integer.parseInt(job.args.get(1)));
            } catch (NumberFormatException e) {
                log.warn("Job {} has a malformed issue number {}, falling back to its id", job.id, job.args.get(1));
            }
        }
        return JobId.parse(job.id);
    }
}
