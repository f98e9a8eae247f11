package com.polychaeta.bot.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public final class ScheduledJob {
    public final String id;
    public final Instant runAt;
    public final JobAction action;
    /** Ordered action arguments; for CLOSE_ISSUE: repository full name, issue number. */
    public final List<String> args;

    public ScheduledJob(String id, Instant runAt, JobAction action, List<String> args) {
        this.id = Objects.requireNonNull(id, "id");
        this.runAt = Objects.requireNonNull(runAt, "runAt");
        this.action = Objects.requireNonNull(action, "action");
        this.args = List.copyOf(args);
    }

    public static ScheduledJob closeIssue(IssueRef issue, Instant runAt) {
        return new ScheduledJob(JobId.make(issue), runAt, JobAction.CLOSE_ISSUE,
                List.of(issue.repoFullName, String.valueOf(issue.number)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduledJob)) return false;
        ScheduledJob other = (ScheduledJob) o;
        return id.equals(other.id) && runAt.equals(other.runAt)
                && action == other.action && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, runAt, action, args);
    }

    @Override
    public String toString() {
        return "ScheduledJob{id=" + id + ", runAt=" + runAt + ", action=" + action + ", args=" + args + "}";
    }
}
