package com.polychaeta.bot.triage;

import com.polychaeta.bot.github.GitHubPlatform;
import com.polychaeta.bot.github.ReviewEvent;
import com.polychaeta.bot.model.IssueRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the commits of a newly opened pull request for subject-line format and
 * {@code Signed-off-by}, requests changes when either is off, and applies topic
 * labels derived from the subject prefixes.
 */
public final class CommitAuditor {
    private static final Logger log = LoggerFactory.getLogger(CommitAuditor.class);

    private static final Pattern SUBJECT_PREFIX = Pattern.compile("^([^:\\n]+):");
    private static final String SIGNOFF = "Signed-off-by:";

    private final GitHubPlatform github;

    public CommitAuditor(GitHubPlatform github) {
        this.github = github;
    }

    public void onPullRequestOpened(IssueRef pullRequest) throws IOException {
        Audit audit = audit(github.listCommitMessages(pullRequest));

        Optional<String> review = review(audit);
        if (review.isPresent()) {
            log.info("Requesting changes on {} (bad message={}, missing signoff={})",
                    pullRequest, audit.badMessage, audit.missingSignoff);
            github.createReview(pullRequest, review.get(), ReviewEvent.REQUEST_CHANGES);
        }

        if (!audit.labels.isEmpty()) {
            log.info("Labeling {} with {}", pullRequest, audit.labels);
            github.setLabels(pullRequest, audit.labels);
        }
    }

    static Audit audit(List<String> messages) {
        Audit audit = new Audit();
        for (String msg : messages) {
            if (msg.startsWith("Revert") || msg.startsWith("Merge")) continue;

            Matcher m = SUBJECT_PREFIX.matcher(msg);
            if (m.find()) {
                Arrays.stream(m.group(1).split(","))
                        .map(String::trim)
                        .map(CommitLabels::labelFor)
                        .flatMap(Optional::stream)
                        .forEach(audit.labels::add);
            } else {
                audit.badMessage = true;
            }

            if (!msg.contains(SIGNOFF)) {
                audit.missingSignoff = true;
            }
        }
        return audit;
    }

    static Optional<String> review(Audit audit) {
        if (!audit.badMessage && !audit.missingSignoff) return Optional.empty();

        StringBuilder body = new StringBuilder(Texts.PR_GREETING);
        if (audit.badMessage) body.append(Texts.PR_WARN_COMMIT_MSG);
        if (audit.missingSignoff) body.append(Texts.PR_WARN_SIGNOFF);
        body.append(Texts.PR_GUIDELINES_REF);
        return Optional.of(body.toString());
    }

    static final class Audit {
        boolean badMessage;
        boolean missingSignoff;
        final Set<String> labels = new TreeSet<>();
    }
}
