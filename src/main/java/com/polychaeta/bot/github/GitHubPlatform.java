package com.polychaeta.bot.github;

import com.polychaeta.bot.model.IssueRef;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * The code-hosting operations the bot performs. Pull requests are addressed as issues.
 */
public interface GitHubPlatform {

    /** Login of the account the bot acts as. */
    String myLogin();

    void closeIssue(IssueRef issue) throws IOException;

    void addLabel(IssueRef issue, String label) throws IOException;

    /** Never throws; failures are reported through the result. */
    LabelRemoval removeLabel(IssueRef issue, String label);

    void createComment(IssueRef issue, String body) throws IOException;

    /** Adds a {@code +1} reaction to a comment on the given issue. */
    void reactPlusOne(IssueRef issue, long commentId) throws IOException;

    List<String> listCommitMessages(IssueRef pullRequest) throws IOException;

    void createReview(IssueRef pullRequest, String body, ReviewEvent event) throws IOException;

    void setLabels(IssueRef pullRequest, Collection<String> labels) throws IOException;

    Permission permissionOf(String repoFullName, String login) throws IOException;
}
