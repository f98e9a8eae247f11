package com.polychaeta.bot.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polychaeta.bot.model.IssueRef;
import org.kohsuke.github.GHEventPayload;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHIssue;
import org.kohsuke.github.GHIssueComment;
import org.kohsuke.github.GHIssueState;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHPullRequestCommitDetail;
import org.kohsuke.github.GHPullRequestReviewEvent;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.ReactionContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@link GitHubPlatform} backed by the {@code org.kohsuke:github-api} client.
 */
public final class GitHubApiPlatform implements GitHubPlatform {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiPlatform.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final GitHub gitHub;
    private final String myLogin;

    public GitHubApiPlatform(GitHub gitHub, String myLogin) {
        this.gitHub = gitHub;
        this.myLogin = myLogin;
    }

    /**
     * Authenticates with the token and resolves the bot's own login.
     */
    public static GitHubApiPlatform connect(String token) throws IOException {
        GitHub gitHub = new GitHubBuilder().withOAuthToken(token).build();
        String login = gitHub.getMyself().getLogin();
        log.info("Authenticated to GitHub as {}", login);
        return new GitHubApiPlatform(gitHub, login);
    }

    @Override
    public String myLogin() {
        return myLogin;
    }

    @Override
    public void closeIssue(IssueRef issue) throws IOException {
        GHIssue ghIssue = issue(issue);
        if (ghIssue.getState() == GHIssueState.CLOSED) {
            log.debug("{} is already closed", issue);
            return;
        }
        ghIssue.close();
    }

    @Override
    public void addLabel(IssueRef issue, String label) throws IOException {
        issue(issue).addLabels(label);
    }

    @Override
    public LabelRemoval removeLabel(IssueRef issue, String label) {
        try {
            issue(issue).removeLabel(label);
            return LabelRemoval.REMOVED;
        } catch (GHFileNotFoundException e) {
            return LabelRemoval.ALREADY_ABSENT;
        } catch (IOException e) {
            log.debug("Removing label '{}' from {} failed: {}", label, issue, e.getMessage());
            return LabelRemoval.FAILED;
        }
    }

    @Override
    public void createComment(IssueRef issue, String body) throws IOException {
        issue(issue).comment(body);
    }

    @Override
    public void reactPlusOne(IssueRef issue, long commentId) throws IOException {
        comment(issue, commentId).createReaction(ReactionContent.PLUS_ONE);
    }

    @Override
    public List<String> listCommitMessages(IssueRef pullRequest) throws IOException {
        List<String> messages = new ArrayList<>();
        for (GHPullRequestCommitDetail detail : pull(pullRequest).listCommits()) {
            messages.add(detail.getCommit().getMessage());
        }
        return messages;
    }

    @Override
    public void createReview(IssueRef pullRequest, String body, ReviewEvent event) throws IOException {
        pull(pullRequest).createReview()
                .body(body)
                .event(GHPullRequestReviewEvent.valueOf(event.name()))
                .create();
    }

    @Override
    public void setLabels(IssueRef pullRequest, Collection<String> labels) throws IOException {
        pull(pullRequest).setLabels(labels.toArray(new String[0]));
    }

    @Override
    public Permission permissionOf(String repoFullName, String login) throws IOException {
        return Permission.fromApi(repo(repoFullName).getPermission(login).name());
    }

    private GHRepository repo(String repoFullName) throws IOException {
        return gitHub.getRepository(repoFullName);
    }

    private GHIssue issue(IssueRef issue) throws IOException {
        return repo(issue.repoFullName).getIssue(issue.number);
    }

    /**
     * Binds a comment handle by id through the webhook payload binder, without a request.
     */
    private GHIssueComment comment(IssueRef issue, long commentId) throws IOException {
        int slash = issue.repoFullName.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Not an owner/name repository: " + issue.repoFullName);
        }
        ObjectNode payload = JSON.createObjectNode();
        payload.putObject("comment").put("id", commentId);
        payload.putObject("issue").put("number", issue.number);
        ObjectNode repository = payload.putObject("repository");
        repository.put("full_name", issue.repoFullName);
        repository.put("name", issue.repoFullName.substring(slash + 1));
        repository.putObject("owner").put("login", issue.repoFullName.substring(0, slash));

        return gitHub.parseEventPayload(new StringReader(payload.toString()), GHEventPayload.IssueComment.class)
                .getComment();
    }

    private GHPullRequest pull(IssueRef pullRequest) throws IOException {
        return repo(pullRequest.repoFullName).getPullRequest(pullRequest.number);
    }
}
