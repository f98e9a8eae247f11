package com.polychaeta.bot.model;

/**
 * Job ids of the form {@code <repo full name>@@@<issue number>}.
 *
 * The same issue always maps to the same id, so the label-applied and the
 * comment-created paths address one record.
 */
public final class JobId {
    public static final String SEPARATOR = "@@@";

    private JobId() {
    }

    public static String make(String repoFullName, int issueNumber) {
        if (repoFullName == null || repoFullName.isBlank()) {
            throw new IllegalArgumentException("Repository name must not be blank");
        }
        if (repoFullName.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Repository name must not contain " + SEPARATOR + ": " + repoFullName);
        }
        if (issueNumber <= 0) {
            throw new IllegalArgumentException("Issue number must be positive: " + issueNumber);
        }
        return repoFullName + SEPARATOR + issueNumber;
    }

    public static String make(IssueRef issue) {
        return make(issue.repoFullName, issue.number);
    }

    public static IssueRef parse(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Job id must not be null");
        }
        int sep = id.lastIndexOf(SEPARATOR);
        if (sep <= 0 || sep + SEPARATOR.length() == id.length()) {
            throw new IllegalArgumentException("Malformed job id: " + id);
        }
        String repo = id.substring(0, sep);
        String tail = id.substring(sep + SEPARATOR.length());
        int number;
        try {
            number = Integer.parseInt(tail);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed job id: " + id, e);
        }
        if (number <= 0 || repo.contains(SEPARATOR) || !tail.equals(String.valueOf(number))) {
            throw new IllegalArgumentException("Malformed job id: " + id);
        }
        return new IssueRef(repo, number);
    }
}
