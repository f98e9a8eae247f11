package com.polychaeta.bot.model;

import java.util.Objects;

/**
 * An issue (or pull request) addressed by repository full name and number.
 */
public final class IssueRef {
    public final String repoFullName;
    public final int number;

    public IssueRef(String repoFullName, int number) {
        this.repoFullName = Objects.requireNonNull(repoFullName, "repoFullName");
        this.number = number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IssueRef)) return false;
        IssueRef other = (IssueRef) o;
        return number == other.number && repoFullName.equals(other.repoFullName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repoFullName, number);
    }

    @Override
    public String toString() {
        return repoFullName + "#" + number;
    }
}
