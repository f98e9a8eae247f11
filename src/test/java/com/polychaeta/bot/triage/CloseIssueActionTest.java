package com.polychaeta.bot.triage;

import com.polychaeta.bot.github.GitHubPlatform;
import com.polychaeta.bot.github.LabelRemoval;
import com.polychaeta.bot.model.IssueRef;
import com.polychaeta.bot.model.JobAction;
import com.polychaeta.bot.model.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CloseIssueAction Tests")
class CloseIssueActionTest {

    private static final IssueRef ISSUE = new IssueRef("acme/repo", 42);

    @Mock
    private GitHubPlatform github;

    private CloseIssueAction action;

    @BeforeEach
    void setUp() {
        action = new CloseIssueAction(github, "autoclose");
    }

    @Test
    @DisplayName("Should close the issue and then remove the trigger label")
    void shouldCloseThenRemoveLabel() throws Exception {
        when(github.removeLabel(ISSUE, "autoclose")).thenReturn(LabelRemoval.REMOVED);

        assertThat(action.closeIssue(ISSUE)).isTrue();

        InOrder order = inOrder(github);
        order.verify(github).closeIssue(ISSUE);
        order.verify(github).removeLabel(ISSUE, "autoclose");
    }

    @Test
    @DisplayName("Should treat an already absent label as success")
    void shouldTolerateAbsentLabel() throws Exception {
        when(github.removeLabel(ISSUE, "autoclose")).thenReturn(LabelRemoval.ALREADY_ABSENT);

        assertThat(action.closeIssue(ISSUE)).isTrue();
    }

    @Test
    @DisplayName("Should not let a failed label removal undo the close")
    void shouldIgnoreLabelFailure() throws Exception {
        when(github.removeLabel(ISSUE, "autoclose")).thenReturn(LabelRemoval.FAILED);

        assertThat(action.closeIssue(ISSUE)).isTrue();
        verify(github).closeIssue(ISSUE);
    }

    @Test
    @DisplayName("Should swallow a close failure and skip label removal")
    void shouldSwallowCloseFailure() throws Exception {
        doThrow(new IOException("502 Bad Gateway")).when(github).closeIssue(ISSUE);

        assertThat(action.closeIssue(ISSUE)).isFalse();
        verify(github, never()).removeLabel(any(), anyString());
    }

    @Test
    @DisplayName("Should close the issue named by the job arguments")
    void shouldHandleJob() throws Exception {
        when(github.removeLabel(ISSUE, "autoclose")).thenReturn(LabelRemoval.REMOVED);

        action.handle(ScheduledJob.closeIssue(ISSUE, Instant.now()));

        verify(github).closeIssue(ISSUE);
    }

    @Test
    @DisplayName("Should fall back to the job id when the arguments are unusable")
    void shouldFallBackToJobId() {
        ScheduledJob job = new ScheduledJob("acme/repo@@@42", Instant.now(), JobAction.CLOSE_ISSUE, List.of());

        assertThat(CloseIssueAction.issueOf(job)).isEqualTo(ISSUE);
    }
}
