package com.polychaeta.bot.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polychaeta.bot.db.JobStoreException;
import com.polychaeta.bot.triage.AutoCloseHandler;
import com.polychaeta.bot.triage.CommitAuditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Validates a webhook delivery and routes it to the matching handler.
 *
 * <p>Bad or missing signature: 401. Missing event header, non-JSON body or a
 * recognized event missing required fields: 400. Unknown events and actions,
 * and deliveries sent by the bot itself: 200, ignored. Handler failures: 500.
 */
public final class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    public static final String EVENT_HEADER = "X-GitHub-Event";

    private final WebhookSignature signature;
    private final ObjectMapper mapper;
    private final AutoCloseHandler autoClose;
    private final CommitAuditor commitAuditor;
    private final String myLogin;

    public WebhookController(WebhookSignature signature,
                             ObjectMapper mapper,
                             AutoCloseHandler autoClose,
                             CommitAuditor commitAuditor,
                             String myLogin) {
        this.signature = signature;
        this.mapper = mapper;
        this.autoClose = autoClose;
        this.commitAuditor = commitAuditor;
        this.myLogin = myLogin;
    }

    /**
     * @param headers case-insensitive header lookup, null when absent
     */
    public WebhookResponse handle(String method, Function<String, String> headers, byte[] body) {
        if (!signature.isValid(body, headers.apply(WebhookSignature.SHA256_HEADER),
                headers.apply(WebhookSignature.SHA1_HEADER))) {
            log.warn("Rejecting {} with missing or invalid signature", method);
            return WebhookResponse.unauthorized();
        }

        if (!"POST".equalsIgnoreCase(method)) {
            return WebhookResponse.ok();
        }

        String event = headers.apply(EVENT_HEADER);
        if (event == null || event.isBlank()) {
            log.warn("No {} header", EVENT_HEADER);
            return WebhookResponse.badRequest("No X-GitHub-Event header");
        }

        log.info("Handling webhook '{}'", event);

        if (!WebhookRoute.isKnownEvent(event)) {
            log.info("Unknown event '{}'", event);
            return WebhookResponse.ok();
        }

        JsonNode payload;
        try {
            payload = mapper.readTree(body);
        } catch (IOException e) {
            log.warn("Could not parse payload as JSON: {}", e.getMessage());
            return WebhookResponse.badRequest("Bad JSON");
        }
        if (payload == null || !payload.isObject()) {
            log.warn("Payload is not a JSON object");
            return WebhookResponse.badRequest("Bad JSON");
        }

        Optional<String> action = Payloads.text(payload, "action");
        if (action.isEmpty()) {
            log.info("No action for event '{}'", event);
            return WebhookResponse.ok();
        }

        Optional<WebhookRoute> route = WebhookRoute.of(event, action.get());
        if (route.isEmpty()) {
            log.info("No handler for action '{}' on event '{}'", action.get(), event);
            return WebhookResponse.ok();
        }

        Optional<String> sender = Payloads.text(payload, "sender", "login");
        if (sender.isPresent() && sender.get().equals(myLogin)) {
            log.info("Ignoring event triggered by me");
            return WebhookResponse.ok();
        }

        log.info("Handling action '{}' on event '{}'", action.get(), event);
        try {
            dispatch(route.get(), payload);
            return WebhookResponse.ok();
        } catch (MalformedPayloadException e) {
            log.warn("Malformed '{}' payload: {}", event, e.getMessage());
            return WebhookResponse.badRequest(e.getMessage());
        } catch (JobStoreException e) {
            log.error("Job store unavailable while handling '{}'/'{}'", event, action.get(), e);
            return WebhookResponse.serverError();
        } catch (IOException e) {
            log.error("GitHub API call failed while handling '{}'/'{}': {}", event, action.get(), e.getMessage(), e);
            return WebhookResponse.serverError();
        } catch (RuntimeException e) {
            log.error("Handler for '{}'/'{}' failed", event, action.get(), e);
            return WebhookResponse.serverError();
        }
    }

    private void dispatch(WebhookRoute route, JsonNode payload) throws MalformedPayloadException, IOException {
        switch (route) {
            case ISSUES_LABELED -> autoClose.onIssueLabeled(
                    Payloads.issue(payload),
                    Payloads.requireText(payload, "label", "name"));
            case ISSUE_COMMENT_CREATED -> autoClose.onCommentCreated(
                    Payloads.issue(payload),
                    Payloads.requireLong(payload, "comment", "id"),
                    Payloads.requireText(payload, "comment", "body"),
                    Payloads.requireText(payload, "sender", "login"));
            case PULL_REQUEST_OPENED -> commitAuditor.onPullRequestOpened(Payloads.pullRequest(payload));
        }
    }
}
