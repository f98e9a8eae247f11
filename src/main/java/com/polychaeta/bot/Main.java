package com.polychaeta.bot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polychaeta.bot.config.BotConfig;
import com.polychaeta.bot.db.Database;
import com.polychaeta.bot.db.JobDao;
import com.polychaeta.bot.github.GitHubApiPlatform;
import com.polychaeta.bot.scheduler.JobScheduler;
import com.polychaeta.bot.triage.AutoCloseHandler;
import com.polychaeta.bot.triage.CloseIssueAction;
import com.polychaeta.bot.triage.CommitAuditor;
import com.polychaeta.bot.triage.SnoozeDateParser;
import com.polychaeta.bot.webhook.WebhookController;
import com.polychaeta.bot.webhook.WebhookServer;
import com.polychaeta.bot.webhook.WebhookSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class Main {

    public static void main(String[] args) throws Exception {
        BotConfig config = BotConfig.fromEnv();

        // must precede the first getLogger call
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", config.simpleLoggerLevel());
        Logger log = LoggerFactory.getLogger(Main.class);

        ObjectMapper mapper = new ObjectMapper();

        Database db = new Database(config.dbPath);
        db.initSchema();
        JobDao jobDao = new JobDao(db, mapper);

        GitHubApiPlatform github = GitHubApiPlatform.connect(config.githubToken);
        Clock clock = Clock.systemUTC();

        JobScheduler scheduler = new JobScheduler(jobDao, new CloseIssueAction(github, config.triggerLabel), clock);
        // restore persisted jobs before any webhook can touch them
        scheduler.start();

        AutoCloseHandler autoClose = new AutoCloseHandler(
                scheduler, github, new SnoozeDateParser(), config.triggerLabel, config.autocloseDays, clock);
        WebhookController controller = new WebhookController(
                new WebhookSignature(config.webhookSecret), mapper, autoClose, new CommitAuditor(github), github.myLogin());
        WebhookServer server = new WebhookServer(controller, config.webhookPath);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown...");
            server.stop();
            scheduler.stop();
        }));

        server.start(config.httpPort);

        log.info("Bot started as @{}", github.myLogin());
    }
}
