package io.resumable.http;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.resumable.checkpoint.Checkpoint;
import io.resumable.config.EngineConfig;
import io.resumable.core.FailurePolicy;
import io.resumable.core.JobDefinition;
import io.resumable.core.JobOptions;
import io.resumable.core.RunResult;
import io.resumable.core.RunStatus;
import io.resumable.inject.EngineModule;
import io.resumable.metrics.Metrics;
import io.resumable.quota.SimpleQuotaTracker;
import io.resumable.quota.WindowBoundary;
import io.resumable.scheduler.BatchScheduler;
import io.resumable.trigger.ScheduledResumptionTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * CLI that replays the lines of a file as HTTP POSTs, a bounded slice per invocation.
 */
@CommandLine.Command(name = "http-batch", mixinStandardHelpOptions = true, description = "POST each line of a file to a URL, resumably")
public final class HttpBatchMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(HttpBatchMain.class);

    static final String QUOTA_BUDGET = "http";
    static final int EXIT_FAILED = 1;
    static final int EXIT_SKIPPED = 3;

    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "File whose non-blank lines are the work items")
    Path input;

    @CommandLine.Option(names = {"-u", "--url"}, required = true, description = "Target URL for the POSTs")
    URI url;

    @CommandLine.Option(names = {"-j", "--job-id"}, description = "Job id; defaults to the input file name")
    String jobId;

    @CommandLine.Option(names = {"-s", "--state-dir"}, description = "Directory for checkpoints and dead letters", defaultValue = "state")
    Path stateDir;

    @CommandLine.Option(names = {"-b", "--time-budget"}, description = "Wall-clock budget per invocation (ISO-8601)", defaultValue = "PT6M")
    Duration timeBudget;

    @CommandLine.Option(names = {"-q", "--quota"}, description = "Calls allowed per quota window; 0 for unlimited", defaultValue = "0")
    long quota;

    @CommandLine.Option(names = {"--quota-reset"}, description = "Local time the quota resets (HH:mm)", defaultValue = "00:00")
    LocalTime quotaReset;

    @CommandLine.Option(names = {"--quota-zone"}, description = "Zone of the quota reset time", defaultValue = "UTC")
    ZoneId quotaZone;

    @CommandLine.Option(names = {"--on-failure"}, description = "SKIP_AND_CONTINUE or ABORT_JOB", defaultValue = "SKIP_AND_CONTINUE")
    FailurePolicy onFailure;

    @CommandLine.Option(names = {"-r", "--max-retries"}, description = "Retries per line for retryable errors", defaultValue = "3")
    int maxRetries;

    @CommandLine.Option(names = {"--request-timeout"}, description = "Timeout of a single POST (ISO-8601)", defaultValue = "PT10S")
    Duration requestTimeout;

    @CommandLine.Option(names = {"-f", "--follow"}, description = "Stay up and keep resuming until the job finishes")
    boolean follow;

    @CommandLine.Option(names = {"--restart"}, description = "Discard any saved progress and start the job from the first line")
    boolean restart;

    public static void main(String[] args) {
        int code = new CommandLine(new HttpBatchMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        if (maxRetries < 0 || quota < 0) {
            System.err.println("--max-retries and --quota must be >= 0");
            return CommandLine.ExitCode.USAGE;
        }
        String id = jobId != null ? jobId : input.getFileName().toString();

        EngineConfig defaults = EngineConfig.fromEnv();
        EngineConfig config = new EngineConfig(EngineConfig.STORE_FILE, stateDir, defaults.jdbcUrl(), defaults.maxCheckpointBytes(),
                maxRetries, defaults.backoffBaseMillis(), defaults.backoffMaxMillis(), defaults.breakerFailureThreshold(),
                defaults.breakerSuccessThreshold(), defaults.breakerCooldown(), defaults.lockWait());
        Injector injector = Guice.createInjector(new EngineModule(config));
        BatchScheduler scheduler = injector.getInstance(BatchScheduler.class);
        ScheduledResumptionTrigger trigger = injector.getInstance(ScheduledResumptionTrigger.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        JobOptions options = JobOptions.defaults()
                .withDependency(url.getHost() == null ? url.toString() : url.getHost())
                .withFailurePolicy(onFailure)
                .withTimeBudget(timeBudget, 0.2);
        if (quota > 0) {
            injector.getInstance(SimpleQuotaTracker.class)
                    .register(QUOTA_BUDGET, quota, WindowBoundary.dailyAt(quotaReset, quotaZone));
            options = options.withQuota(QUOTA_BUDGET, 1);
        }
        JobDefinition<String> job = new JobDefinition<>(id, new LineFileSource(input),
                new HttpPostWorkItem(url, id, requestTimeout), options);

        try {
            if (restart && scheduler.restart(id)) {
                System.out.println("Discarded saved progress of job " + id);
            }
            RunResult result;
            if (follow) {
                BlockingQueue<RunResult> resumed = new LinkedBlockingQueue<>();
                trigger.launchWith(j -> resumed.put(scheduler.resume(j)));
                result = scheduler.run(job);
                while (result.status() == RunStatus.PAUSED) {
                    print(result);
                    result = resumed.take();
                }
            } else {
                result = scheduler.run(job);
            }
            print(result);
            printMetrics(registry);
            return exitCode(result);
        } finally {
            trigger.close();
        }
    }

    static int exitCode(RunResult result) {
        return switch (result.status()) {
            case COMPLETED, PAUSED -> CommandLine.ExitCode.OK;
            case FAILED -> EXIT_FAILED;
            case SKIPPED -> EXIT_SKIPPED;
        };
    }

    private static void print(RunResult r) {
        log.info("Run of {} ended {} ({})", r.jobId(), r.status(), r.reason());
        StringBuilder sb = new StringBuilder()
                .append(r.jobId()).append(": ").append(r.status())
                .append(" reason=").append(r.reason())
                .append(" itemsThisRun=").append(r.itemsThisRun());
        if (r.resumeAfter() != null) sb.append(" resumeAfter=").append(r.resumeAfter());
        if (r.checkpoint() != null) {
            sb.append(" offset=").append(r.checkpoint().lastCompletedOffset())
                    .append(" processed=").append(r.counter(Checkpoint.PROCESSED))
                    .append(" failed=").append(r.counter(Checkpoint.FAILED))
                    .append(" retries=").append(r.counter(Checkpoint.RETRIES))
                    .append(" runs=").append(r.counter(Checkpoint.RUNS));
        }
        System.out.println(sb);
    }

    private static void printMetrics(MetricRegistry r) {
        System.out.println("metrics:"
                + " processed=" + r.meter(Metrics.ITEMS_PROCESSED).getCount()
                + " failed=" + r.meter(Metrics.ITEMS_FAILED).getCount()
                + " retries=" + r.counter(Metrics.RETRIES).getCount()
                + " item.p50(ms)=" + String.format("%.3f", r.timer(Metrics.ITEM_TIME).getSnapshot().getMedian() / 1_000_000.0));
    }
}
